package com.kuzur.script.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.kuzur.debug.Debug;
import com.kuzur.script.errors.ParseError;
import com.kuzur.script.parser.Expr.Assign;
import com.kuzur.script.parser.Expr.Binary;
import com.kuzur.script.parser.Expr.Call;
import com.kuzur.script.parser.Expr.Literal;
import com.kuzur.script.parser.Expr.Logical;
import com.kuzur.script.parser.Expr.Unary;
import com.kuzur.script.parser.Expr.Variable;
import com.kuzur.script.parser.Statement.Block;
import com.kuzur.script.parser.Statement.Branch;
import com.kuzur.script.parser.Statement.ExprStmt;
import com.kuzur.script.parser.Statement.FunctionStmt;
import com.kuzur.script.parser.Statement.Stmt;
import com.kuzur.script.parser.Statement.VarAssign;
import com.kuzur.script.parser.Statement.While;

/**
 * Recursive-descent parser with one method per precedence level.
 *
 * Kuzur has no statement terminator. An infix operator, an assignment
 * {@code =} or the {@code (} of a call only continues an expression when it
 * sits on the same line as the token before it, so
 * <pre>
 *   x = a
 *   -1
 * </pre>
 * is two statements. A {@code ;} between statements is allowed and ignored.
 */
public class Parser {
    private static final String TAG = "Parser";
    private static final int MAX_NESTING = 256;

    private final List<Token> tokens;
    private int current = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(statement());
            skipSeparators();
        }
        Debug.get().d(TAG, "parsed " + statements.size() + " top-level statement(s)");
        return statements;
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.DO)) return doWhileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.FUNC)) return functionDeclaration();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return new Statement.BreakStmt(previous());
        if (match(TokenType.CONTINUE)) return new Statement.ContinueStmt(previous());
        if (check(TokenType.LEFT_BRACE)) return block("block");
        return exprOrAssignStatement();
    }

    private Stmt exprOrAssignStatement() {
        if (check(TokenType.IDENTIFIER) && peekNext().type() == TokenType.EQUAL
                && peekNext().line == peek().line) {
            Token name = advance();
            advance(); // '='
            return new VarAssign(name, expression());
        }
        return new ExprStmt(expression());
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "function name after 'func'");
        consume(TokenType.LEFT_PAREN, "'(' after function name");

        List<Token> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token param = consume(TokenType.IDENTIFIER, "parameter name");
                if (!seen.add(param.lexeme)) {
                    throw new ParseError(param.line, param.column,
                            "a parameter name not already used in '" + name.lexeme + "'",
                            "duplicate " + param.describe());
                }
                params.add(param);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after parameters");

        Block body = block("function body");
        return new FunctionStmt(name, params, body);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        // a value must start on the same line as 'return'
        if (!isAtEnd() && !check(TokenType.RIGHT_BRACE) && !check(TokenType.SEMICOLON)
                && peek().line == keyword.line) {
            value = expression();
        }
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        Branch thenBranch = branch(previous());

        List<Branch> elifs = new ArrayList<>();
        Block elseBranch = null;
        while (true) {
            if (match(TokenType.ELIF)) {
                elifs.add(branch(previous()));
            } else if (check(TokenType.ELSE) && peekNext().type() == TokenType.IF) {
                advance(); // 'else'
                elifs.add(branch(advance()));
            } else if (match(TokenType.ELSE)) {
                elseBranch = block("else body");
                break;
            } else {
                break;
            }
        }
        return new Statement.If(thenBranch, elifs, elseBranch);
    }

    // '(' condition ')' block, after the keyword has been consumed
    private Branch branch(Token keyword) {
        Expr.ExprInterface condition = parenthesizedCondition(keyword);
        Block body = block("'" + keyword.lexeme + "' body");
        return new Branch(keyword, condition, body);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = parenthesizedCondition(keyword);
        Block body = block("while body");
        return new While(keyword, condition, body);
    }

    private Stmt doWhileStatement() {
        Block body = block("do body");
        Token whileKeyword = consume(TokenType.WHILE, "'while' after do body");
        Expr.ExprInterface condition = parenthesizedCondition(whileKeyword);
        return new Statement.DoWhile(body, whileKeyword, condition);
    }

    // for i = start; end { ... }   or   for (i = start; end) { ... }
    private Stmt forStatement() {
        boolean parenthesized = match(TokenType.LEFT_PAREN);

        Token variable = consume(TokenType.IDENTIFIER, "loop variable after 'for'");
        consume(TokenType.EQUAL, "'=' after loop variable");
        Expr.ExprInterface start = expression();
        consume(TokenType.SEMICOLON, "';' after loop start value");
        Expr.ExprInterface end = expression();
        if (parenthesized) consume(TokenType.RIGHT_PAREN, "')' after loop bounds");

        Block body = block("for body");
        return new Statement.For(variable, start, end, body);
    }

    private Expr.ExprInterface parenthesizedCondition(Token keyword) {
        consume(TokenType.LEFT_PAREN, "'(' after '" + keyword.lexeme + "'");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "')' after " + keyword.lexeme + " condition");
        return condition;
    }

    private Block block(String what) {
        consume(TokenType.LEFT_BRACE, "'{' to open " + what);
        enterNested();
        try {
            List<Stmt> statements = new ArrayList<Stmt>();
            skipSeparators();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                statements.add(statement());
                skipSeparators();
            }
            consume(TokenType.RIGHT_BRACE, "'}' to close " + what);
            return new Block(statements);
        } finally {
            nesting--;
        }
    }

    private Expr.ExprInterface expression() {
        enterNested();
        try {
            return assignment();
        } finally {
            nesting--;
        }
    }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();
        if (matchInfix(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = expression();
            if (expr instanceof Variable) {
                return new Assign(((Variable) expr).name, value);
            }
            throw new ParseError(equals.line, equals.column, "a variable name before '='", "an expression");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (matchInfix(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (matchInfix(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (matchInfix(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (matchInfix(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (matchInfix(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (matchInfix(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            enterNested();
            try {
                return new Unary(op, unary());
            } finally {
                nesting--;
            }
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (matchInfix(TokenType.LEFT_PAREN)) return finishCall(name);
            return new Variable(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "')' after expression");
            return expr;
        }

        throw error(peek(), "an expression");
    }

    private Expr.ExprInterface finishCall(Token callee) {
        Token paren = previous();
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after arguments");
        return new Call(callee, paren, arguments);
    }

    // recursion depth guard, so pathological input fails with a ParseError
    private void enterNested() {
        if (++nesting > MAX_NESTING) {
            Token token = peek();
            throw new ParseError(token.line, token.column,
                    "at most " + MAX_NESTING + " levels of nesting", token.describe());
        }
    }

    private void skipSeparators() {
        while (match(TokenType.SEMICOLON)) {
            // empty statement
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /** Like match, but only when the token continues the previous token's line. */
    private boolean matchInfix(TokenType... types) {
        if (current > 0 && peek().line != previous().line) return false;
        return match(types);
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type() == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekNext() {
        return (current + 1 < tokens.size()) ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String expected) {
        return new ParseError(token.line, token.column, expected, token.describe());
    }
}
