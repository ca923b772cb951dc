package com.kuzur.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.kuzur.debug.Debug;
import com.kuzur.script.errors.ControlFlowError;
import com.kuzur.script.errors.KuzurError;
import com.kuzur.script.errors.NameError;
import com.kuzur.script.errors.RecursionError;
import com.kuzur.script.errors.TypeError;
import com.kuzur.script.errors.ValueError;
import com.kuzur.script.parser.Expr.Assign;
import com.kuzur.script.parser.Expr.Binary;
import com.kuzur.script.parser.Expr.Call;
import com.kuzur.script.parser.Expr.ExprVisitor;
import com.kuzur.script.parser.Expr.Literal;
import com.kuzur.script.parser.Expr.Logical;
import com.kuzur.script.parser.Expr.Unary;
import com.kuzur.script.parser.Expr.Variable;
import com.kuzur.script.parser.Statement.Block;
import com.kuzur.script.parser.Statement.BreakStmt;
import com.kuzur.script.parser.Statement.Branch;
import com.kuzur.script.parser.Statement.ContinueStmt;
import com.kuzur.script.parser.Statement.DoWhile;
import com.kuzur.script.parser.Statement.ExprStmt;
import com.kuzur.script.parser.Statement.For;
import com.kuzur.script.parser.Statement.FunctionStmt;
import com.kuzur.script.parser.Statement.If;
import com.kuzur.script.parser.Statement.ReturnStmt;
import com.kuzur.script.parser.Statement.Stmt;
import com.kuzur.script.parser.Statement.StmtVisitor;
import com.kuzur.script.parser.Statement.VarAssign;
import com.kuzur.script.parser.Statement.While;

/**
 * Tree-walking evaluator.
 *
 * Statements return normally or unwind with one of the control signals
 * ({@link ReturnSignal}, {@link BreakSignal}, {@link ContinueSignal}). Loops
 * catch break/continue, {@link UserFunction#call} catches return. A signal
 * that escapes the construct able to handle it becomes a
 * {@link ControlFlowError}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    Environment env;
    private final Environment globals;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;

    public Interpreter(Environment globals, int maxDepth) {
        this.globals = globals;
        this.env = globals;
        this.maxDepth = maxDepth;
    }

    /** Runs a whole program against the global environment. */
    public void execute(List<Stmt> program) {
        try {
            for (Stmt stmt : program) stmt.accept(this);
        } catch (ReturnSignal rs) {
            throw new ControlFlowError("'return' outside function").at(rs.keyword.line, rs.keyword.column);
        } catch (BreakSignal bs) {
            throw new ControlFlowError("'break' outside loop").at(bs.keyword.line, bs.keyword.column);
        } catch (ContinueSignal cs) {
            throw new ControlFlowError("'continue' outside loop").at(cs.keyword.line, cs.keyword.column);
        }
    }

    /** Calls a global function from host code, after {@link #execute} has run the program. */
    public Value invokeForHost(String name, List<Value> args) {
        if (!globals.exists(name)) throw new NameError("Undefined function '%s'", name);
        Value target = globals.get(name);
        if (target.getType() != Value.Type.FUNC) {
            throw new TypeError("'%s' is not a function (it is a %s)", name, target.typeName());
        }
        callStack.push(new CallFrame(name, args));
        try {
            return target.asFunc().call(this, args);
        } finally {
            callStack.pop();
        }
    }

    /** Runs a block in the current frame; blocks do not open a scope. */
    void executeBlock(Block block) {
        for (Stmt s : block.statements) s.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    @Override
    public void visitVarAssignStmt(VarAssign stmt) {
        Value value = eval(stmt.initializer);
        env.assign(stmt.name.lexeme, value);
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt);
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (condition(stmt.thenBranch.condition, stmt.thenBranch.keyword)) {
            executeBlock(stmt.thenBranch.body);
            return;
        }
        for (Branch elif : stmt.elifBranches) {
            if (condition(elif.condition, elif.keyword)) {
                executeBlock(elif.body);
                return;
            }
        }
        if (stmt.elseBranch != null) executeBlock(stmt.elseBranch);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        while (condition(stmt.condition, stmt.keyword)) {
            try {
                executeBlock(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // next condition check
            }
        }
    }

    @Override
    public void visitDoWhileStmt(DoWhile stmt) {
        do {
            try {
                executeBlock(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // next condition check
            }
        } while (condition(stmt.condition, stmt.whileKeyword));
    }

    @Override
    public void visitForStmt(For stmt) {
        Token var = stmt.variable;
        Value start = eval(stmt.start);
        requireNumber(start, var, "for loop start");
        env.assign(var.lexeme, start);

        while (true) {
            // the bound is re-evaluated before every iteration
            Value end = eval(stmt.end);
            requireNumber(end, var, "for loop end");
            Value i = loopVariable(var);
            if (!(i.asNumber() <= end.asNumber())) break;

            try {
                executeBlock(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // fall through to the increment
            }

            env.assign(var.lexeme, Value.number(loopVariable(var).asNumber() + 1));
        }
    }

    private Value loopVariable(Token var) {
        if (!env.exists(var.lexeme)) {
            throw new NameError("Undefined variable '%s'", var.lexeme).at(var.line, var.column);
        }
        Value v = env.get(var.lexeme);
        requireNumber(v, var, "for loop variable");
        return v;
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        if (env.existsInCurrentScope(name)) {
            Debug.get().d(TAG, "redefining '" + name + "' at line " + stmt.name.line);
        }
        env.define(name, Value.func(new UserFunction(name, stmt.params, stmt.body, env)));
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.keyword, stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal(stmt.keyword);
    }

    @Override
    public void visitContinueStmt(ContinueStmt stmt) {
        throw new ContinueSignal(stmt.keyword);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type()) {
            case PLUS: {
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (isConcatenable(left, right) || isConcatenable(right, left)) {
                    return Value.string(left.display() + right.display());
                }
                throw operandError(op, left, right);
            }
            case MINUS:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT: {
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                double a = left.asNumber();
                double b = right.asNumber();
                // floored modulo: the result takes the sign of the divisor
                return Value.number(a - b * Math.floor(a / b));
            }

            case GREATER:
                return Value.bool(compare(left, right, op) > 0);
            case GREATER_EQUAL:
                return Value.bool(compare(left, right, op) >= 0);
            case LESS:
                return Value.bool(compare(left, right, op) < 0);
            case LESS_EQUAL:
                return Value.bool(compare(left, right, op) <= 0);

            case EQUAL_EQUAL:
                return Value.bool(isEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!isEqual(left, right));

            default:
                throw new TypeError("Unsupported binary operator '%s'", op.lexeme).at(op.line, op.column);
        }
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        Token op = expr.operator;
        switch (op.type()) {
            case BANG:
                if (right.getType() != Value.Type.BOOL) {
                    throw new TypeError("Operator '!' expects bool, got %s", right.typeName()).at(op.line, op.column);
                }
                return Value.bool(!right.asBool());
            case MINUS:
                requireNumber(right, op, "operand of unary '-'");
                return Value.number(-right.asNumber());
            case PLUS:
                requireNumber(right, op, "operand of unary '+'");
                return right;
            default:
                throw new TypeError("Unsupported unary operator '%s'", op.lexeme).at(op.line, op.column);
        }
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        if (!env.exists(name)) {
            throw new NameError("Undefined variable '%s'", name).at(expr.name.line, expr.name.column);
        }
        return env.get(name);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Token op = expr.operator;
        boolean left = logicalOperand(eval(expr.left), op);
        if (op.type() == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(logicalOperand(eval(expr.right), op));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Token callee = expr.callee;
        String name = callee.lexeme;

        if (!env.exists(name)) {
            throw new NameError("Undefined function '%s'", name).at(callee.line, callee.column);
        }
        Value target = env.get(name);
        if (target.getType() != Value.Type.FUNC) {
            throw new TypeError("'%s' is not a function (it is a %s)", name, target.typeName())
                    .at(callee.line, callee.column);
        }

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        if (callStack.size() >= maxDepth) {
            throw new RecursionError("Maximum call depth of %d exceeded calling %s()", maxDepth, name)
                    .at(callee.line, callee.column);
        }

        CallFrame frame = new CallFrame(name, args);
        callStack.push(frame);
        if (Debug.get().isEnabled()) Debug.get().t(TAG, "call " + frame + " depth " + callStack.size());
        try {
            return target.asFunc().call(this, args);
        } catch (KuzurError e) {
            // errors raised by built-ins carry no position yet
            throw e.at(callee.line, callee.column);
        } finally {
            callStack.pop();
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    /** Conditions must be booleans; there is no implicit truthiness. */
    private boolean condition(Expr.ExprInterface expr, Token keyword) {
        Value v = eval(expr);
        if (v.getType() != Value.Type.BOOL) {
            throw new TypeError("Condition of '%s' must be a bool, got %s", keyword.lexeme, v.typeName())
                    .at(keyword.line, keyword.column);
        }
        return v.asBool();
    }

    private boolean logicalOperand(Value v, Token op) {
        if (v.getType() != Value.Type.BOOL) {
            throw new TypeError("Operator '%s' expects bool operands, got %s", op.lexeme, v.typeName())
                    .at(op.line, op.column);
        }
        return v.asBool();
    }

    // a string joins with a number, a bool or another string
    private static boolean isConcatenable(Value str, Value other) {
        if (str.getType() != Value.Type.STRING) return false;
        switch (other.getType()) {
            case STRING:
            case NUMBER:
            case BOOL:
                return true;
            default:
                return false;
        }
    }

    private int compare(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
            double a = left.asNumber();
            double b = right.asNumber();
            return (a < b) ? -1 : (a > b) ? 1 : 0;
        }
        if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            return left.asString().compareTo(right.asString());
        }
        throw operandError(op, left, right);
    }

    public boolean isEqual(Value a, Value b) {
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case NULL:
                return true;
            case NUMBER:
                return a.asNumber() == b.asNumber();
            case BOOL:
                return a.asBool() == b.asBool();
            case STRING:
                return a.asString().equals(b.asString());
            case FUNC:
                return a.asFunc() == b.asFunc();
            default:
                return false;
        }
    }

    private void requireNumbers(Value a, Value b, Token op) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw operandError(op, a, b);
        }
    }

    private void requireNumber(Value v, Token where, String what) {
        if (v.getType() != Value.Type.NUMBER) {
            throw new TypeError("%s must be a number, got %s", capitalize(what), v.typeName())
                    .at(where.line, where.column);
        }
    }

    private void requireNonZero(Value divisor, Token op) {
        if (divisor.asNumber() == 0.0) {
            throw new ValueError("Division by zero").at(op.line, op.column);
        }
    }

    private static KuzurError operandError(Token op, Value left, Value right) {
        return new TypeError("Unsupported operand types for '%s': %s and %s",
                op.lexeme, left.typeName(), right.typeName()).at(op.line, op.column);
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    // -------------------------
    // Control signals
    // -------------------------

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Token keyword;
        final transient Value value;
        ReturnSignal(Token keyword, Value value) {
            super(null, null, false, false);
            this.keyword = keyword;
            this.value = value;
        }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Token keyword;
        BreakSignal(Token keyword) {
            super(null, null, false, false);
            this.keyword = keyword;
        }
    }

    public static final class ContinueSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final transient Token keyword;
        ContinueSignal(Token keyword) {
            super(null, null, false, false);
            this.keyword = keyword;
        }
    }
}
