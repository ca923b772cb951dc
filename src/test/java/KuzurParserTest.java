import org.junit.jupiter.api.Test;

import com.kuzur.script.KuzurScript;
import com.kuzur.script.errors.ParseError;
import com.kuzur.script.parser.Expr;
import com.kuzur.script.parser.Statement;
import com.kuzur.script.parser.Statement.Stmt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KuzurParserTest {

    private static List<Stmt> parse(String src) {
        return new KuzurScript().parse(src);
    }

    @Test
    void ifWithoutParentheses_isParseError() {
        ParseError e = assertThrows(ParseError.class, () -> parse("x = 1\nif x > 10 {\n}\n"));

        assertEquals(2, e.line());
        assertEquals(4, e.column());
        assertEquals("'(' after 'if'", e.expected());
        assertEquals("identifier 'x'", e.found());
    }

    @Test
    void loopBodyWithoutBraces_isParseError() {
        ParseError e = assertThrows(ParseError.class, () -> parse("while (true) print(1)\n"));
        assertEquals("'{' to open while body", e.expected());
    }

    @Test
    void unexpectedEndOfInput_isParseError() {
        ParseError e = assertThrows(ParseError.class, () -> parse("print(1"));
        assertEquals("end of input", e.found());

        assertThrows(ParseError.class, () -> parse("func f() {\n  x = 1\n"));
    }

    @Test
    void duplicateParameter_isParseError() {
        assertThrows(ParseError.class, () -> parse("func f(a, a) { }\n"));
    }

    @Test
    void assignmentToNonVariable_isParseError() {
        assertThrows(ParseError.class, () -> parse("1 + 2 = 3\n"));
    }

    @Test
    void statementKinds() {
        List<Stmt> program = parse(
                "x = 1\n" +
                "print(x)\n" +
                "if (x > 0) { }\n" +
                "while (false) { }\n" +
                "do { } while (false)\n" +
                "for i = 1; 3 { }\n" +
                "func f(a, b) { return a }\n" +
                "{ }\n"
        );

        assertEquals(8, program.size());
        assertTrue(program.get(0) instanceof Statement.VarAssign);
        assertTrue(program.get(1) instanceof Statement.ExprStmt);
        assertTrue(program.get(2) instanceof Statement.If);
        assertTrue(program.get(3) instanceof Statement.While);
        assertTrue(program.get(4) instanceof Statement.DoWhile);
        assertTrue(program.get(5) instanceof Statement.For);
        assertTrue(program.get(6) instanceof Statement.FunctionStmt);
        assertTrue(program.get(7) instanceof Statement.Block);

        Statement.FunctionStmt f = (Statement.FunctionStmt) program.get(6);
        assertEquals("f", f.name.lexeme);
        assertEquals(2, f.params.size());
    }

    @Test
    void ifChain_collectsElifAndElseIfBranches() {
        List<Stmt> program = parse(
                "if (a) { } elif (b) { } else if (c) { } else { }\n"
        );

        Statement.If stmt = (Statement.If) program.get(0);
        assertEquals(2, stmt.elifBranches.size());
        assertNotNull(stmt.elseBranch);
    }

    @Test
    void forLoop_acceptsParenthesisedHeader() {
        Statement.For plain = (Statement.For) parse("for i = 1; 10 { }\n").get(0);
        Statement.For paren = (Statement.For) parse("for (j = 0; n - 1) { }\n").get(0);

        assertEquals("i", plain.variable.lexeme);
        assertEquals("j", paren.variable.lexeme);
        assertTrue(paren.end instanceof Expr.Binary);
    }

    @Test
    void operatorOnNextLine_startsNewStatement() {
        List<Stmt> program = parse("x = 1\n-2\n");

        assertEquals(2, program.size());
        Statement.ExprStmt second = (Statement.ExprStmt) program.get(1);
        assertTrue(second.expression instanceof Expr.Unary);
    }

    @Test
    void returnValue_mustShareTheLine() {
        Statement.FunctionStmt f = (Statement.FunctionStmt) parse(
                "func f() {\n" +
                "  return\n" +
                "  5\n" +
                "}\n"
        ).get(0);

        assertEquals(2, f.body.statements.size());
        Statement.ReturnStmt ret = (Statement.ReturnStmt) f.body.statements.get(0);
        assertNull(ret.value);
    }

    @Test
    void precedence_multiplicationBindsTighter() {
        Statement.VarAssign assign = (Statement.VarAssign) parse("x = 1 + 2 * 3\n").get(0);

        Expr.Binary sum = (Expr.Binary) assign.initializer;
        assertEquals("+", sum.operator.lexeme);
        assertTrue(sum.right instanceof Expr.Binary);
        assertEquals("*", ((Expr.Binary) sum.right).operator.lexeme);
    }

    @Test
    void deeplyNestedParentheses_isParseErrorNotStackOverflow() {
        String src = "x = " + "(".repeat(3000) + "1" + ")".repeat(3000) + "\n";

        ParseError e = assertThrows(ParseError.class, () -> parse(src));
        assertEquals("at most 256 levels of nesting", e.expected());
        assertEquals("'('", e.found());
    }

    @Test
    void deeplyNestedBlocksAndUnaryChains_areParseErrors() {
        String blocks = "if (true) {\n".repeat(400) + "}\n".repeat(400);
        assertThrows(ParseError.class, () -> parse(blocks));

        assertThrows(ParseError.class, () -> parse("x = " + "-".repeat(5000) + "1\n"));
    }

    @Test
    void moderateNesting_isAccepted() {
        String src = "x = " + "(".repeat(100) + "1" + ")".repeat(100) + "\n";
        assertEquals(1, parse(src).size());

        KuzurScript ks = new KuzurScript();
        assertEquals(-1.0, ks.run("y = " + "-".repeat(99) + "1\n").get("y").asNumber(), 1e-9);
    }
}
