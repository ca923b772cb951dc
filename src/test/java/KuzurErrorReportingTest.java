import org.junit.jupiter.api.Test;

import com.kuzur.script.KuzurScript;
import com.kuzur.script.errors.ArityError;
import com.kuzur.script.errors.KuzurError;
import com.kuzur.script.errors.NameError;
import com.kuzur.script.errors.TypeError;
import com.kuzur.script.errors.ValueError;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class KuzurErrorReportingTest {

    private static String report(String src) {
        KuzurError e = assertThrows(KuzurError.class, () -> new KuzurScript().run(src));
        return e.report();
    }

    @Test
    void execute_printsOneLineReportAndReturnsOne() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        KuzurScript ks = new KuzurScript();
        ks.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));

        int status = ks.execute("print(\"before\")\nprint(y)\nprint(\"after\")\n",
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(1, status);
        assertEquals("before\n", out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
        assertEquals("NameError at line 2, column 7: Undefined variable 'y'",
                err.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void execute_returnsZeroOnSuccess() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        KuzurScript ks = new KuzurScript();
        ks.setOutput(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertEquals(0, ks.execute("x = 1\n", new PrintStream(err, true, StandardCharsets.UTF_8)));
        assertEquals(0, err.size());
    }

    @Test
    void undefinedVariable_isNameError() {
        NameError e = assertThrows(NameError.class, () -> new KuzurScript().run("print(y)\n"));
        assertEquals(1, e.line());
        assertEquals(7, e.column());
        assertEquals("NameError", e.kind());
    }

    @Test
    void undefinedFunction_isNameError() {
        assertEquals("NameError at line 1, column 1: Undefined function 'foo'", report("foo()\n"));
    }

    @Test
    void callingANonFunction_isTypeError() {
        assertEquals("TypeError at line 2, column 1: 'x' is not a function (it is a number)",
                report("x = 5\nx()\n"));
    }

    @Test
    void operandMismatch_isTypeErrorAtOperator() {
        assertEquals("TypeError at line 1, column 7: Unsupported operand types for '-': number and string",
                report("x = 1 - \"a\"\n"));
        assertThrows(TypeError.class, () -> new KuzurScript().run("x = 1 + true\n"));
        assertThrows(TypeError.class, () -> new KuzurScript().run("x = 1 < \"a\"\n"));
        assertThrows(TypeError.class, () -> new KuzurScript().run("x = !1\n"));
        assertThrows(TypeError.class, () -> new KuzurScript().run("x = -\"a\"\n"));
        assertThrows(TypeError.class, () -> new KuzurScript().run(
                "func f() { }\n" +
                "x = \"value: \" + f()\n"
        ));
    }

    @Test
    void divisionByZero_isValueError() {
        assertEquals("ValueError at line 1, column 7: Division by zero", report("x = 1 / 0\n"));
        assertThrows(ValueError.class, () -> new KuzurScript().run("x = 5 % 0\n"));
    }

    @Test
    void builtinErrors_carryTheCallSite() {
        assertEquals("TypeError at line 1, column 1: len() expects a string, got number", report("len(5)\n"));
    }

    @Test
    void userFunctionArity_isArityErrorAtCallSite() {
        ArityError e = assertThrows(ArityError.class, () -> new KuzurScript().run(
                "func add(a, b) { return a + b }\n" +
                "add(1)\n"
        ));
        assertEquals("ArityError at line 2, column 1: add() expects 2 argument(s), got 1", e.report());
    }

    @Test
    void errorsInsideFunctions_keepTheirOwnPosition() {
        assertEquals("NameError at line 2, column 10: Undefined variable 'missing'", report(
                "func f() {\n" +
                "  return missing\n" +
                "}\n" +
                "f()\n"
        ));
    }

    @Test
    void parseErrors_useExpectedButFoundWording() {
        assertEquals("ParseError at line 1, column 4: Expected '(' after 'if' but found identifier 'x'",
                report("if x > 10 {\n}\n"));
    }

    @Test
    void parseErrors_preventAnyExecution() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        KuzurScript ks = new KuzurScript();
        ks.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));

        assertThrows(KuzurError.class, () -> ks.run("print(\"never\")\nwhile (true) {\n"));
        assertEquals(0, out.size());
    }
}
