import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kuzur.script.GlobalsJson;
import com.kuzur.script.KuzurScript;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalsJsonTest {

    @Test
    void valuesMapToJsonKinds() {
        KuzurScript ks = new KuzurScript();
        ObjectNode json = GlobalsJson.toJson(ks.run(
                "a = 1\n" +
                "b = 2.5\n" +
                "c = \"s\"\n" +
                "d = false\n" +
                "func f() { }\n" +
                "e = f()\n"
        ));

        assertTrue(json.get("a").isIntegralNumber());
        assertEquals(1L, json.get("a").asLong());
        assertTrue(json.get("b").isDouble());
        assertEquals("s", json.get("c").asText());
        assertTrue(json.get("d").isBoolean());
        assertEquals("<func f>", json.get("f").asText());
        assertTrue(json.get("e").isNull());
    }

    @Test
    void prettyKeepsDefinitionOrder() {
        KuzurScript ks = new KuzurScript();
        String text = GlobalsJson.pretty(ks.run("z = 1\na = 2\n"));

        assertTrue(text.indexOf("\"z\"") < text.indexOf("\"a\""), text);
    }
}
