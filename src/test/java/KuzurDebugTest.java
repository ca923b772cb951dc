import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.kuzur.debug.Debug;
import com.kuzur.debug.DebugLevel;
import com.kuzur.debug.DebugSink;
import com.kuzur.debug.PrintStreamDebugSink;
import com.kuzur.script.KuzurScript;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KuzurDebugTest {

    private final List<String> entries = new ArrayList<>();
    private DebugSink previous;

    @BeforeEach
    void installCollector() {
        previous = Debug.get().setSink((level, tag, message, error) -> entries.add(level + " " + tag + " " + message));
    }

    @AfterEach
    void restoreSink() {
        Debug.get().setSink(previous);
    }

    @Test
    void failedRunIsLoggedAtErrorLevel() {
        KuzurScript ks = new KuzurScript();
        assertThrows(RuntimeException.class, () -> ks.run("print(y)\n"));

        assertTrue(entries.contains("ERROR KuzurScript NameError at line 1, column 7: Undefined variable 'y'"),
                "entries: " + entries);
    }

    @Test
    void callsAreTraced() {
        KuzurScript ks = new KuzurScript();
        ks.run("func f(a) { return a }\nf(1)\n");

        assertTrue(entries.contains("TRACE Interpreter call f/1 depth 1"), "entries: " + entries);
    }

    @Test
    void shadowingIsTracedOnlyWhileASinkIsInstalled() {
        String src =
                "x = 1\n" +
                "func f() { x = 2 }\n" +
                "f()\n";

        new KuzurScript().run(src);
        assertTrue(entries.contains("TRACE Environment 'x' shadows an outer binding"), "entries: " + entries);

        Debug.get().setSink(null);
        entries.clear();
        new KuzurScript().run(src);
        assertTrue(entries.isEmpty());
    }

    @Test
    void nullSinkRestoresNoop() {
        Debug.get().setSink(null);
        assertFalse(Debug.get().isEnabled());
    }

    @Test
    void printStreamSinkFiltersBelowThreshold() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStreamDebugSink sink = new PrintStreamDebugSink(
                new PrintStream(buf, true, StandardCharsets.UTF_8), DebugLevel.WARN);

        sink.log(DebugLevel.INFO, "T", "hidden", null);
        sink.log(DebugLevel.ERROR, "T", "shown", null);

        assertEquals("[ERROR] T: shown", buf.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void freshHubStartsWithNoopSink() throws Exception {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader fresh = new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader())) {
            Class<?> hubClass = Class.forName("com.kuzur.debug.Debug", true, fresh);
            assertNotSame(Debug.class, hubClass);

            Object hub = hubClass.getMethod("get").invoke(null);
            assertNotNull(hubClass.getMethod("getSink").invoke(hub));
            assertEquals(Boolean.FALSE, hubClass.getMethod("isEnabled").invoke(hub));
            hubClass.getMethod("t", String.class, String.class).invoke(hub, "Test", "dropped");
        }
    }
}
