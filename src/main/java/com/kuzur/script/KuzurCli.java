package com.kuzur.script;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import com.kuzur.debug.Debug;
import com.kuzur.debug.DebugLevel;
import com.kuzur.debug.DebugSink;
import com.kuzur.debug.PrintStreamDebugSink;
import com.kuzur.script.errors.KuzurError;
import com.kuzur.script.parser.Value;

/**
 * Command line entry point:
 * <pre>
 *   kuzur [--debug[=LEVEL]] [--dump-globals] program.kz
 *   kuzur --version | --help
 * </pre>
 * Exit status: 0 on success, 1 when the program fails with a Kuzur error,
 * 2 for usage problems and unreadable files.
 */
public final class KuzurCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return EXIT_OK;
        }

        DebugLevel debugLevel = null;
        boolean dumpGlobals = false;
        String file = null;

        for (String a : args) {
            if (a.equals("-V") || a.equals("--version")) {
                out.println(KuzurScript.NAME + " " + KuzurScript.VERSION);
                return EXIT_OK;
            } else if (a.equals("-h") || a.equals("--help")) {
                printUsage(out);
                return EXIT_OK;
            } else if (a.equals("--debug")) {
                debugLevel = DebugLevel.DEBUG;
            } else if (a.startsWith("--debug=")) {
                String level = a.substring("--debug=".length()).toUpperCase(Locale.ROOT);
                try {
                    debugLevel = DebugLevel.valueOf(level);
                } catch (IllegalArgumentException e) {
                    err.println("Unknown debug level: " + a.substring("--debug=".length()));
                    return EXIT_USAGE;
                }
            } else if (a.equals("--dump-globals")) {
                dumpGlobals = true;
            } else if (a.startsWith("-")) {
                err.println("Unknown option: " + a);
                printUsage(err);
                return EXIT_USAGE;
            } else if (file == null) {
                file = a;
            } else {
                printUsage(out);
                return EXIT_USAGE;
            }
        }

        if (file == null || !file.endsWith(".kz")) {
            printUsage(out);
            return EXIT_USAGE;
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("File not found: " + file);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
            return EXIT_USAGE;
        }

        DebugSink previousSink = null;
        if (debugLevel != null) {
            previousSink = Debug.get().setSink(new PrintStreamDebugSink(err, debugLevel));
        }
        try {
            KuzurScript engine = new KuzurScript();
            engine.setOutput(out);

            Map<String, Value> globals = engine.run(script);
            if (dumpGlobals) out.println(GlobalsJson.pretty(globals));
            return EXIT_OK;
        } catch (KuzurError e) {
            err.println(e.report());
            return EXIT_SCRIPT_ERROR;
        } catch (UncheckedIOException e) {
            err.println("I/O error: " + e.getCause().getMessage());
            return EXIT_SCRIPT_ERROR;
        } finally {
            if (debugLevel != null) Debug.get().setSink(previousSink);
            out.flush();
            err.flush();
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: kuzur [options] <program.kz>");
        out.println();
        out.println("Options:");
        out.println("  -V, --version        Print Kuzur version and exit");
        out.println("  -h, --help           Show this help message");
        out.println("  --debug[=LEVEL]      Trace the interpreter on stderr (TRACE, DEBUG, INFO, WARN, ERROR)");
        out.println("  --dump-globals       Print the final global variables as JSON");
        out.println();
        out.println("Examples:");
        out.println("  kuzur myprogram.kz");
        out.println("  kuzur --version");
    }

    private KuzurCli() {}
}
