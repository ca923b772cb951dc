package com.kuzur.script.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.regex.Pattern;

import com.kuzur.script.KuzurScript;
import com.kuzur.script.errors.ArityError;
import com.kuzur.script.errors.TypeError;
import com.kuzur.script.errors.ValueError;
import com.kuzur.script.parser.Value;

/**
 * KuzurCorePlugin
 *
 * The fixed built-in library every engine starts with:
 *
 *   print(a, b, ...)   string forms joined by a space, then a newline
 *   input(prompt?)     one line from the engine input, without the newline
 *   len(s)             number of characters in a string
 *   int(x)             number truncated toward zero, or a parsed integer string
 *   str(x)             string form of a number, bool or string
 *
 * Output and input are looked up on the engine at call time, so
 * {@link KuzurScript#setOutput} and {@link KuzurScript#setInput} apply even
 * after registration.
 */
public final class KuzurCorePlugin {

    // optional sign then digits; surrounding whitespace is trimmed first
    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?[0-9]+");

    private KuzurCorePlugin() {}

    public static void register(KuzurScript engine) {

        engine.registerFunction("print", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).display());
            }
            engine.output().println(sb);
            return Value.nil();
        });

        engine.registerFunction("input", args -> {
            requireArgsBetween("input", args, 0, 1);
            PrintStream out = engine.output();
            if (!args.isEmpty()) {
                out.print(args.get(0).display());
                out.flush();
            }
            BufferedReader in = engine.input();
            try {
                String line = in.readLine(); // blocks
                return Value.string(line == null ? "" : line);
            } catch (IOException ioe) {
                throw new UncheckedIOException("input() failed: " + ioe.getMessage(), ioe);
            }
        });

        engine.registerFunction("len", args -> {
            requireArgs("len", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.STRING) {
                throw new TypeError("len() expects a string, got %s", v.typeName());
            }
            String s = v.asString();
            return Value.number(s.codePointCount(0, s.length()));
        });

        engine.registerFunction("int", args -> {
            requireArgs("int", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case NUMBER: {
                    double d = v.asNumber();
                    if (Double.isNaN(d) || Double.isInfinite(d)) {
                        throw new ValueError("int() cannot convert %s", Value.formatNumber(d));
                    }
                    return Value.number(d < 0 ? Math.ceil(d) : Math.floor(d));
                }
                case STRING:
                    return Value.number(parseInteger(v.asString()));
                default:
                    throw new TypeError("int() expects a string or number, got %s", v.typeName());
            }
        });

        engine.registerFunction("str", args -> {
            requireArgs("str", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case NUMBER:
                case BOOL:
                case STRING:
                    return Value.string(v.display());
                default:
                    throw new TypeError("str() expects a number, bool or string, got %s", v.typeName());
            }
        });
    }

    static double parseInteger(String raw) {
        String s = raw.trim();
        if (!INTEGER_LITERAL.matcher(s).matches()) {
            throw new ValueError("invalid literal for int(): '%s'", raw);
        }
        // digits only, so this cannot fail; very long literals lose precision like any double
        return Double.parseDouble(s);
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new ArityError("%s() expects %d argument(s), got %d", fn, n, args.size());
        }
    }

    private static void requireArgsBetween(String fn, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new ArityError("%s() expects %d to %d argument(s), got %d", fn, min, max, args.size());
        }
    }
}
