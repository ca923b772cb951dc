package com.kuzur.script;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.kuzur.debug.Debug;
import com.kuzur.script.errors.KuzurError;
import com.kuzur.script.parser.EntryRunResult;
import com.kuzur.script.parser.Environment;
import com.kuzur.script.parser.Interpreter;
import com.kuzur.script.parser.Lexer;
import com.kuzur.script.parser.NativeFunction;
import com.kuzur.script.parser.Parser;
import com.kuzur.script.parser.Statement.Stmt;
import com.kuzur.script.parser.Token;
import com.kuzur.script.parser.Value;
import com.kuzur.script.plugins.KuzurCorePlugin;

/**
 * Core Kuzur engine.
 *
 * - Syntax: if / elif / else, while, do-while, for i = a; b, func, return,
 *   break, continue, // comments, no statement terminator
 * - Types: number (double), bool, string, function, null
 * - Built-ins: print, input, len, int, str (see {@link KuzurCorePlugin});
 *   hosts may register more via registerFunction
 * - Every run gets its own global environment and interpreter, so several
 *   engines can live in one JVM
 *
 * Errors are {@link KuzurError}s and always reach the host; the engine
 * only logs them to the {@link Debug} hub on the way out.
 */
public class KuzurScript {

    public static final String NAME = "Kuzur";
    public static final String VERSION = "1.0.0";
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private static final String TAG = "KuzurScript";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private PrintStream out = System.out;
    private BufferedReader in;

    public KuzurScript() {
        KuzurCorePlugin.register(this);
    }

    // ===================== CONFIGURATION =====================

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Where print and input prompts go. Defaults to System.out. */
    public void setOutput(PrintStream out) {
        this.out = (out == null) ? System.out : out;
    }

    public PrintStream output() { return out; }

    /** Where input reads lines from. Defaults to System.in decoded as UTF-8. */
    public void setInput(BufferedReader in) {
        this.in = in;
    }

    public BufferedReader input() {
        if (in == null) {
            in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return in;
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public Set<String> builtinNames() { return Collections.unmodifiableSet(functions.keySet()); }

    // ===================== ENGINE PUBLIC API =====================

    /** Lexes and parses without executing anything. */
    public List<Stmt> parse(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens);
        return parser.parse();
    }

    /** Runs a program to completion and returns its user-visible globals. */
    public Map<String, Value> run(String source) {
        Environment env = newGlobals();
        try {
            List<Stmt> program = parse(source);
            Interpreter interpreter = new Interpreter(env, maxCallDepth);
            interpreter.execute(program);
            return userGlobals(env);
        } catch (KuzurError e) {
            Debug.get().e(TAG, e.report());
            throw e;
        } finally {
            out.flush();
        }
    }

    /**
     * Runs the program's top level, then invokes the global function
     * {@code entryFunctionName} with {@code entryArgs} and returns its result
     * together with the globals after the call.
     */
    public EntryRunResult runWithEntryResult(String source, String entryFunctionName, List<Value> entryArgs) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (entryFunctionName == null || entryFunctionName.trim().isEmpty()) {
            throw new IllegalArgumentException("entryFunctionName must not be empty");
        }

        Environment env = newGlobals();
        try {
            List<Stmt> program = parse(source);
            Interpreter interpreter = new Interpreter(env, maxCallDepth);

            // 1) globals
            interpreter.execute(program);

            // 2) entry call
            List<Value> args = (entryArgs == null) ? Collections.emptyList() : entryArgs;
            Value result = interpreter.invokeForHost(entryFunctionName, args);

            return new EntryRunResult(userGlobals(env), result);
        } catch (KuzurError e) {
            Debug.get().e(TAG, "entry " + entryFunctionName + ": " + e.report());
            throw e;
        } finally {
            out.flush();
        }
    }

    /**
     * Runs a program the way the command line does: 0 when it falls off the
     * end, 1 after writing a one-line report of the first error to {@code err}.
     */
    public int execute(String source, PrintStream err) {
        try {
            run(source);
            return 0;
        } catch (KuzurError e) {
            err.println(e.report());
            err.flush();
            return 1;
        }
    }

    private Environment newGlobals() {
        Environment env = new Environment();
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            env.define(e.getKey(), Value.func(new NativeFunction(e.getKey(), e.getValue())));
        }
        return env;
    }

    // built-ins are part of every global frame; hosts only care about what the script bound
    private static Map<String, Value> userGlobals(Environment env) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : env.snapshot().entrySet()) {
            Value v = e.getValue();
            if (v.getType() == Value.Type.FUNC && v.asFunc() instanceof NativeFunction) continue;
            out.put(e.getKey(), v);
        }
        return out;
    }
}
