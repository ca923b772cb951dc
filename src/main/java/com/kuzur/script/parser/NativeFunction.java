package com.kuzur.script.parser;

import java.util.List;

import com.kuzur.script.KuzurScript.BuiltinFunction;

/** A host-registered built-in bound in the global environment. */
public final class NativeFunction implements KuzurCallable {
    private final String name;
    private final BuiltinFunction fn;

    public NativeFunction(String name, BuiltinFunction fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        return fn.call(args);
    }

    @Override
    public String toString() { return "<builtin " + name + ">"; }
}
