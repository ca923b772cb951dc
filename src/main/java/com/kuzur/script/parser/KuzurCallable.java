package com.kuzur.script.parser;

import java.util.List;

/** Anything a call expression can invoke: user functions and native built-ins. */
public interface KuzurCallable {
    String name();

    Value call(Interpreter interpreter, List<Value> args);
}
