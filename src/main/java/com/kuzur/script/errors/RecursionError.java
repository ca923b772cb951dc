package com.kuzur.script.errors;

/** User function calls nested deeper than the engine's configured limit. */
public class RecursionError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public RecursionError(String msg, Object... args) {
        super("RecursionError", msg, args);
    }
}
