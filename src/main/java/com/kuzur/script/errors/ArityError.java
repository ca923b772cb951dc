package com.kuzur.script.errors;

/** A function called with the wrong number of arguments. */
public class ArityError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public ArityError(String msg, Object... args) {
        super("ArityError", msg, args);
    }
}
