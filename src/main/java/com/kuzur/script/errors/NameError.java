package com.kuzur.script.errors;

/** Undefined identifier. */
public class NameError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public NameError(String msg, Object... args) {
        super("NameError", msg, args);
    }
}
