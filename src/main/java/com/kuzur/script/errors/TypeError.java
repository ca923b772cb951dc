package com.kuzur.script.errors;

/** An operator, condition or built-in applied to a value of the wrong kind. */
public class TypeError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public TypeError(String msg, Object... args) {
        super("TypeError", msg, args);
    }
}
