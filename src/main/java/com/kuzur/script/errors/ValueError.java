package com.kuzur.script.errors;

/** A value of the right kind but unusable content, such as {@code int("abc")} or a division by zero. */
public class ValueError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public ValueError(String msg, Object... args) {
        super("ValueError", msg, args);
    }
}
