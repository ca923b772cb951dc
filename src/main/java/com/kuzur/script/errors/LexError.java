package com.kuzur.script.errors;

public class LexError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public LexError(int line, int column, String msg, Object... args) {
        super("LexError", msg, args);
        at(line, column);
    }
}
