package com.kuzur.script.errors;

/** {@code break}, {@code continue} or {@code return} reached outside a construct that handles it. */
public class ControlFlowError extends KuzurError {
    private static final long serialVersionUID = 1L;

    public ControlFlowError(String msg, Object... args) {
        super("ControlFlowError", msg, args);
    }
}
