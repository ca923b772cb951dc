package com.kuzur.script.errors;

/**
 * Unexpected or missing token. Parsing stops at the first one; there is no
 * recovery and no multi-error reporting.
 */
public class ParseError extends KuzurError {
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public ParseError(int line, int column, String expected, String found) {
        super("ParseError", "Expected %s but found %s", expected, found);
        this.expected = expected;
        this.found = found;
        at(line, column);
    }

    public String expected() { return expected; }

    public String found() { return found; }
}
