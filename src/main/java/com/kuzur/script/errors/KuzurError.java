package com.kuzur.script.errors;

/**
 * Base of every error a Kuzur program can raise. All of them are fatal to
 * the run: the engine reports once and the host decides the exit status.
 *
 * The source position is optional because built-in functions raise errors
 * without knowing where they were called from; the interpreter stamps the
 * call site with {@link #at(int, int)} while the error unwinds.
 */
public abstract class KuzurError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String kind;
    private int line = -1;
    private int column = -1;

    /**
     * @param kind error kind shown to the user, e.g. {@code "TypeError"}
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected KuzurError(String kind, String msg, Object... args) {
        super(args.length == 0 ? msg : String.format(msg, args));
        this.kind = kind;
    }

    public String kind() { return kind; }

    public int line() { return line; }

    public int column() { return column; }

    public boolean hasPosition() { return line > 0; }

    /** Records the source position, keeping the first one recorded. */
    public KuzurError at(int line, int column) {
        if (!hasPosition()) {
            this.line = line;
            this.column = column;
        }
        return this;
    }

    /** Human readable one-line report, e.g. {@code NameError at line 3, column 7: Undefined variable 'y'}. */
    public String report() {
        if (!hasPosition()) return kind + ": " + getMessage();
        return kind + " at line " + line + ", column " + column + ": " + getMessage();
    }

    @Override
    public String toString() {
        return report();
    }
}
