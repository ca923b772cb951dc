package com.kuzur.debug;

import java.io.PrintStream;

/**
 * Writes debug lines as {@code [LEVEL] tag: message} to a stream, dropping
 * anything below the configured threshold.
 */
public final class PrintStreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public PrintStreamDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.TRACE : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.isAtLeast(threshold)) return;
        synchronized (out) {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
