package com.posh.debug;

import java.io.PrintStream;

/** Pluggable diagnostic output target (stderr, file, test capture). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);

    /** Plain-text sink writing one line per message. */
    static DebugSink printing(PrintStream out) {
        return (level, tag, message, error) -> {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }
}
