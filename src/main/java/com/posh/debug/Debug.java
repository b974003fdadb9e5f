package com.posh.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global diagnostic hub for the interpreter and its stages.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Silent until a sink is installed
 */
public final class Debug {

    // NOOP must be initialised before INSTANCE reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // discard
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Messages below this level are dropped before reaching the sink. */
    public void setThreshold(DebugLevel level) {
        threshold = level == null ? DebugLevel.TRACE : level;
    }

    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.atLeast(threshold);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
