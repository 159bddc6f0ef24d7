package com.otto.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Otto components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - SLF4J-backed sink by default, filtered by the current level
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(new Slf4jDebugSink());
    private volatile DebugLevel minLevel = DebugLevel.INFO;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink; {@code null} silences all output. */
    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void resetSink() {
        sinkRef.set(new Slf4jDebugSink());
    }

    public void setLevel(DebugLevel level) {
        this.minLevel = level == null ? DebugLevel.INFO : level;
    }

    public DebugLevel getLevel() {
        return minLevel;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.isAtLeast(minLevel)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
