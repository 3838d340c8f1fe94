package com.elara.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global diagnostics hub for the Kconfig engine and its tools.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 * - useSysErr() routes diagnostics to standard error, out of the normal
 *   output stream
 */
public final class Debug {

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    // Must follow NOOP, which the constructor reads
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink that prints INFO and above (with stack traces) to System.err. */
    public static void useSysErr() {
        INSTANCE.setSink(printing(System.err, DebugLevel.INFO));
    }

    /** A sink writing plain message lines at or above {@code minLevel} to the given stream. */
    public static DebugSink printing(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (level.compareTo(minLevel) < 0) return;
            out.println(message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    // Convenience methods
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
