package com.elara.debug;

/** Pluggable diagnostics target (stderr, a test collector, a log file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
