package com.otto.debug;

/** Pluggable debug output target (SLF4J, stdout, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
