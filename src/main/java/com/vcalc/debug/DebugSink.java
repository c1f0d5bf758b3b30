package com.vcalc.debug;

/** Pluggable debug output target (stdout, stderr, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
