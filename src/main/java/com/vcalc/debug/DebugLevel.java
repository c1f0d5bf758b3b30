package com.vcalc.debug;

/** Severity of a debug message, lowest first. */
public enum DebugLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel min) {
        return min == null || this.ordinal() >= min.ordinal();
    }
}
