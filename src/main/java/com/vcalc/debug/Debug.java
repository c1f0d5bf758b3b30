package com.vcalc.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the converter, the block runner and the CLI.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...); {@link #printing} gives a level-filtered stream sink
 * - Silent until a sink is installed
 *
 * Tags in use: vcalc.engine, vcalc.sequencer, vcalc.store, vcalc.cli.
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE, whose field initializer reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route messages at or above {@code min} to System.err (keeps stdout clean for CLI output). */
    public static void useSysErr(DebugLevel min) {
        INSTANCE.setSink(printing(System.err, min));
    }

    public static DebugSink printing(PrintStream out, DebugLevel min) {
        return (level, tag, message, error) -> {
            if (!level.atLeast(min)) return;
            out.println("[" + level + "][" + tag + "] " + message);
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
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
