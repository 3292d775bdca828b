package com.branchprobe.agent;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Consumer;

/**
 * Static hook that instrumented code calls for every executed conditional branch.
 *
 * The hook itself keeps no log state: it forwards to the installed {@link BranchOutcomeSink}.
 * When nothing was installed (the program was instrumented ahead of time and runs without the
 * agent) a {@link DynamicLogger} writing to {@value DynamicLogger#DEFAULT_LOG_DIR} is created
 * on the first event, with a shutdown hook that closes it.
 */
public final class BranchLog {

    /** Name under which instrumenters declare the hook. */
    public static final String HOOK_NAME = "logBranchOutcome";

    private BranchLog() {}

    private static volatile BranchOutcomeSink sink;
    private static volatile String programName;

    public static void logBranchOutcome(long branchId, boolean taken) {
        BranchOutcomeSink s = sink;
        if (s == null) {
            s = installDefault(Paths.get(DynamicLogger.DEFAULT_LOG_DIR), Runtime.getRuntime()::addShutdownHook);
        }
        try {
            s.record(branchId, taken);
        } catch (RuntimeException e) {
            // The instrumented program must behave exactly as without the probe.
            System.err.println("[branch-agent] ERROR recording branch " + branchId + ": " + e);
        }
    }

    /**
     * Names the running program. Takes effect for the default logger and for an installed
     * {@link DynamicLogger} that has not yet opened its file.
     */
    public static synchronized void setProgramName(String name) {
        programName = name;
        if (sink instanceof DynamicLogger logger) {
            logger.setProgramId(name);
        }
    }

    /** Installs {@code newSink} and returns the previously installed sink, or null. */
    public static synchronized BranchOutcomeSink install(BranchOutcomeSink newSink) {
        BranchOutcomeSink previous = sink;
        sink = newSink;
        return previous;
    }

    public static BranchOutcomeSink current() {
        return sink;
    }

    static synchronized BranchOutcomeSink installDefault(Path logDir, Consumer<Thread> shutdownHooks) {
        if (sink == null) {
            DynamicLogger logger = new DynamicLogger(logDir);
            logger.setProgramId(programName);
            shutdownHooks.accept(new Thread(new ShutdownHook(logger, null, null, null)));
            sink = logger;
        }
        return sink;
    }

    // -----------------------------------------------------------------------
    // Reset (for testing)
    // -----------------------------------------------------------------------

    public static synchronized void reset() {
        BranchOutcomeSink previous = sink;
        sink = null;
        programName = null;
        if (previous != null) {
            previous.close();
        }
    }
}
