package com.branchprobe.agent;

/**
 * Receives the outcome of one executed conditional branch.
 *
 * Implementations must tolerate being called from any thread of the instrumented program
 * and must never throw into it.
 */
public interface BranchOutcomeSink extends AutoCloseable {

    void record(long branchId, boolean taken);

    /** Flushes and releases whatever the sink holds. Safe to call more than once. */
    @Override
    void close();
}
