package com.branchprobe.agent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of branch identifiers: dense, non-negative, starting at 0 and incremented by 1 per call.
 *
 * One instance is threaded through whatever scope should share IDs (a single function, a whole
 * extraction run, or one agent run), so no branch counter lives in process-wide state.
 */
public final class BranchIdSequence {

    private final AtomicLong next;

    public BranchIdSequence() {
        this(0L);
    }

    public BranchIdSequence(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Branch IDs are non-negative, got start=" + start);
        }
        this.next = new AtomicLong(start);
    }

    /** Returns the next ID and advances the sequence. */
    public long next() {
        return next.getAndIncrement();
    }

    /** Returns the ID the next call to {@link #next()} will hand out. */
    public long peek() {
        return next.get();
    }
}
