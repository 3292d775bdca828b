package com.branchprobe.extractor.ir;

/** The control-flow kinds a block terminator can have. */
public enum TerminatorKind {
    CONDITIONAL_BRANCH,
    UNCONDITIONAL_BRANCH,
    INDIRECT_BRANCH,
    SWITCH,
    CALL,
    RETURN
}
