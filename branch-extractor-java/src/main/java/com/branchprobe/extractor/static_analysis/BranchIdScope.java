package com.branchprobe.extractor.static_analysis;

/**
 * Lifetime of the branch ID counter. {@link #FUNCTION} restarts at 0 for every function,
 * which matches the per-method ordinals of the bytecode agent; {@link #RUN} threads one
 * counter through a sequential extraction run, making IDs unique across functions.
 */
public enum BranchIdScope {
    FUNCTION("function"),
    RUN("run");

    private final String text;

    BranchIdScope(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static BranchIdScope fromText(String text) {
        for (BranchIdScope s : values()) {
            if (s.text.equalsIgnoreCase(text)) return s;
        }
        throw new IllegalArgumentException("Unknown branch ID scope: " + text + " (expected function or run)");
    }
}
