package com.branchprobe.extractor.static_analysis;

/**
 * Edges the block-level distance search relaxes.
 *
 * {@link #PREDECESSORS} reads as "steps back, along control flow, to the previous decision
 * point" and is the default. {@link #BIDIRECTIONAL} treats the CFG as undirected; blocks far
 * downstream of every seed get smaller distances than under {@code PREDECESSORS}.
 */
public enum PropagationMode {
    PREDECESSORS("predecessors"),
    BIDIRECTIONAL("bidirectional");

    private final String text;

    PropagationMode(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static PropagationMode fromText(String text) {
        for (PropagationMode m : values()) {
            if (m.text.equalsIgnoreCase(text)) return m;
        }
        throw new IllegalArgumentException("Unknown propagation mode: " + text
                + " (expected predecessors or bidirectional)");
    }
}
