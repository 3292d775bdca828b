package com.branchprobe.extractor.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Straight-line instruction sequence ending in one terminator. Edges are derived from
 * terminators, so the model never stores them twice.
 */
public class BasicBlock {

    private final String name;
    private final List<Instruction> instructions = new ArrayList<>();
    private Function parent;

    BasicBlock(String name) {
        this.name = name;
    }

    /** Structural name, or {@code null} for an unnamed block. */
    public String name()                    { return name; }
    public Function parent()                { return parent; }
    public List<Instruction> instructions() { return Collections.unmodifiableList(instructions); }

    /** Last instruction if it is a terminator, else null. */
    public Instruction terminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /** Distinct successor blocks, in terminator order. */
    public List<BasicBlock> successors() {
        Instruction term = terminator();
        if (term == null) {
            return List.of();
        }
        Set<BasicBlock> distinct = new LinkedHashSet<>(term.successors());
        return new ArrayList<>(distinct);
    }

    /** Distinct predecessor blocks, in function block order. */
    public List<BasicBlock> predecessors() {
        List<BasicBlock> preds = new ArrayList<>();
        if (parent == null) {
            return preds;
        }
        for (BasicBlock b : parent.blocks()) {
            Instruction term = b.terminator();
            if (term != null && term.successors().contains(this)) {
                preds.add(b);
            }
        }
        return preds;
    }

    public int index() {
        return parent == null ? -1 : parent.blocks().indexOf(this);
    }

    void setParent(Function parent) {
        this.parent = parent;
    }

    void append(Instruction instruction) {
        instruction.setParent(this);
        instructions.add(instruction);
    }

    void insertBefore(Instruction anchor, Instruction instruction) {
        int at = instructions.indexOf(anchor);
        if (at < 0) {
            throw new IllegalArgumentException("Anchor is not in this block");
        }
        instruction.setParent(this);
        instructions.add(at, instruction);
    }
}
