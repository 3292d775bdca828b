package com.branchprobe.extractor.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/** A natural loop: its header, its body blocks in function order and its direct sub-loops. */
public class Loop {

    private final BasicBlock header;
    private final List<BasicBlock> blocks;
    private final List<Loop> subLoops = new ArrayList<>();
    private Loop parent;
    private int depth = 1;

    Loop(BasicBlock header, List<BasicBlock> blocks) {
        this.header = header;
        this.blocks = List.copyOf(blocks);
    }

    public BasicBlock header()      { return header; }
    public List<BasicBlock> blocks() { return blocks; }
    public List<Loop> subLoops()    { return Collections.unmodifiableList(subLoops); }
    public Loop parent()            { return parent; }

    /** Nesting depth, 1 for an outermost loop. */
    public int depth()              { return depth; }

    public boolean contains(BasicBlock block) {
        return blocks.contains(block);
    }

    void setParent(Loop parent) {
        this.parent = parent;
        parent.subLoops.add(this);
    }

    void sortSubLoops() {
        subLoops.sort(Comparator.comparingInt(l -> l.header.index()));
    }

    void setDepth(int depth) {
        this.depth = depth;
    }
}
