package com.branchprobe.extractor.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A function: parameters and an ordered list of basic blocks, the first being the entry.
 * A function without blocks is an external declaration.
 */
public class Function {

    private final String name;
    private final IrType returnType;
    private final List<Parameter> parameters;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private Module parent;

    Function(String name, IrType returnType, List<Parameter> parameters) {
        this.name = name;
        this.returnType = returnType;
        this.parameters = List.copyOf(parameters);
        for (Parameter p : this.parameters) {
            p.setParent(this);
        }
    }

    public String name()                  { return name; }
    public IrType returnType()            { return returnType; }
    public List<Parameter> parameters()   { return parameters; }
    public Parameter parameter(int i)     { return parameters.get(i); }
    public List<BasicBlock> blocks()      { return Collections.unmodifiableList(blocks); }
    public Module parent()                { return parent; }
    public boolean isDeclaration()        { return blocks.isEmpty(); }

    public BasicBlock entry() {
        if (blocks.isEmpty()) {
            throw new MalformedFunctionException(name, "function has no blocks");
        }
        return blocks.get(0);
    }

    /** All instructions in block order. */
    public List<Instruction> instructions() {
        List<Instruction> all = new ArrayList<>();
        for (BasicBlock b : blocks) {
            all.addAll(b.instructions());
        }
        return all;
    }

    /** Blocks reachable from the entry, in function order. */
    public Set<BasicBlock> reachableBlocks() {
        Set<BasicBlock> seen = new HashSet<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(entry());
        while (!stack.isEmpty()) {
            BasicBlock b = stack.pop();
            if (seen.add(b)) {
                for (BasicBlock s : b.successors()) {
                    stack.push(s);
                }
            }
        }
        Set<BasicBlock> ordered = new LinkedHashSet<>();
        for (BasicBlock b : blocks) {
            if (seen.contains(b)) ordered.add(b);
        }
        return ordered;
    }

    /**
     * Checks the structural invariants the analyses rely on.
     *
     * @throws MalformedFunctionException if a reachable block has no terminator, a terminator
     *         is not the last instruction of its block, or a branch leaves the function
     */
    public void verify() {
        if (blocks.isEmpty()) {
            throw new MalformedFunctionException(name, "function has no blocks");
        }
        for (BasicBlock b : blocks) {
            List<Instruction> insts = b.instructions();
            for (int i = 0; i < insts.size() - 1; i++) {
                if (insts.get(i).isTerminator()) {
                    throw new MalformedFunctionException(name,
                            "terminator '" + insts.get(i).opcode().mnemonic() + "' is not the last instruction of block " + b.index());
                }
            }
            Instruction term = b.terminator();
            if (term != null) {
                for (BasicBlock target : term.successors()) {
                    if (target.parent() != this) {
                        throw new MalformedFunctionException(name, "branch in block " + b.index() + " targets a block of another function");
                    }
                }
            }
        }
        for (BasicBlock b : reachableBlocks()) {
            if (b.terminator() == null) {
                throw new MalformedFunctionException(name, "reachable block " + b.index() + " has no terminator");
            }
        }
    }

    void setParent(Module parent) {
        this.parent = parent;
    }

    void addBlock(BasicBlock block) {
        block.setParent(this);
        blocks.add(block);
    }

    @Override
    public String toString() {
        return name;
    }
}
