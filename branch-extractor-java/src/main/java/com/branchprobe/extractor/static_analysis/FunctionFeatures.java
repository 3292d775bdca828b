package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Everything the static engine derived for one function: block labels, per-instruction
 * feature records, branch IDs and data dependencies, plus the settings that produced them.
 */
public class FunctionFeatures {

    private final Function function;
    private final Map<BasicBlock, String> labels;
    private final Map<Instruction, FeatureRecord> records;
    private final Map<Instruction, Long> branchIds;
    private final Map<Instruction, Set<Instruction>> dependencies;
    private final BranchIdScope scope;
    private final PropagationMode mode;

    FunctionFeatures(Function function,
                     Map<BasicBlock, String> labels,
                     Map<Instruction, FeatureRecord> records,
                     Map<Instruction, Long> branchIds,
                     Map<Instruction, Set<Instruction>> dependencies,
                     BranchIdScope scope,
                     PropagationMode mode) {
        this.function = function;
        this.labels = Collections.unmodifiableMap(labels);
        this.records = Collections.unmodifiableMap(records);
        this.branchIds = Collections.unmodifiableMap(branchIds);
        this.dependencies = Collections.unmodifiableMap(dependencies);
        this.scope = scope;
        this.mode = mode;
    }

    public Function function()                              { return function; }
    public Map<BasicBlock, String> labels()                 { return labels; }
    public Map<Instruction, FeatureRecord> records()        { return records; }
    public Map<Instruction, Long> branchIds()               { return branchIds; }
    public Map<Instruction, Set<Instruction>> dependencies() { return dependencies; }
    public BranchIdScope scope()                            { return scope; }
    public PropagationMode mode()                           { return mode; }

    public String label(BasicBlock block)       { return labels.get(block); }
    public FeatureRecord record(Instruction i)  { return records.get(i); }

    /** Branch ID of a conditional branch, else null. */
    public Long branchId(Instruction i)         { return branchIds.get(i); }

    public Set<Instruction> dependencies(Instruction i) {
        return dependencies.getOrDefault(i, Set.of());
    }
}
