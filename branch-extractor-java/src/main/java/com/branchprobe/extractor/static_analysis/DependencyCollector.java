package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.Value;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * First-degree def-use edges: for each instruction, the operands that are instructions of
 * the same function. Parameters and constants are not producers. Every instruction gets an
 * entry, empty when it has no producer.
 */
public class DependencyCollector {

    public Map<Instruction, Set<Instruction>> collect(Function function) {
        Map<Instruction, Set<Instruction>> deps = new LinkedHashMap<>();
        for (Instruction i : function.instructions()) {
            Set<Instruction> producers = new LinkedHashSet<>();
            for (Value operand : i.operands()) {
                if (operand instanceof Instruction producer && producer.function() == function) {
                    producers.add(producer);
                }
            }
            deps.put(i, producers);
        }
        return deps;
    }
}
