package com.branchprobe.extractor.static_analysis;

import com.branchprobe.agent.BranchIdSequence;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numbers the conditional-branch terminators of a function in block order. The counter is
 * passed in, so callers decide whether IDs restart per function or continue across a run.
 */
public class BranchIdAssigner {

    public Map<Instruction, Long> assign(Function function, BranchIdSequence ids) {
        Map<Instruction, Long> assigned = new LinkedHashMap<>();
        for (BasicBlock b : function.blocks()) {
            Instruction term = b.terminator();
            if (term != null && term.isConditionalBranch()) {
                assigned.put(term, ids.next());
            }
        }
        return assigned;
    }
}
