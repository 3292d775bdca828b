package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.Loop;
import com.branchprobe.extractor.ir.LoopNest;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Marks instructions inside loop bodies and records the depth of their innermost loop.
 * Walks the loop-nest tree with an explicit stack, so nesting depth is unbounded.
 */
public class LoopAnnotator {

    public record Result(Set<Instruction> inLoop, Map<Instruction, Integer> loopDepth) {

        public boolean inLoop(Instruction i) {
            return inLoop.contains(i);
        }

        /** Innermost enclosing loop depth, 0 outside loops. */
        public int depth(Instruction i) {
            return loopDepth.getOrDefault(i, 0);
        }
    }

    public Result annotate(Function function, LoopNest nest) {
        Set<Instruction> inLoop = new HashSet<>();
        Deque<Loop> stack = new ArrayDeque<>(nest.topLevelLoops());
        while (!stack.isEmpty()) {
            Loop loop = stack.pop();
            for (BasicBlock b : loop.blocks()) {
                inLoop.addAll(b.instructions());
            }
            for (Loop sub : loop.subLoops()) {
                stack.push(sub);
            }
        }

        Map<Instruction, Integer> depth = new HashMap<>();
        for (BasicBlock b : function.blocks()) {
            Loop innermost = nest.loopFor(b);
            if (innermost == null) {
                continue;
            }
            for (Instruction i : b.instructions()) {
                depth.put(i, innermost.depth());
            }
        }
        return new Result(inLoop, depth);
    }
}
