package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Distance from every instruction to the nearest control-flow instruction (branch, switch,
 * call, return, throw), capped at {@link #MAX}.
 *
 * Blocks whose terminator is control-flow significant are seeded with distance 0 and a
 * multi-source BFS relaxes neighbours to {@code d + 1} when strictly smaller. Inside a block
 * the walk goes backward from the last instruction: control-flow instructions get 0 and
 * restart the count, each earlier instruction gets one more than its successor. Instructions
 * left without a value (those after the last control-flow instruction of a block lacking a
 * terminator) take the block distance.
 */
public class DistancePropagator {

    /** Sentinel for "no control-flow instruction reachable". */
    public static final int MAX = 999;

    private final PropagationMode mode;

    public DistancePropagator() {
        this(PropagationMode.PREDECESSORS);
    }

    public DistancePropagator(PropagationMode mode) {
        this.mode = mode;
    }

    public PropagationMode mode() {
        return mode;
    }

    public Map<BasicBlock, Integer> blockDistances(Function function) {
        Map<BasicBlock, Integer> dist = new LinkedHashMap<>();
        Queue<BasicBlock> queue = new ArrayDeque<>();
        for (BasicBlock b : function.blocks()) {
            Instruction term = b.terminator();
            if (term != null && term.opcode().isControlFlow()) {
                dist.put(b, 0);
                queue.add(b);
            } else {
                dist.put(b, MAX);
            }
        }

        while (!queue.isEmpty()) {
            BasicBlock current = queue.poll();
            int next = dist.get(current) + 1;
            for (BasicBlock neighbour : neighbours(current)) {
                Integer known = dist.get(neighbour);
                if (known != null && known > next) {
                    dist.put(neighbour, next);
                    queue.add(neighbour);
                }
            }
        }
        return dist;
    }

    public Map<Instruction, Integer> propagate(Function function) {
        Map<BasicBlock, Integer> blockDist = blockDistances(function);
        Map<Instruction, Integer> result = new HashMap<>();
        for (BasicBlock b : function.blocks()) {
            List<Instruction> insts = b.instructions();
            int next = -1;
            for (int k = insts.size() - 1; k >= 0; k--) {
                Instruction i = insts.get(k);
                if (i.opcode().isControlFlow()) {
                    result.put(i, 0);
                    next = 1;
                } else if (next >= 0) {
                    result.put(i, next);
                    next = Math.min(next + 1, MAX);
                } else {
                    result.put(i, blockDist.get(b));
                }
            }
        }
        return result;
    }

    private List<BasicBlock> neighbours(BasicBlock b) {
        if (mode == PropagationMode.PREDECESSORS) {
            return b.predecessors();
        }
        List<BasicBlock> all = new ArrayList<>(b.predecessors());
        all.addAll(b.successors());
        return all;
    }
}
