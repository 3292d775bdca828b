package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.SampleFunctions;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.FunctionBuilder;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.Module;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.branchprobe.extractor.ir.FunctionBuilder.param;
import static org.junit.jupiter.api.Assertions.*;

class DistancePropagatorTest {

    @Test
    void countsUpBackwardFromTheTerminator() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.I32, param("x", IrType.I32));
        b.at(b.block("entry"));
        Instruction a = b.add("a", b.param(0), Constant.i32(1));
        Instruction c = b.add("c", a, Constant.i32(2));
        Instruction ret = b.ret(c);

        Map<Instruction, Integer> dist = new DistancePropagator().propagate(b.function());
        assertEquals(2, dist.get(a));
        assertEquals(1, dist.get(c));
        assertEquals(0, dist.get(ret));
    }

    @Test
    void callRestartsTheCount() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.I32, param("x", IrType.I32));
        b.at(b.block("entry"));
        Instruction before = b.add("before", b.param(0), Constant.i32(1));
        Instruction call = b.call(null, IrType.VOID, "work");
        Instruction after = b.add("after", before, Constant.i32(1));
        Instruction ret = b.ret(after);

        Map<Instruction, Integer> dist = new DistancePropagator().propagate(b.function());
        assertEquals(1, dist.get(before));
        assertEquals(0, dist.get(call));
        assertEquals(1, dist.get(after));
        assertEquals(0, dist.get(ret));
    }

    @Test
    void everyTerminatorIsAtDistanceZero() {
        Function f = SampleFunctions.sumTo(new Module("m"));
        Map<Instruction, Integer> dist = new DistancePropagator().propagate(f);
        for (BasicBlock block : f.blocks()) {
            assertEquals(0, dist.get(block.terminator()), block.name());
        }
        assertEquals(f.instructions().size(), dist.size());
    }

    @Test
    void blockWithoutPathToControlFlowGetsMax() {
        Function f = deadSuccessor();
        Instruction orphan = f.blocks().get(2).instructions().get(0);

        Map<Instruction, Integer> dist = new DistancePropagator(PropagationMode.PREDECESSORS).propagate(f);
        assertEquals(DistancePropagator.MAX, dist.get(orphan));
    }

    @Test
    void bidirectionalModeAlsoRelaxesSuccessors() {
        Function f = deadSuccessor();
        Instruction orphan = f.blocks().get(2).instructions().get(0);

        DistancePropagator bidirectional = new DistancePropagator(PropagationMode.BIDIRECTIONAL);
        assertEquals(1, bidirectional.propagate(f).get(orphan));
        assertEquals(1, bidirectional.blockDistances(f).get(f.blocks().get(2)));
        assertEquals(PropagationMode.BIDIRECTIONAL, bidirectional.mode());
    }

    @Test
    void modesAgreeOnWellFormedFunctions() {
        Function f = SampleFunctions.nestedLoops(new Module("m"));
        assertEquals(new DistancePropagator(PropagationMode.PREDECESSORS).propagate(f),
                new DistancePropagator(PropagationMode.BIDIRECTIONAL).propagate(f));
    }

    @Test
    void longStraightRunIsCapped() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "long_run", IrType.I32, param("x", IrType.I32));
        b.at(b.block("entry"));
        Instruction first = null;
        Instruction v = null;
        for (int k = 0; k < DistancePropagator.MAX + 10; k++) {
            v = b.add(null, v == null ? b.param(0) : v, Constant.i32(1));
            if (first == null) first = v;
        }
        b.ret(v);

        assertEquals(DistancePropagator.MAX, new DistancePropagator().propagate(b.function()).get(first));
    }

    /**
     * {@code entry: ret void}; unreachable {@code u: br label %v}; unreachable {@code v} with one
     * add and no terminator.
     */
    private static Function deadSuccessor() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "dead", IrType.VOID);
        BasicBlock entry = b.block("entry");
        BasicBlock u = b.block("u");
        BasicBlock v = b.block("v");
        b.at(entry).retVoid();
        b.at(u).br(v);
        b.at(v).add("orphan", Constant.i32(1), Constant.i32(2));
        return b.function();
    }
}
