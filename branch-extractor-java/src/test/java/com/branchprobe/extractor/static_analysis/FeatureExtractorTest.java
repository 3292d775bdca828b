package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.SampleFunctions;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.FunctionBuilder;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.MalformedFunctionException;
import com.branchprobe.extractor.ir.Module;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void defaultsArePredecessorsAndPerFunctionIds() {
        assertEquals(PropagationMode.PREDECESSORS, extractor.mode());
        assertEquals(BranchIdScope.FUNCTION, extractor.scope());
    }

    @Test
    void twoSequentialBlocksAreBothAtDistanceZero() {
        Function f = SampleFunctions.twoBlocks(new Module("m"));
        FunctionFeatures features = extractor.extract(f);

        for (Instruction i : f.instructions()) {
            assertEquals(0, features.record(i).distToControlFlow());
            assertNull(features.branchId(i));
        }
        assertTrue(features.branchIds().isEmpty());
    }

    @Test
    void threeBlockCycleIsOneLoopOfDepthOne() {
        Function f = SampleFunctions.simpleLoop(new Module("m"));
        FunctionFeatures features = extractor.extract(f);

        for (BasicBlock b : f.blocks()) {
            boolean inCycle = b.name().startsWith("loop.");
            for (Instruction i : b.instructions()) {
                assertEquals(inCycle, features.record(i).inLoop(), b.name());
                assertEquals(inCycle ? 1 : 0, features.record(i).loopDepth(), b.name());
            }
        }
    }

    @Test
    void terminatorsAreAlwaysAtDistanceZero() {
        Module m = new Module("m");
        for (Function f : List.of(SampleFunctions.sumTo(m), SampleFunctions.nestedLoops(m), SampleFunctions.sign(m))) {
            FunctionFeatures features = extractor.extract(f);
            for (Instruction i : f.instructions()) {
                if (i.isTerminator()) {
                    assertEquals(0, features.record(i).distToControlFlow(), f.name() + ": " + i);
                }
            }
        }
    }

    @Test
    void nestedLoopInstructionsReportTheInnerDepth() {
        Function f = SampleFunctions.nestedLoops(new Module("m"));
        FunctionFeatures features = extractor.extract(f);
        Instruction innerBranch = f.blocks().get(2).terminator();
        Instruction outerBranch = f.blocks().get(1).terminator();

        assertTrue(features.record(innerBranch).inLoop());
        assertEquals(2, features.record(innerBranch).loopDepth());
        assertEquals(1, features.record(outerBranch).loopDepth());
    }

    @Test
    void branchIdsAreExactlyZeroToKMinusOne() {
        Function f = SampleFunctions.sign(new Module("m"));
        FunctionFeatures features = extractor.extract(f);
        assertEquals(List.of(0L, 1L), new ArrayList<>(features.branchIds().values()));
    }

    @Test
    void runScopeContinuesIdsAcrossFunctions() {
        Module m = new Module("m");
        SampleFunctions.sign(m, "first");
        SampleFunctions.sign(m, "second");
        FeatureExtractor run = new FeatureExtractor(PropagationMode.PREDECESSORS, BranchIdScope.RUN);

        List<FunctionFeatures> all = run.extractAll(m);
        assertEquals(List.of(0L, 1L), new ArrayList<>(all.get(0).branchIds().values()));
        assertEquals(List.of(2L, 3L), new ArrayList<>(all.get(1).branchIds().values()));
    }

    @Test
    void functionScopeRestartsIdsPerFunction() {
        Module m = new Module("m");
        SampleFunctions.sign(m, "first");
        SampleFunctions.sign(m, "second");

        List<FunctionFeatures> all = extractor.extractAll(m);
        assertEquals(List.of(0L, 1L), new ArrayList<>(all.get(1).branchIds().values()));
    }

    @Test
    void malformedFunctionIsRejected() {
        Module m = new Module("m");
        Function f = openEnded(m, "broken");
        assertThrows(MalformedFunctionException.class, () -> extractor.extract(f));
    }

    @Test
    void malformedFunctionDoesNotStopTheOthers() {
        Module m = new Module("m");
        SampleFunctions.sign(m, "before");
        openEnded(m, "broken");
        SampleFunctions.sign(m, "after");

        List<FunctionFeatures> all = extractor.extractAll(m);
        assertEquals(2, all.size());
        assertEquals("before", all.get(0).function().name());
        assertEquals("after", all.get(1).function().name());
    }

    @Test
    void repeatedExtractionRendersIdentically() {
        Module m = new Module("m");
        SampleFunctions.sumTo(m);
        SampleFunctions.nestedLoops(m);
        FeatureReportWriter writer = new FeatureReportWriter();

        String first = writer.render(new FeatureExtractor().extractAll(m));
        String second = writer.render(new FeatureExtractor().extractAll(m));
        assertEquals(first, second);
    }

    private static Function openEnded(Module m, String name) {
        FunctionBuilder b = FunctionBuilder.define(m, name, IrType.I32);
        BasicBlock entry = b.block("entry");
        b.at(entry).add("x", Constant.i32(1), Constant.i32(2));
        return b.function();
    }
}
