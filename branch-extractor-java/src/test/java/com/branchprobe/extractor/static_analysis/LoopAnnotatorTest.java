package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.SampleFunctions;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.LoopNest;
import com.branchprobe.extractor.ir.Module;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoopAnnotatorTest {

    private final LoopAnnotator annotator = new LoopAnnotator();

    @Test
    void subLoopInstructionsCarryTheInnermostDepth() {
        Function f = SampleFunctions.nestedLoops(new Module("m"));
        LoopAnnotator.Result r = annotator.annotate(f, LoopNest.compute(f));

        for (BasicBlock b : f.blocks()) {
            int expected = switch (b.name()) {
                case "inner", "inner.body" -> 2;
                case "outer", "outer.latch" -> 1;
                default -> 0;
            };
            for (Instruction i : b.instructions()) {
                assertEquals(expected, r.depth(i), b.name());
                assertEquals(expected > 0, r.inLoop(i), b.name());
            }
        }
    }

    @Test
    void functionWithoutLoopsIsAllZero() {
        Function f = SampleFunctions.sign(new Module("m"));
        LoopAnnotator.Result r = annotator.annotate(f, LoopNest.compute(f));
        assertTrue(r.inLoop().isEmpty());
        for (Instruction i : f.instructions()) {
            assertEquals(0, r.depth(i));
        }
    }
}
