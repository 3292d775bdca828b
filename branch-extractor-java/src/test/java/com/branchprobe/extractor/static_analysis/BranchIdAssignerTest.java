package com.branchprobe.extractor.static_analysis;

import com.branchprobe.agent.BranchIdSequence;
import com.branchprobe.extractor.SampleFunctions;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.Module;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BranchIdAssignerTest {

    private final BranchIdAssigner assigner = new BranchIdAssigner();

    @Test
    void conditionalBranchesAreNumberedInBlockOrder() {
        Function f = SampleFunctions.sign(new Module("m"));
        Map<Instruction, Long> ids = assigner.assign(f, new BranchIdSequence());

        assertEquals(List.of(0L, 1L), new ArrayList<>(ids.values()));
        assertSame(f.blocks().get(0).terminator(), ids.keySet().iterator().next());
    }

    @Test
    void unconditionalBranchesGetNoId() {
        Function f = SampleFunctions.twoBlocks(new Module("m"));
        assertTrue(assigner.assign(f, new BranchIdSequence()).isEmpty());
    }

    @Test
    void sharedSequenceContinuesAcrossFunctions() {
        Module m = new Module("m");
        BranchIdSequence run = new BranchIdSequence();
        Map<Instruction, Long> first = assigner.assign(SampleFunctions.sign(m, "a"), run);
        Map<Instruction, Long> second = assigner.assign(SampleFunctions.sign(m, "b"), run);

        assertEquals(List.of(0L, 1L), new ArrayList<>(first.values()));
        assertEquals(List.of(2L, 3L), new ArrayList<>(second.values()));
        assertEquals(4L, run.peek());
    }

    @Test
    void independentSequencesDoNotInterfere() {
        Function f = SampleFunctions.nestedLoops(new Module("m"));
        Map<Instruction, Long> a = assigner.assign(f, new BranchIdSequence());
        Map<Instruction, Long> b = assigner.assign(f, new BranchIdSequence());
        assertEquals(a, b);
        assertEquals(List.of(0L, 1L), new ArrayList<>(a.values()));
    }
}
