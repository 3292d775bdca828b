package com.branchprobe.extractor.static_analysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropagationModeTest {

    @Test
    void parsesReportNames() {
        assertEquals(PropagationMode.PREDECESSORS, PropagationMode.fromText("predecessors"));
        assertEquals(PropagationMode.BIDIRECTIONAL, PropagationMode.fromText("bidirectional"));
        assertEquals(BranchIdScope.FUNCTION, BranchIdScope.fromText("function"));
        assertEquals(BranchIdScope.RUN, BranchIdScope.fromText("run"));
    }

    @Test
    void textRoundTripsThroughFromText() {
        for (PropagationMode m : PropagationMode.values()) {
            assertSame(m, PropagationMode.fromText(m.text()));
        }
        for (BranchIdScope s : BranchIdScope.values()) {
            assertSame(s, BranchIdScope.fromText(s.text()));
        }
    }

    @Test
    void unknownNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PropagationMode.fromText("successors"));
        assertThrows(IllegalArgumentException.class, () -> BranchIdScope.fromText("global"));
    }
}
