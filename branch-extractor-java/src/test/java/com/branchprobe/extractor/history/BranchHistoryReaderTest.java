package com.branchprobe.extractor.history;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class BranchHistoryReaderTest {

    @TempDir
    Path tempDir;

    private final BranchHistoryReader reader = new BranchHistoryReader();

    @Test
    void groupsOutcomesPerBranchInLogOrder() throws Exception {
        Path log = tempDir.resolve("prog_branch_history.log");
        Files.writeString(log, "1,1\n0,0\n1,0\n0,1\n1,1\n");

        SortedMap<Long, List<Boolean>> outcomes = reader.read(log);
        assertEquals(List.of(0L, 1L), List.copyOf(outcomes.keySet()));
        assertEquals(List.of(false, true), outcomes.get(0L));
        assertEquals(List.of(true, false, true), outcomes.get(1L));
    }

    @Test
    void idsAreOrderedAsUnsigned() throws Exception {
        Path log = tempDir.resolve("big.log");
        Files.writeString(log, "18446744073709551615,1\n3,0\n");

        SortedMap<Long, List<Boolean>> outcomes = reader.read(log);
        assertEquals(List.of(3L, -1L), List.copyOf(outcomes.keySet()));
    }

    @Test
    void malformedLinesAreSkippedWithAWarning() throws Exception {
        Path log = tempDir.resolve("noisy.log");
        Files.writeString(log, "0,1\nnot a line\n\n2,7\nx,1\n0,0\n");

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
        SortedMap<Long, List<Boolean>> outcomes;
        try {
            outcomes = reader.read(log);
        } finally {
            System.setErr(originalErr);
        }

        assertEquals(1, outcomes.size());
        assertEquals(List.of(true, false), outcomes.get(0L));
        String warnings = err.toString(StandardCharsets.UTF_8);
        assertEquals(3, warnings.lines().filter(l -> l.contains("WARNING")).count(), warnings);
    }

    @Test
    void missingLogIsAnError() {
        assertThrows(BranchHistoryReader.HistoryReadException.class,
                () -> reader.read(tempDir.resolve("absent.log")));
    }
}
