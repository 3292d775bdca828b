package com.branchprobe.agent;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownHookTest {

    private static BranchIndex sampleIndex() {
        BranchIndex index = new BranchIndex();
        index.record(2, "com.example.Search", "find", "([II)I", 1);
        index.record(0, "com.example.Search", "main", "([Ljava/lang/String;)V", 0);
        index.record(1, "com.example.Search", "find", "([II)I", 0);
        return index;
    }

    @Test
    void closesSinkAndWritesIndex(@TempDir Path tmp) throws Exception {
        RecordingSink sink = new RecordingSink();
        Path indexPath = tmp.resolve("prog_branch_index.json");

        new ShutdownHook(sink, sampleIndex(), indexPath, "prog").run();

        assertTrue(sink.closed, "Shutdown must close the branch log");
        assertTrue(Files.exists(indexPath));
        try (Reader r = Files.newBufferedReader(indexPath)) {
            BranchIndex.Document doc = new Gson().fromJson(r, BranchIndex.Document.class);
            assertEquals("prog", doc.program);
            assertEquals(3, doc.branches.size());
            assertEquals(0, doc.branches.get(0).branchId, "Sites sorted by branch ID");
            assertEquals(1, doc.branches.get(1).branchId);
            assertEquals("find", doc.branches.get(1).method);
            assertEquals(0, doc.branches.get(1).ordinal);
        }
    }

    @Test
    void jsonUsesSnakeCaseKeys(@TempDir Path tmp) throws Exception {
        Path indexPath = tmp.resolve("idx.json");
        new ShutdownHook(new RecordingSink(), sampleIndex(), indexPath, "prog").run();
        String json = Files.readString(indexPath);
        assertTrue(json.contains("\"branch_id\""));
        assertTrue(json.contains("\"ordinal\""));
    }

    @Test
    void deterministicOutput(@TempDir Path tmp) throws Exception {
        Path p1 = tmp.resolve("a.json");
        Path p2 = tmp.resolve("b.json");
        new ShutdownHook(new RecordingSink(), sampleIndex(), p1, "prog").run();
        new ShutdownHook(new RecordingSink(), sampleIndex(), p2, "prog").run();
        assertEquals(Files.readString(p1), Files.readString(p2));
    }

    @Test
    void outputDirCreatedIfAbsent(@TempDir Path tmp) {
        Path nested = tmp.resolve("a/b/idx.json");
        new ShutdownHook(new RecordingSink(), sampleIndex(), nested, "prog").run();
        assertTrue(Files.exists(nested));
    }

    @Test
    void nullIndexPathOnlyClosesSink(@TempDir Path tmp) throws Exception {
        RecordingSink sink = new RecordingSink();
        new ShutdownHook(sink, sampleIndex(), null, "prog").run();
        assertTrue(sink.closed);
        try (var files = Files.list(tmp)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void closesRealLoggerSoLinesSurvive(@TempDir Path tmp) throws Exception {
        DynamicLogger logger = new DynamicLogger(tmp, new ProgramIdResolver(n -> null));
        logger.setProgramId("prog");
        logger.record(5, true);
        new ShutdownHook(logger, new BranchIndex(), null, "prog").run();
        assertEquals(DynamicLogger.State.CLOSED, logger.state());
        assertEquals("5,1\n", Files.readString(tmp.resolve("prog_branch_history.log")));
    }
}
