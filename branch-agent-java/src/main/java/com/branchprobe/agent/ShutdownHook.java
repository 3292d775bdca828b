package com.branchprobe.agent;

import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Releases the branch log and writes the branch index on JVM shutdown.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private final BranchOutcomeSink sink;
    private final BranchIndex index;
    private final Path indexPath;
    private final String program;

    /**
     * @param indexPath where to write the index, or null to skip it
     */
    public ShutdownHook(BranchOutcomeSink sink, BranchIndex index, Path indexPath, String program) {
        this.sink = sink;
        this.index = index;
        this.indexPath = indexPath;
        this.program = program;
    }

    @Override
    public void run() {
        try {
            sink.close();
        } catch (RuntimeException e) {
            System.err.println("[branch-agent] ERROR closing branch log: " + e.getMessage());
        }
        if (indexPath == null) {
            return;
        }
        try {
            write(buildDocument());
        } catch (Exception e) {
            System.err.println("[branch-agent] ERROR writing branch index: " + e.getMessage());
        }
    }

    BranchIndex.Document buildDocument() {
        BranchIndex.Document doc = new BranchIndex.Document();
        doc.program = program;
        doc.branches = index.sites();
        return doc;
    }

    void write(BranchIndex.Document doc) throws IOException {
        Path parent = indexPath.getParent() != null ? indexPath.getParent() : Path.of(".");
        Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(indexPath, StandardCharsets.UTF_8)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(doc, w);
        }
        System.err.println("[branch-agent] branch index written: " + indexPath
                + " (" + doc.branches.size() + " branches)");
    }
}
