package com.branchprobe.agent;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, flush-per-event log of branch outcomes for one program run.
 *
 * The log file is opened lazily on the first event at
 * {@code <logDir>/<programId>_branch_history.log}; every event becomes one
 * {@code branchID,taken} line ({@code taken} is 0 or 1) and is flushed before
 * {@link #record} returns. Open/write/flush run under one lock, so lines written
 * from concurrent threads never interleave.
 *
 * Failures never reach the caller: a missing log directory produces a warning, and
 * if the file cannot be opened the logger drops all further events without retrying.
 */
public class DynamicLogger implements BranchOutcomeSink {

    public static final String DEFAULT_LOG_DIR = "branch_history_logs";
    public static final String LOG_SUFFIX = "_branch_history.log";

    public enum State { UNINITIALIZED, OPEN, FAILED, CLOSED }

    private final Path logDir;
    private final ProgramIdResolver resolver;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String explicitProgramId;
    private State state = State.UNINITIALIZED;
    private BufferedWriter writer;
    private Path logPath;

    public DynamicLogger(Path logDir) {
        this(logDir, new ProgramIdResolver());
    }

    public DynamicLogger(Path logDir, ProgramIdResolver resolver) {
        this.logDir = logDir;
        this.resolver = resolver;
    }

    /**
     * Sets the program identifier explicitly. Only effective before the first event,
     * since the file name is fixed once the log is open.
     */
    public void setProgramId(String programId) {
        this.explicitProgramId = programId;
    }

    @Override
    public void record(long branchId, boolean taken) {
        lock.lock();
        try {
            if (state == State.UNINITIALIZED) {
                open();
            }
            if (state != State.OPEN) {
                return;
            }
            writer.write(Long.toUnsignedString(branchId));
            writer.write(taken ? ",1\n" : ",0\n");
            writer.flush();
        } catch (IOException e) {
            System.err.println("[branch-agent] ERROR writing " + logPath + ": " + e.getMessage()
                    + " (further branch outcomes are dropped)");
            state = State.FAILED;
            closeQuietly();
        } finally {
            lock.unlock();
        }
    }

    private void open() {
        String programId = resolver.resolve(explicitProgramId);
        logPath = logDir.resolve(programId + LOG_SUFFIX);

        if (!Files.isDirectory(logDir)) {
            System.err.println("[branch-agent] WARNING: log directory does not exist: " + logDir);
        }
        try {
            writer = Files.newBufferedWriter(logPath, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            state = State.OPEN;
        } catch (IOException e) {
            System.err.println("[branch-agent] ERROR: failed to open " + logPath + ": " + e);
            state = State.FAILED;
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (state == State.OPEN) {
                closeQuietly();
            }
            state = State.CLOSED;
        } finally {
            lock.unlock();
        }
    }

    private void closeQuietly() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            System.err.println("[branch-agent] WARNING: failed to close " + logPath + ": " + e.getMessage());
        } finally {
            writer = null;
        }
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Path of the log file, or {@code null} before the first event. */
    public Path logPath() {
        lock.lock();
        try {
            return logPath;
        } finally {
            lock.unlock();
        }
    }
}
