package com.branchprobe.extractor.history;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parses a dynamic branch log ({@code branchID,taken} per line) into per-branch outcome
 * sequences in log order. Branch IDs are unsigned 64-bit values. Malformed lines are
 * skipped with a warning.
 */
public class BranchHistoryReader {

    public static class HistoryReadException extends RuntimeException {
        public HistoryReadException(String message) { super(message); }
        public HistoryReadException(String message, Throwable cause) { super(message, cause); }
    }

    /** @return outcomes per branch ID, ordered by unsigned branch ID */
    public SortedMap<Long, List<Boolean>> read(Path log) {
        if (!Files.isRegularFile(log)) {
            throw new HistoryReadException("Branch log not found: " + log);
        }
        SortedMap<Long, List<Boolean>> outcomes = new TreeMap<>(Long::compareUnsigned);
        try (BufferedReader reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int comma = trimmed.indexOf(',');
                String taken = comma < 0 ? "" : trimmed.substring(comma + 1).trim();
                if (comma < 0 || !(taken.equals("0") || taken.equals("1"))) {
                    warn(log, lineNo, line);
                    continue;
                }
                long branchId;
                try {
                    branchId = Long.parseUnsignedLong(trimmed.substring(0, comma).trim());
                } catch (NumberFormatException e) {
                    warn(log, lineNo, line);
                    continue;
                }
                outcomes.computeIfAbsent(branchId, k -> new ArrayList<>()).add(taken.equals("1"));
            }
        } catch (IOException e) {
            throw new HistoryReadException("Failed to read branch log: " + log + ": " + e.getMessage(), e);
        }
        return outcomes;
    }

    private static void warn(Path log, int lineNo, String line) {
        System.err.println("[branch-extractor] WARNING: skipping malformed line " + lineNo + " of " + log + ": '" + line + "'");
    }
}
