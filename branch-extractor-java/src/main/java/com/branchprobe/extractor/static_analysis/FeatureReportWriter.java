package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.InstructionPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes extracted features to the control-flow features text format:
 *
 * <pre>
 * Control-flow features for function: &lt;name&gt;
 * Branch ID scope: function, distance propagation: predecessors
 * &lt;label&gt;:
 * BranchID: 0   br i1 %cmp, label %4, label %6: [in_loop: 0, dist_to_control_flow: 0, ...]
 *   Depends on:   %cmp = icmp sgt i32 %3, 0
 * </pre>
 *
 * Output is a pure function of the features: {@code \n} line endings, dependencies sorted by
 * instruction position, functions separated by one blank line.
 */
public class FeatureReportWriter {

    public static final String FILE_SUFFIX = "_control_flow_features.txt";

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    public String render(FunctionFeatures features) {
        StringBuilder sb = new StringBuilder();
        Function function = features.function();
        InstructionPrinter printer = InstructionPrinter.forFunction(function);

        Map<Instruction, Integer> position = new HashMap<>();
        for (Instruction i : function.instructions()) {
            position.put(i, position.size());
        }

        sb.append("Control-flow features for function: ").append(function.name()).append('\n');
        sb.append("Branch ID scope: ").append(features.scope().text())
          .append(", distance propagation: ").append(features.mode().text()).append('\n');
        for (BasicBlock block : function.blocks()) {
            sb.append(features.label(block)).append(":\n");
            for (Instruction i : block.instructions()) {
                Long branchId = features.branchId(i);
                if (branchId != null) {
                    sb.append("BranchID: ").append(Long.toUnsignedString(branchId)).append("   ");
                }
                sb.append(printer.print(i)).append(": ").append(features.record(i).render()).append('\n');

                List<Instruction> deps = new ArrayList<>(features.dependencies(i));
                if (!deps.isEmpty()) {
                    deps.sort(Comparator.comparingInt(position::get));
                    sb.append("  Depends on:   ");
                    for (int d = 0; d < deps.size(); d++) {
                        if (d > 0) sb.append(", ");
                        sb.append(printer.print(deps.get(d)));
                    }
                    sb.append('\n');
                }
            }
        }
        return sb.toString();
    }

    public String render(List<FunctionFeatures> all) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < all.size(); k++) {
            if (k > 0) sb.append('\n');
            sb.append(render(all.get(k)));
        }
        return sb.toString();
    }

    public void write(List<FunctionFeatures> all, Writer out) throws IOException {
        out.write(render(all));
        out.flush();
    }

    /**
     * Writes {@code outputDir/<baseName>_control_flow_features.txt}, creating the directory
     * if absent.
     *
     * @return the written file
     */
    public Path write(List<FunctionFeatures> all, Path outputDir, String baseName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }
        Path report = outputDir.resolve(baseName + FILE_SUFFIX);
        try (Writer w = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            write(all, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + report + ": " + e.getMessage(), e);
        }
        System.err.println("[branch-extractor] features written: " + report);
        return report;
    }
}
