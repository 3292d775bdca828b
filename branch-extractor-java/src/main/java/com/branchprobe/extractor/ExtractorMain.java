package com.branchprobe.extractor;

import com.branchprobe.extractor.bytecode.ClassFileReader;
import com.branchprobe.extractor.config.ConfigReader;
import com.branchprobe.extractor.config.ExtractorConfig;
import com.branchprobe.extractor.history.BranchHistoryReader;
import com.branchprobe.extractor.history.BranchHistorySummary;
import com.branchprobe.extractor.ir.Module;
import com.branchprobe.extractor.static_analysis.BranchIdScope;
import com.branchprobe.extractor.static_analysis.FeatureExtractor;
import com.branchprobe.extractor.static_analysis.FeatureReportWriter;
import com.branchprobe.extractor.static_analysis.FunctionFeatures;
import com.branchprobe.extractor.static_analysis.PropagationMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the branch-extractor-java CLI.
 *
 * Usage:
 *   java -jar branch-extractor-java.jar extract \
 *     --input  <class-file|jar|dir> \
 *     --output <output-dir> \
 *     [--config <extractor.json>] [--mode predecessors|bidirectional] [--scope function|run]
 *
 *   java -jar branch-extractor-java.jar summarize --log <branch-log.csv>
 */
public class ExtractorMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[branch-extractor] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar branch-extractor-java.jar extract --input <path> --output <dir> "
                    + "[--config <json>] [--mode predecessors|bidirectional] [--scope function|run]");
            System.err.println("       java -jar branch-extractor-java.jar summarize --log <file>");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[branch-extractor] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "extract" -> extract(args);
            case "summarize" -> summarize(args);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    private static void extract(String[] args) {
        String inputPath = null;
        String outputDir = null;
        String configPath = null;
        PropagationMode mode = null;
        BranchIdScope scope = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> inputPath  = requireNext(args, i++, "--input");
                case "--output" -> outputDir  = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--mode"   -> mode  = parse(requireNext(args, i++, "--mode"), PropagationMode::fromText);
                case "--scope"  -> scope = parse(requireNext(args, i++, "--scope"), BranchIdScope::fromText);
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (inputPath == null) throw new UsageException("--input is required");

        ExtractorConfig config = configPath != null
                ? new ConfigReader().read(Paths.get(configPath))
                : new ExtractorConfig();
        // Flags win over the config file
        if (mode == null) mode = config.getPropagationMode();
        if (scope == null) scope = config.getBranchIdScope();
        if (outputDir == null) outputDir = config.getOutputDir();
        if (outputDir == null) throw new UsageException("--output is required (or output_dir in --config)");

        Path input = Paths.get(inputPath);
        Path output = Paths.get(outputDir);

        System.err.println("[branch-extractor] Reading classes: " + input);
        List<Module> modules = new ClassFileReader(config.getIncludeMethods()).readAll(input);

        FeatureExtractor extractor = new FeatureExtractor(mode, scope);
        FeatureReportWriter writer = new FeatureReportWriter();
        int functions = 0;
        for (Module module : modules) {
            List<FunctionFeatures> features = extractor.extractAll(module);
            if (features.isEmpty()) continue;
            writer.write(features, output, module.name());
            functions += features.size();
        }
        System.err.println("[branch-extractor] Done: " + functions + " functions from "
                + modules.size() + " classes (" + mode.text() + ", " + scope.text() + ")");
    }

    private static void summarize(String[] args) {
        String logPath = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--log")) {
                logPath = requireNext(args, i++, "--log");
            } else {
                throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (logPath == null) throw new UsageException("--log is required");

        Map<Long, List<Boolean>> outcomes = new BranchHistoryReader().read(Paths.get(logPath));
        BranchHistorySummary summary = new BranchHistorySummary();
        System.out.print(summary.render(summary.summarize(outcomes)));
        System.out.flush();
    }

    private static <T> T parse(String text, java.util.function.Function<String, T> parser) {
        try {
            return parser.apply(text);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
