package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.InstructionPrinter;
import com.branchprobe.extractor.ir.TerminatorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns every block the display label a reader of the report can match against branch
 * targets. Labels are recovered from the printed text of branches, so they are exactly the
 * identifiers that appear after {@code label %} in the report.
 *
 * Total: a block no branch names and without a usable structural name keeps its
 * {@code <unnamed_N>} placeholder. Duplicate labels are allowed.
 */
public class BlockLabeler {

    private static final Pattern LABEL_TARGET = Pattern.compile("label %([^,\\s]+)");

    public Map<BasicBlock, String> label(Function function) {
        Map<BasicBlock, String> labels = new LinkedHashMap<>();
        List<BasicBlock> blocks = function.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            labels.put(blocks.get(i), placeholder(i));
        }

        InstructionPrinter printer = InstructionPrinter.forFunction(function);
        for (BasicBlock block : blocks) {
            Instruction term = block.terminator();
            if (term == null) {
                continue;
            }
            TerminatorKind kind = term.opcode().terminatorKind();
            if (kind != TerminatorKind.CONDITIONAL_BRANCH && kind != TerminatorKind.UNCONDITIONAL_BRANCH) {
                continue;
            }
            List<String> targets = targetIds(printer.print(term));
            List<BasicBlock> successors = term.successors();
            for (int s = 0; s < successors.size() && s < targets.size(); s++) {
                if (labels.containsKey(successors.get(s))) {
                    labels.put(successors.get(s), targets.get(s));
                }
            }
        }

        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            String name = block.name();
            if (labels.get(block).equals(placeholder(i)) && name != null && !name.isEmpty() && !name.equals("0")) {
                labels.put(block, name);
            }
        }
        return labels;
    }

    static List<String> targetIds(String branchText) {
        List<String> ids = new ArrayList<>();
        Matcher m = LABEL_TARGET.matcher(branchText);
        while (m.find()) {
            ids.add(m.group(1));
        }
        return ids;
    }

    private static String placeholder(int ordinal) {
        return "<unnamed_" + ordinal + ">";
    }
}
