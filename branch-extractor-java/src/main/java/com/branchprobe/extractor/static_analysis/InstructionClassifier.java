package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.Parameter;
import com.branchprobe.extractor.ir.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * Operand-kind and block-adjacency features of each instruction.
 */
public class InstructionClassifier {

    public record Classification(int numOperands,
                                 boolean memoryAccess,
                                 boolean registerOperand,
                                 boolean immediate,
                                 int numPredecessors,
                                 int numSuccessors) {}

    public Map<Instruction, Classification> classify(Function function) {
        Map<Instruction, Classification> result = new HashMap<>();
        for (BasicBlock b : function.blocks()) {
            int preds = b.predecessors().size();
            int succs = b.successors().size();
            for (Instruction i : b.instructions()) {
                Flags flags = operandFlags(i);
                if (i.opcode().isMemoryAccess()) {
                    flags.memory = true;
                }
                // A branch on a loaded or computed value inherits the producer's flags.
                Value condition = i.condition();
                if (condition instanceof Instruction producer) {
                    Flags cond = operandFlags(producer);
                    flags.memory |= cond.memory || producer.opcode().isMemoryAccess();
                    flags.register |= cond.register;
                    flags.immediate |= cond.immediate;
                }
                result.put(i, new Classification(i.numOperands(), flags.memory, flags.register,
                        flags.immediate, preds, succs));
            }
        }
        return result;
    }

    private static Flags operandFlags(Instruction i) {
        Flags f = new Flags();
        for (Value v : i.operands()) {
            if (v.type().isPointer()) f.memory = true;
            if (v instanceof Constant c && c.isImmediate()) f.immediate = true;
            if (v instanceof Instruction || v instanceof Parameter) f.register = true;
        }
        return f;
    }

    private static final class Flags {
        boolean memory;
        boolean register;
        boolean immediate;
    }
}
