package com.branchprobe.extractor.ir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical textual form of instructions, close to LLVM assembly:
 * {@code %3 = add i32 %1, 7}, {@code br i1 %cmp, label %if.then, label %8}.
 *
 * Unnamed parameters, unnamed blocks and unnamed value-producing instructions share one
 * numbering sequence per function, assigned in that order (parameters first, then each
 * block's label followed by its instructions), the way LLVM's slot tracker numbers them.
 * A printer is a snapshot: create a new one after the function changes.
 */
public class InstructionPrinter {

    private static final Pattern PLAIN_NAME = Pattern.compile("[-a-zA-Z$._][-a-zA-Z$._0-9]*");

    private final Map<Object, Integer> slots = new IdentityHashMap<>();

    private InstructionPrinter(Function function) {
        int next = 0;
        if (function == null) {
            return;
        }
        for (Parameter p : function.parameters()) {
            if (!p.hasName()) slots.put(p, next++);
        }
        for (BasicBlock b : function.blocks()) {
            if (b.name() == null || b.name().isEmpty()) slots.put(b, next++);
            for (Instruction i : b.instructions()) {
                if (i.producesValue() && !i.hasName()) slots.put(i, next++);
            }
        }
    }

    public static InstructionPrinter forFunction(Function function) {
        return new InstructionPrinter(function);
    }

    static String printDetached(Instruction instruction) {
        return new InstructionPrinter(null).print(instruction);
    }

    /** Identifier of a block as it appears after {@code label}, without the {@code %}. */
    public String blockId(BasicBlock block) {
        if (block.name() != null && !block.name().isEmpty()) {
            return quote(block.name());
        }
        Integer slot = slots.get(block);
        return slot == null ? "<badref>" : slot.toString();
    }

    /** Value reference without type: {@code %x}, {@code %4}, {@code 7}. */
    public String ref(Value v) {
        if (v instanceof Constant c) {
            return c.render();
        }
        if (v.hasName()) {
            return "%" + quote(v.name());
        }
        Integer slot = slots.get(v);
        return slot == null ? "%<badref>" : "%" + slot;
    }

    public String print(Instruction i) {
        StringBuilder sb = new StringBuilder();
        if (i.producesValue()) {
            sb.append(ref(i)).append(" = ");
        }
        sb.append(i.opcode().mnemonic());
        switch (i.opcode()) {
            case ICMP, FCMP -> sb.append(' ').append(i.predicate().text()).append(' ')
                    .append(typed(i.operand(0))).append(", ").append(ref(i.operand(1)));
            case CMP -> sb.append(' ').append(typed(i.operand(0))).append(", ").append(ref(i.operand(1)));
            case FNEG, ARRAYLENGTH -> sb.append(' ').append(typed(i.operand(0)));
            case ALLOCA -> sb.append(' ').append(i.elementType());
            case LOAD -> {
                sb.append(' ').append(i.type());
                for (Value v : i.operands()) sb.append(", ").append(typed(v));
                if (i.symbol() != null) sb.append(", @").append(i.symbol());
            }
            case STORE -> {
                sb.append(' ').append(joinTyped(i.operands()));
                if (i.symbol() != null) sb.append(", @").append(i.symbol());
            }
            case GETELEMENTPTR -> sb.append(' ').append(i.elementType()).append(", ").append(joinTyped(i.operands()));
            case NEW -> {
                sb.append(" ptr @").append(i.symbol());
                for (Value v : i.operands()) sb.append(", ").append(typed(v));
            }
            case INSTANCEOF -> sb.append(' ').append(typed(i.operand(0))).append(", @").append(i.symbol());
            case LANDINGPAD -> {
                sb.append(" ptr");
                sb.append(i.symbol() != null ? " catch @" + i.symbol() : " cleanup");
            }
            case CALL -> sb.append(' ').append(i.type()).append(" @").append(i.symbol())
                    .append('(').append(joinTyped(i.operands())).append(')');
            case INVOKE -> sb.append(' ').append(i.type()).append(" @").append(i.symbol())
                    .append('(').append(joinTyped(i.operands())).append(')')
                    .append(" to ").append(label(i.successors().get(0)))
                    .append(" unwind ").append(label(i.successors().get(1)));
            case BR -> sb.append(' ').append(label(i.successors().get(0)));
            case CONDBR -> sb.append(' ').append(typed(i.operand(0)))
                    .append(", ").append(label(i.successors().get(0)))
                    .append(", ").append(label(i.successors().get(1)));
            case SWITCH -> {
                sb.append(' ').append(typed(i.operand(0))).append(", ").append(label(i.successors().get(0))).append(" [");
                List<Constant> cases = i.caseValues();
                for (int c = 0; c < cases.size(); c++) {
                    if (c > 0) sb.append(", ");
                    sb.append(typed(cases.get(c))).append(", ").append(label(i.successors().get(c + 1)));
                }
                sb.append(']');
            }
            case INDIRECTBR -> {
                sb.append(' ').append(typed(i.operand(0))).append(", [");
                for (int s = 0; s < i.successors().size(); s++) {
                    if (s > 0) sb.append(", ");
                    sb.append(label(i.successors().get(s)));
                }
                sb.append(']');
            }
            case RET -> sb.append(' ').append(i.numOperands() == 0 ? "void" : typed(i.operand(0)));
            case THROW -> sb.append(' ').append(typed(i.operand(0)));
            default -> {
                if (i.opcode().isCast()) {
                    sb.append(' ').append(typed(i.operand(0))).append(" to ").append(i.type());
                } else {
                    // binary arithmetic
                    sb.append(' ').append(typed(i.operand(0))).append(", ").append(ref(i.operand(1)));
                }
            }
        }
        return sb.toString();
    }

    private String typed(Value v) {
        return v.type() + " " + ref(v);
    }

    private String joinTyped(List<Value> values) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < values.size(); k++) {
            if (k > 0) sb.append(", ");
            sb.append(typed(values.get(k)));
        }
        return sb.toString();
    }

    private String label(BasicBlock b) {
        return "label %" + blockId(b);
    }

    private static String quote(String name) {
        return PLAIN_NAME.matcher(name).matches() ? name : "\"" + name.replace("\"", "\\22") + "\"";
    }
}
