package com.branchprobe.extractor.ir;

/**
 * Instruction opcodes with their textual mnemonic and control-flow classification.
 *
 * {@link #BR} is the unconditional branch and {@link #CONDBR} the conditional one; both
 * print as {@code br}. {@link #INVOKE} is a call that terminates its block (normal and
 * unwind successors). {@link #THROW} leaves the function by exception and is classified
 * with the {@link TerminatorKind#RETURN} kind.
 */
public enum Opcode {
    // integer arithmetic
    ADD("add"), SUB("sub"), MUL("mul"), SDIV("sdiv"), SREM("srem"),
    AND("and"), OR("or"), XOR("xor"), SHL("shl"), ASHR("ashr"), LSHR("lshr"),
    // floating point arithmetic
    FADD("fadd"), FSUB("fsub"), FMUL("fmul"), FDIV("fdiv"), FREM("frem"), FNEG("fneg"),
    // comparisons
    ICMP("icmp"), FCMP("fcmp"), CMP("cmp"),
    // conversions
    SEXT("sext"), ZEXT("zext"), TRUNC("trunc"), SITOFP("sitofp"), FPTOSI("fptosi"),
    FPEXT("fpext"), FPTRUNC("fptrunc"), BITCAST("bitcast"),
    // memory
    ALLOCA("alloca"), LOAD("load"), STORE("store"), GETELEMENTPTR("getelementptr"),
    // object model
    NEW("new"), ARRAYLENGTH("arraylength"), INSTANCEOF("instanceof"), LANDINGPAD("landingpad"),
    // calls
    CALL("call"), INVOKE("invoke"),
    // terminators
    BR("br"), CONDBR("br"), INDIRECTBR("indirectbr"), SWITCH("switch"), RET("ret"), THROW("throw");

    private final String mnemonic;

    Opcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public boolean isTerminator() {
        return terminatorKind() != null;
    }

    /** Kind of a terminator opcode, or {@code null} for non-terminators. */
    public TerminatorKind terminatorKind() {
        return switch (this) {
            case CONDBR -> TerminatorKind.CONDITIONAL_BRANCH;
            case BR -> TerminatorKind.UNCONDITIONAL_BRANCH;
            case INDIRECTBR -> TerminatorKind.INDIRECT_BRANCH;
            case SWITCH -> TerminatorKind.SWITCH;
            case INVOKE -> TerminatorKind.CALL;
            case RET, THROW -> TerminatorKind.RETURN;
            default -> null;
        };
    }

    /** Branches, switches, calls (terminating or not), returns and throws. */
    public boolean isControlFlow() {
        return isTerminator() || this == CALL;
    }

    public boolean isMemoryAccess() {
        return this == LOAD || this == STORE;
    }

    public boolean isBinary() {
        return switch (this) {
            case ADD, SUB, MUL, SDIV, SREM, AND, OR, XOR, SHL, ASHR, LSHR,
                 FADD, FSUB, FMUL, FDIV, FREM -> true;
            default -> false;
        };
    }

    public boolean isCast() {
        return switch (this) {
            case SEXT, ZEXT, TRUNC, SITOFP, FPTOSI, FPEXT, FPTRUNC, BITCAST -> true;
            default -> false;
        };
    }
}
