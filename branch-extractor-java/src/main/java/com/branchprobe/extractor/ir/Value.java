package com.branchprobe.extractor.ir;

/**
 * Anything that can appear as an instruction operand: an {@link Instruction} result,
 * a function {@link Parameter} or a {@link Constant}. Operands are references into the
 * function's value pool and are never owned by the instruction using them.
 */
public abstract class Value {

    private final IrType type;
    private final String name;

    protected Value(IrType type, String name) {
        this.type = type;
        this.name = name;
    }

    public IrType type() {
        return type;
    }

    /** Explicit name, or {@code null} when the printer has to number the value. */
    public String name() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }
}
