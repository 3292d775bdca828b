package com.branchprobe.extractor.ir;

/**
 * First-class value types of the IR. Pointers are opaque, as in LLVM since opaque pointers.
 */
public enum IrType {
    VOID("void", 0),
    I1("i1", 1),
    I8("i8", 8),
    I16("i16", 16),
    I32("i32", 32),
    I64("i64", 64),
    FLOAT("float", 32),
    DOUBLE("double", 64),
    PTR("ptr", 64),
    LABEL("label", 0);

    private final String text;
    private final int bits;

    IrType(String text, int bits) {
        this.text = text;
        this.bits = bits;
    }

    public String text() { return text; }
    public int bits()    { return bits; }

    public boolean isInteger()  { return this == I1 || this == I8 || this == I16 || this == I32 || this == I64; }
    public boolean isFloating() { return this == FLOAT || this == DOUBLE; }
    public boolean isPointer()  { return this == PTR; }

    @Override
    public String toString() {
        return text;
    }
}
