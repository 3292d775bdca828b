package com.branchprobe.extractor.ir;

/** Comparison predicates of {@code icmp} (integer and pointer) and {@code fcmp}. */
public enum Predicate {
    EQ("eq"), NE("ne"), SGT("sgt"), SGE("sge"), SLT("slt"), SLE("sle"),
    UGT("ugt"), UGE("uge"), ULT("ult"), ULE("ule"),
    OEQ("oeq"), ONE("one"), OGT("ogt"), OGE("oge"), OLT("olt"), OLE("ole"),
    UEQ("ueq"), UNE("une"), UNO("uno");

    private final String text;

    Predicate(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public boolean isFloating() {
        return ordinal() >= OEQ.ordinal();
    }
}
