package com.branchprobe.extractor.ir;

public class Parameter extends Value {

    private final int index;
    private Function parent;

    Parameter(int index, IrType type, String name) {
        super(type, name);
        this.index = index;
    }

    public int index()        { return index; }
    public Function parent()  { return parent; }

    void setParent(Function parent) {
        this.parent = parent;
    }
}
