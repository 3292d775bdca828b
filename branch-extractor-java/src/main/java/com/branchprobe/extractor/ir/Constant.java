package com.branchprobe.extractor.ir;

import java.util.Objects;

/**
 * Compile-time constant operand. Integer and floating constants are immediates; the
 * {@code null} pointer, string literals and symbol references are pointer-typed constants.
 * {@code undef} stands for an operand of code no execution reaches.
 */
public final class Constant extends Value {

    public enum Kind { INTEGER, FLOATING, NULL, STRING, SYMBOL, UNDEF }

    private final Kind kind;
    private final long longValue;
    private final double doubleValue;
    private final String text;

    private Constant(IrType type, Kind kind, long longValue, double doubleValue, String text) {
        super(type, null);
        this.kind = kind;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.text = text;
    }

    public static Constant ofInt(IrType type, long value) {
        if (!type.isInteger()) {
            throw new IllegalArgumentException("Not an integer type: " + type);
        }
        return new Constant(type, Kind.INTEGER, value, 0, null);
    }

    public static Constant i1(boolean value)  { return ofInt(IrType.I1, value ? 1 : 0); }
    public static Constant i32(long value)    { return ofInt(IrType.I32, value); }
    public static Constant i64(long value)    { return ofInt(IrType.I64, value); }

    public static Constant ofFloating(IrType type, double value) {
        if (!type.isFloating()) {
            throw new IllegalArgumentException("Not a floating point type: " + type);
        }
        return new Constant(type, Kind.FLOATING, 0, value, null);
    }

    public static Constant nullPointer() {
        return new Constant(IrType.PTR, Kind.NULL, 0, 0, null);
    }

    public static Constant string(String value) {
        return new Constant(IrType.PTR, Kind.STRING, 0, 0, Objects.requireNonNull(value));
    }

    /** Reference to a named global entity (a class literal, a method handle). */
    public static Constant symbol(String name) {
        return new Constant(IrType.PTR, Kind.SYMBOL, 0, 0, Objects.requireNonNull(name));
    }

    public static Constant undef(IrType type) {
        return new Constant(type, Kind.UNDEF, 0, 0, null);
    }

    public Kind kind()            { return kind; }
    public long longValue()       { return longValue; }
    public double doubleValue()   { return doubleValue; }
    public String text()          { return text; }

    /** Integer or floating point constant. */
    public boolean isImmediate() {
        return kind == Kind.INTEGER || kind == Kind.FLOATING;
    }

    /** Operand text without the type, e.g. {@code 7}, {@code true}, {@code null}. */
    public String render() {
        return switch (kind) {
            case INTEGER -> type() == IrType.I1 ? (longValue != 0 ? "true" : "false") : Long.toString(longValue);
            case FLOATING -> Double.toString(doubleValue);
            case NULL -> "null";
            case STRING -> "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
            case SYMBOL -> "@" + text;
            case UNDEF -> "undef";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant other)) return false;
        return kind == other.kind && type() == other.type()
                && longValue == other.longValue
                && Double.compare(doubleValue, other.doubleValue) == 0
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type(), longValue, doubleValue, text);
    }

    @Override
    public String toString() {
        return type() + " " + render();
    }
}
