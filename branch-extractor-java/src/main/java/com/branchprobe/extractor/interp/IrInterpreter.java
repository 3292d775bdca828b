package com.branchprobe.extractor.interp;

import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.Module;
import com.branchprobe.extractor.ir.Predicate;
import com.branchprobe.extractor.ir.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reference interpreter for the IR. Integers are carried as sign-normalized {@code Long}s
 * ({@code i1} as 0 or 1), floating point values as {@code Double}s, pointers as
 * {@link Pointer}s or {@code null}.
 *
 * Calls to functions defined in the same module are interpreted; calls to declarations go
 * to the {@link CallHandler}. Exceptions ({@code throw}, {@code landingpad}) and
 * {@code indirectbr} are not executable.
 */
public class IrInterpreter {

    public static class IrExecutionException extends RuntimeException {
        public IrExecutionException(String msg) { super(msg); }
    }

    /** Address of a mutable location. */
    public interface Pointer {
        Object load();
        void store(Object value);
    }

    private static final class Slot implements Pointer {
        private Object value;
        public Object load()             { return value; }
        public void store(Object value)  { this.value = value; }
    }

    private static final class ObjectRef {
        final String type;
        final Map<String, Object> fields = new HashMap<>();
        ObjectRef(String type) { this.type = type; }
    }

    private static final class ArrayRef {
        final Object[] elements;
        ArrayRef(int length) { this.elements = new Object[length]; }
    }

    private record ElementRef(ArrayRef array, int index) implements Pointer {
        public Object load() {
            checkIndex();
            return array.elements[index];
        }
        public void store(Object value) {
            checkIndex();
            array.elements[index] = value;
        }
        private void checkIndex() {
            if (index < 0 || index >= array.elements.length) {
                throw new IrExecutionException("Array index out of bounds: " + index);
            }
        }
    }

    private record FieldRef(Map<String, Object> fields, String field) implements Pointer {
        public Object load()             { return fields.get(field); }
        public void store(Object value)  { fields.put(field, value); }
    }

    private final CallHandler handler;
    private final long maxSteps;
    private final Map<String, Object> statics = new HashMap<>();
    private long steps;

    public IrInterpreter(CallHandler handler) {
        this(handler, 10_000_000L);
    }

    public IrInterpreter(CallHandler handler, long maxSteps) {
        this.handler = handler;
        this.maxSteps = maxSteps;
    }

    /**
     * Runs {@code function} with {@code args} ({@code Integer}, {@code Long}, {@code Boolean},
     * {@code Double} are accepted for parameters).
     *
     * The step limit applies to each call of this method, nested calls included.
     *
     * @return the returned value, or null for {@code ret void}
     */
    public Object run(Function function, Object... args) {
        steps = 0;
        return interpret(function, args);
    }

    private Object interpret(Function function, Object... args) {
        if (function.isDeclaration()) {
            return handler.call(function.name(), List.of(args));
        }
        if (args.length != function.parameters().size()) {
            throw new IrExecutionException(function.name() + " expects " + function.parameters().size()
                    + " arguments, got " + args.length);
        }
        Map<Value, Object> env = new IdentityHashMap<>();
        for (int k = 0; k < args.length; k++) {
            env.put(function.parameter(k), coerce(args[k], function.parameter(k).type()));
        }

        BasicBlock block = function.entry();
        while (true) {
            BasicBlock next = null;
            for (Instruction i : block.instructions()) {
                if (++steps > maxSteps) {
                    throw new IrExecutionException("Step limit of " + maxSteps + " exceeded in " + function.name());
                }
                switch (i.opcode()) {
                    case BR -> next = i.successors().get(0);
                    case CONDBR -> next = i.successors().get(truth(eval(env, i.operand(0))) ? 0 : 1);
                    case SWITCH -> next = switchTarget(env, i);
                    case RET -> {
                        return i.numOperands() == 0 ? null : eval(env, i.operand(0));
                    }
                    case INVOKE -> {
                        env.put(i, call(env, i, function.parent()));
                        next = i.successors().get(0);
                    }
                    case INDIRECTBR, THROW, LANDINGPAD ->
                            throw new IrExecutionException("'" + i.opcode().mnemonic() + "' is not executable");
                    default -> {
                        Object result = execute(env, i, function.parent());
                        if (i.producesValue()) {
                            env.put(i, result);
                        }
                    }
                }
                if (next != null) {
                    break;
                }
            }
            if (next == null) {
                throw new IrExecutionException("Fell off the end of a block in " + function.name());
            }
            block = next;
        }
    }

    private Object execute(Map<Value, Object> env, Instruction i, Module module) {
        return switch (i.opcode()) {
            case ADD, SUB, MUL, SDIV, SREM, AND, OR, XOR, SHL, ASHR, LSHR ->
                    integerOp(i, (Long) eval(env, i.operand(0)), (Long) eval(env, i.operand(1)));
            case FADD, FSUB, FMUL, FDIV, FREM ->
                    floatOp(i, (Double) eval(env, i.operand(0)), (Double) eval(env, i.operand(1)));
            case FNEG -> round(-(Double) eval(env, i.operand(0)), i.type());
            case ICMP -> icmp(i.predicate(), i.operand(0).type(), eval(env, i.operand(0)), eval(env, i.operand(1))) ? 1L : 0L;
            case FCMP -> fcmp(i.predicate(), (Double) eval(env, i.operand(0)), (Double) eval(env, i.operand(1))) ? 1L : 0L;
            case CMP -> threeWay(eval(env, i.operand(0)), eval(env, i.operand(1)));
            case SEXT, TRUNC -> normalize((Long) eval(env, i.operand(0)), i.type());
            case ZEXT -> normalize(unsigned((Long) eval(env, i.operand(0)), i.operand(0).type()), i.type());
            case SITOFP -> round(((Long) eval(env, i.operand(0))).doubleValue(), i.type());
            case FPTOSI -> i.type() == IrType.I64
                    ? (long) (double) (Double) eval(env, i.operand(0))
                    : normalize((int) (double) (Double) eval(env, i.operand(0)), i.type());
            case FPEXT, FPTRUNC -> round((Double) eval(env, i.operand(0)), i.type());
            case BITCAST -> eval(env, i.operand(0));
            case ALLOCA -> new Slot();
            case LOAD -> pointer(env, i, 0).load();
            case STORE -> {
                pointer(env, i, 1).store(eval(env, i.operand(0)));
                yield null;
            }
            case GETELEMENTPTR -> {
                Object base = eval(env, i.operand(0));
                if (!(base instanceof ArrayRef array)) {
                    throw new IrExecutionException("getelementptr on a non-array value");
                }
                yield new ElementRef(array, (int) (long) (Long) eval(env, i.operand(1)));
            }
            case NEW -> i.numOperands() == 0
                    ? new ObjectRef(i.symbol())
                    : new ArrayRef((int) (long) (Long) eval(env, i.operand(0)));
            case ARRAYLENGTH -> {
                Object array = eval(env, i.operand(0));
                if (!(array instanceof ArrayRef a)) {
                    throw new IrExecutionException("arraylength on a non-array value");
                }
                yield (long) a.elements.length;
            }
            case INSTANCEOF -> eval(env, i.operand(0)) instanceof ObjectRef o && o.type.equals(i.symbol()) ? 1L : 0L;
            case CALL -> call(env, i, module);
            default -> throw new IrExecutionException("'" + i.opcode().mnemonic() + "' is not executable");
        };
    }

    private Object call(Map<Value, Object> env, Instruction i, Module module) {
        List<Object> args = new ArrayList<>();
        for (Value v : i.operands()) {
            args.add(eval(env, v));
        }
        Function callee = module == null ? null : module.function(i.symbol());
        if (callee != null) {
            return interpret(callee, args.toArray());
        }
        return handler.call(i.symbol(), args);
    }

    private Pointer pointer(Map<Value, Object> env, Instruction i, int pointerOperand) {
        if (i.symbol() != null) {
            if (i.numOperands() == pointerOperand) {
                return new FieldRef(statics, i.symbol());
            }
            Object target = eval(env, i.operand(pointerOperand));
            if (!(target instanceof ObjectRef object)) {
                throw new IrExecutionException("Field access on " + (target == null ? "null" : "a non-object value"));
            }
            return new FieldRef(object.fields, i.symbol());
        }
        Object p = eval(env, i.operand(pointerOperand));
        if (!(p instanceof Pointer pointer)) {
            throw new IrExecutionException("'" + i.opcode().mnemonic() + "' through " + (p == null ? "a null pointer" : "a non-pointer value"));
        }
        return pointer;
    }

    private BasicBlock switchTarget(Map<Value, Object> env, Instruction i) {
        long v = (Long) eval(env, i.operand(0));
        List<Constant> cases = i.caseValues();
        for (int c = 0; c < cases.size(); c++) {
            if (normalize(cases.get(c).longValue(), i.operand(0).type()) == v) {
                return i.successors().get(c + 1);
            }
        }
        return i.successors().get(0);
    }

    private Object eval(Map<Value, Object> env, Value v) {
        if (v instanceof Constant c) {
            return switch (c.kind()) {
                case INTEGER -> normalize(c.longValue(), c.type());
                case FLOATING -> round(c.doubleValue(), c.type());
                case NULL -> null;
                case STRING, SYMBOL -> c.text();
                case UNDEF -> throw new IrExecutionException("Use of undef");
            };
        }
        if (!env.containsKey(v)) {
            throw new IrExecutionException("Use of a value before its definition");
        }
        return env.get(v);
    }

    private static long integerOp(Instruction i, long a, long b) {
        IrType t = i.type();
        int bits = t.bits();
        long r = switch (i.opcode()) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case SDIV -> {
                if (b == 0) throw new IrExecutionException("Division by zero");
                yield a / b;
            }
            case SREM -> {
                if (b == 0) throw new IrExecutionException("Division by zero");
                yield a % b;
            }
            case AND -> a & b;
            case OR -> a | b;
            case XOR -> a ^ b;
            case SHL -> a << (b & (bits - 1));
            case ASHR -> a >> (b & (bits - 1));
            case LSHR -> unsigned(a, t) >>> (b & (bits - 1));
            default -> throw new IllegalStateException(i.opcode().name());
        };
        return normalize(r, t);
    }

    private static double floatOp(Instruction i, double a, double b) {
        double r = switch (i.opcode()) {
            case FADD -> a + b;
            case FSUB -> a - b;
            case FMUL -> a * b;
            case FDIV -> a / b;
            case FREM -> a % b;
            default -> throw new IllegalStateException(i.opcode().name());
        };
        return round(r, i.type());
    }

    private static boolean icmp(Predicate p, IrType type, Object a, Object b) {
        if (type.isPointer()) {
            return switch (p) {
                case EQ -> a == b;
                case NE -> a != b;
                default -> throw new IrExecutionException("Ordered comparison of pointers");
            };
        }
        long x = (Long) a;
        long y = (Long) b;
        return switch (p) {
            case EQ -> x == y;
            case NE -> x != y;
            case SGT -> x > y;
            case SGE -> x >= y;
            case SLT -> x < y;
            case SLE -> x <= y;
            case UGT -> Long.compareUnsigned(unsigned(x, type), unsigned(y, type)) > 0;
            case UGE -> Long.compareUnsigned(unsigned(x, type), unsigned(y, type)) >= 0;
            case ULT -> Long.compareUnsigned(unsigned(x, type), unsigned(y, type)) < 0;
            case ULE -> Long.compareUnsigned(unsigned(x, type), unsigned(y, type)) <= 0;
            default -> throw new IrExecutionException("Not an integer predicate: " + p.text());
        };
    }

    private static boolean fcmp(Predicate p, double x, double y) {
        boolean unordered = Double.isNaN(x) || Double.isNaN(y);
        return switch (p) {
            case OEQ -> !unordered && x == y;
            case ONE -> !unordered && x != y;
            case OGT -> !unordered && x > y;
            case OGE -> !unordered && x >= y;
            case OLT -> !unordered && x < y;
            case OLE -> !unordered && x <= y;
            case UEQ -> unordered || x == y;
            case UNE -> unordered || x != y;
            case UNO -> unordered;
            default -> throw new IrExecutionException("Not a floating point predicate: " + p.text());
        };
    }

    private static long threeWay(Object a, Object b) {
        if (a instanceof Double x && b instanceof Double y) {
            // NaN compares as less, like fcmpl/dcmpl
            if (Double.isNaN(x) || Double.isNaN(y)) return -1L;
            double dx = x;
            double dy = y;
            return dx < dy ? -1L : (dx > dy ? 1L : 0L);
        }
        return Long.signum(Long.compare((Long) a, (Long) b));
    }

    private static boolean truth(Object condition) {
        return (Long) Objects.requireNonNull(condition, "branch condition") != 0;
    }

    static long normalize(long v, IrType type) {
        return switch (type) {
            case I1 -> v & 1L;
            case I8 -> (byte) v;
            case I16 -> (short) v;
            case I32 -> (int) v;
            default -> v;
        };
    }

    private static long unsigned(long v, IrType type) {
        return type.bits() >= 64 ? v : v & ((1L << type.bits()) - 1);
    }

    private static double round(double v, IrType type) {
        return type == IrType.FLOAT ? (float) v : v;
    }

    private static Object coerce(Object arg, IrType type) {
        if (arg instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (type.isInteger() && arg instanceof Number n) {
            return normalize(n.longValue(), type);
        }
        if (type.isFloating() && arg instanceof Number n) {
            return round(n.doubleValue(), type);
        }
        return arg;
    }
}
