package com.branchprobe.extractor.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent construction of functions. Instructions are appended at the end of the current
 * block, or inserted before an anchor after {@link #before(Instruction)}. Names passed as
 * {@code null} leave the value unnamed; the printer numbers it.
 *
 * <pre>
 *   FunctionBuilder b = FunctionBuilder.define(module, "sign", IrType.I32, FunctionBuilder.param("x", IrType.I32));
 *   BasicBlock entry = b.block("entry");
 *   ...
 *   b.at(entry).condBr(cmp, pos, neg);
 * </pre>
 */
public final class FunctionBuilder {

    /** Parameter declaration for {@link #define}. */
    public record Param(String name, IrType type) {}

    public static Param param(String name, IrType type) {
        return new Param(name, type);
    }

    private final Function function;
    private BasicBlock current;
    private Instruction anchor;

    private FunctionBuilder(Function function) {
        this.function = function;
    }

    /** Creates a new function definition in {@code module}. */
    public static FunctionBuilder define(Module module, String name, IrType returnType, Param... params) {
        return define(module, name, returnType, List.of(params));
    }

    public static FunctionBuilder define(Module module, String name, IrType returnType, List<Param> params) {
        List<Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            parameters.add(new Parameter(i, params.get(i).type(), params.get(i).name()));
        }
        Function f = new Function(name, returnType, parameters);
        module.add(f);
        return new FunctionBuilder(f);
    }

    /** Builder over an existing function, for rewriting passes. */
    public static FunctionBuilder edit(Function function) {
        return new FunctionBuilder(function);
    }

    public Function function() {
        return function;
    }

    public Parameter param(int index) {
        return function.parameter(index);
    }

    /** Creates a block at the end of the function. Does not move the insertion point. */
    public BasicBlock block(String name) {
        BasicBlock b = new BasicBlock(name);
        function.addBlock(b);
        return b;
    }

    /** Appends subsequent instructions to the end of {@code block}. */
    public FunctionBuilder at(BasicBlock block) {
        requireOwned(block);
        this.current = block;
        this.anchor = null;
        return this;
    }

    /** Inserts subsequent instructions immediately before {@code instruction}, in order. */
    public FunctionBuilder before(Instruction instruction) {
        requireOwned(instruction.parent());
        this.current = instruction.parent();
        this.anchor = instruction;
        return this;
    }

    // -----------------------------------------------------------------------
    // Memory
    // -----------------------------------------------------------------------

    public Instruction alloca(String name, IrType allocated) {
        Instruction i = new Instruction(Opcode.ALLOCA, IrType.PTR, name);
        i.setElementType(allocated);
        return insert(i);
    }

    public Instruction load(String name, IrType type, Value pointer) {
        Instruction i = new Instruction(Opcode.LOAD, type, name);
        i.addOperand(pointer);
        return insert(i);
    }

    /** Load of a field; {@code object} is null for a static field. */
    public Instruction loadField(String name, IrType type, Value object, String field) {
        Instruction i = new Instruction(Opcode.LOAD, type, name);
        if (object != null) i.addOperand(object);
        i.setSymbol(field);
        return insert(i);
    }

    public Instruction store(Value value, Value pointer) {
        Instruction i = new Instruction(Opcode.STORE, IrType.VOID, null);
        i.addOperand(value);
        i.addOperand(pointer);
        return insert(i);
    }

    /** Store to a field; {@code object} is null for a static field. */
    public Instruction storeField(Value value, Value object, String field) {
        Instruction i = new Instruction(Opcode.STORE, IrType.VOID, null);
        i.addOperand(value);
        if (object != null) i.addOperand(object);
        i.setSymbol(field);
        return insert(i);
    }

    public Instruction gep(String name, IrType element, Value base, Value index) {
        Instruction i = new Instruction(Opcode.GETELEMENTPTR, IrType.PTR, name);
        i.setElementType(element);
        i.addOperand(base);
        i.addOperand(index);
        return insert(i);
    }

    // -----------------------------------------------------------------------
    // Arithmetic, comparison, conversion
    // -----------------------------------------------------------------------

    public Instruction binary(Opcode opcode, String name, Value lhs, Value rhs) {
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException("Not a binary opcode: " + opcode);
        }
        Instruction i = new Instruction(opcode, lhs.type(), name);
        i.addOperand(lhs);
        i.addOperand(rhs);
        return insert(i);
    }

    public Instruction add(String name, Value lhs, Value rhs) {
        return binary(Opcode.ADD, name, lhs, rhs);
    }

    public Instruction fneg(String name, Value operand) {
        Instruction i = new Instruction(Opcode.FNEG, operand.type(), name);
        i.addOperand(operand);
        return insert(i);
    }

    public Instruction icmp(String name, Predicate predicate, Value lhs, Value rhs) {
        if (predicate.isFloating()) {
            throw new IllegalArgumentException("Not an integer predicate: " + predicate);
        }
        return compare(Opcode.ICMP, name, predicate, lhs, rhs);
    }

    public Instruction fcmp(String name, Predicate predicate, Value lhs, Value rhs) {
        if (!predicate.isFloating()) {
            throw new IllegalArgumentException("Not a floating point predicate: " + predicate);
        }
        return compare(Opcode.FCMP, name, predicate, lhs, rhs);
    }

    private Instruction compare(Opcode opcode, String name, Predicate predicate, Value lhs, Value rhs) {
        Instruction i = new Instruction(opcode, IrType.I1, name);
        i.setPredicate(predicate);
        i.addOperand(lhs);
        i.addOperand(rhs);
        return insert(i);
    }

    /** Three-way compare yielding -1, 0 or 1 as {@code i32}. */
    public Instruction cmp(String name, Value lhs, Value rhs) {
        Instruction i = new Instruction(Opcode.CMP, IrType.I32, name);
        i.addOperand(lhs);
        i.addOperand(rhs);
        return insert(i);
    }

    public Instruction cast(Opcode opcode, String name, Value operand, IrType to) {
        if (!opcode.isCast()) {
            throw new IllegalArgumentException("Not a cast opcode: " + opcode);
        }
        Instruction i = new Instruction(opcode, to, name);
        i.addOperand(operand);
        return insert(i);
    }

    // -----------------------------------------------------------------------
    // Object model
    // -----------------------------------------------------------------------

    /** Allocates an instance of {@code type}; {@code dimensions} are array lengths, if any. */
    public Instruction newObject(String name, String type, Value... dimensions) {
        Instruction i = new Instruction(Opcode.NEW, IrType.PTR, name);
        i.setSymbol(type);
        for (Value d : dimensions) i.addOperand(d);
        return insert(i);
    }

    public Instruction arrayLength(String name, Value array) {
        Instruction i = new Instruction(Opcode.ARRAYLENGTH, IrType.I32, name);
        i.addOperand(array);
        return insert(i);
    }

    public Instruction instanceOf(String name, Value object, String type) {
        Instruction i = new Instruction(Opcode.INSTANCEOF, IrType.I1, name);
        i.addOperand(object);
        i.setSymbol(type);
        return insert(i);
    }

    /** Exception object at the start of a handler; {@code caught} is null for catch-all. */
    public Instruction landingPad(String name, String caught) {
        Instruction i = new Instruction(Opcode.LANDINGPAD, IrType.PTR, name);
        i.setSymbol(caught);
        return insert(i);
    }

    // -----------------------------------------------------------------------
    // Calls
    // -----------------------------------------------------------------------

    public Instruction call(String name, IrType returnType, String callee, Value... args) {
        return call(name, returnType, callee, List.of(args));
    }

    public Instruction call(String name, IrType returnType, String callee, List<Value> args) {
        Instruction i = new Instruction(Opcode.CALL, returnType, returnType == IrType.VOID ? null : name);
        i.setSymbol(Objects.requireNonNull(callee));
        for (Value a : args) i.addOperand(a);
        return insert(i);
    }

    public Instruction invoke(String name, IrType returnType, String callee, List<Value> args,
                              BasicBlock normal, BasicBlock unwind) {
        Instruction i = new Instruction(Opcode.INVOKE, returnType, returnType == IrType.VOID ? null : name);
        i.setSymbol(Objects.requireNonNull(callee));
        for (Value a : args) i.addOperand(a);
        i.addSuccessor(normal);
        i.addSuccessor(unwind);
        return insert(i);
    }

    // -----------------------------------------------------------------------
    // Terminators
    // -----------------------------------------------------------------------

    public Instruction br(BasicBlock target) {
        Instruction i = new Instruction(Opcode.BR, IrType.VOID, null);
        i.addSuccessor(target);
        return insert(i);
    }

    public Instruction condBr(Value condition, BasicBlock ifTrue, BasicBlock ifFalse) {
        Instruction i = new Instruction(Opcode.CONDBR, IrType.VOID, null);
        i.addOperand(condition);
        i.addSuccessor(ifTrue);
        i.addSuccessor(ifFalse);
        return insert(i);
    }

    /** Multi-way branch; iteration order of {@code cases} is the case order. */
    public Instruction switchOn(Value value, BasicBlock defaultTarget, Map<Constant, BasicBlock> cases) {
        Instruction i = new Instruction(Opcode.SWITCH, IrType.VOID, null);
        i.addOperand(value);
        i.addSuccessor(defaultTarget);
        for (Map.Entry<Constant, BasicBlock> c : cases.entrySet()) {
            i.addCase(c.getKey());
            i.addSuccessor(c.getValue());
        }
        return insert(i);
    }

    public Instruction indirectBr(Value address, List<BasicBlock> targets) {
        Instruction i = new Instruction(Opcode.INDIRECTBR, IrType.VOID, null);
        i.addOperand(address);
        for (BasicBlock t : targets) i.addSuccessor(t);
        return insert(i);
    }

    public Instruction ret(Value value) {
        Instruction i = new Instruction(Opcode.RET, IrType.VOID, null);
        i.addOperand(value);
        return insert(i);
    }

    public Instruction retVoid() {
        return insert(new Instruction(Opcode.RET, IrType.VOID, null));
    }

    public Instruction throwValue(Value exception) {
        Instruction i = new Instruction(Opcode.THROW, IrType.VOID, null);
        i.addOperand(exception);
        return insert(i);
    }

    private Instruction insert(Instruction i) {
        if (current == null) {
            throw new IllegalStateException("No insertion point: call at(block) first");
        }
        if (anchor != null) {
            current.insertBefore(anchor, i);
        } else {
            current.append(i);
        }
        return i;
    }

    private void requireOwned(BasicBlock block) {
        if (block == null || block.parent() != function) {
            throw new IllegalArgumentException("Block does not belong to " + function.name());
        }
    }
}
