package com.branchprobe.extractor.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One IR instruction. Belongs to exactly one {@link BasicBlock}; created through
 * {@link FunctionBuilder}.
 *
 * For {@link Opcode#SWITCH} the first successor is the default destination and
 * successor {@code i + 1} belongs to {@code caseValues().get(i)}. For {@link Opcode#CONDBR}
 * the first successor is taken when the condition is true.
 */
public class Instruction extends Value {

    private final Opcode opcode;
    private final List<Value> operands = new ArrayList<>();
    private final List<BasicBlock> successors = new ArrayList<>();
    private final List<Constant> caseValues = new ArrayList<>();
    private Predicate predicate;
    private String symbol;
    private IrType elementType;
    private BasicBlock parent;

    Instruction(Opcode opcode, IrType type, String name) {
        super(type, name);
        this.opcode = opcode;
    }

    public Opcode opcode()                  { return opcode; }
    public List<Value> operands()           { return Collections.unmodifiableList(operands); }
    public Value operand(int i)             { return operands.get(i); }
    public int numOperands()                { return operands.size(); }
    public List<BasicBlock> successors()    { return Collections.unmodifiableList(successors); }
    public List<Constant> caseValues()      { return Collections.unmodifiableList(caseValues); }
    public BasicBlock parent()              { return parent; }

    /** Comparison predicate of {@code icmp}/{@code fcmp}, else null. */
    public Predicate predicate()            { return predicate; }

    /** Callee of a call, accessed field, or class of {@code new}/{@code instanceof}. */
    public String symbol()                  { return symbol; }

    /** Allocated type of {@code alloca}, element type of {@code getelementptr}. */
    public IrType elementType()             { return elementType; }

    public boolean isTerminator()           { return opcode.isTerminator(); }
    public boolean isConditionalBranch()    { return opcode == Opcode.CONDBR; }
    public boolean producesValue()          { return type() != IrType.VOID; }

    /** Condition operand of a conditional branch or switch, else null. */
    public Value condition() {
        if ((opcode == Opcode.CONDBR || opcode == Opcode.SWITCH) && !operands.isEmpty()) {
            return operands.get(0);
        }
        return null;
    }

    public Function function() {
        return parent == null ? null : parent.parent();
    }

    void addOperand(Value value)            { operands.add(value); }
    void addSuccessor(BasicBlock block)     { successors.add(block); }
    void addCase(Constant value)            { caseValues.add(value); }
    void setPredicate(Predicate predicate)  { this.predicate = predicate; }
    void setSymbol(String symbol)           { this.symbol = symbol; }
    void setElementType(IrType type)        { this.elementType = type; }
    void setParent(BasicBlock parent)       { this.parent = parent; }

    @Override
    public String toString() {
        Function f = function();
        return f == null ? InstructionPrinter.printDetached(this) : InstructionPrinter.forFunction(f).print(this);
    }
}
