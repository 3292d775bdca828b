package com.branchprobe.extractor.ir;

import com.branchprobe.extractor.SampleFunctions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.branchprobe.extractor.ir.FunctionBuilder.param;
import static org.junit.jupiter.api.Assertions.*;

class FunctionTest {

    @Test
    void wellFormedFunctionVerifies() {
        Function f = SampleFunctions.sumTo(new Module("m"));
        assertDoesNotThrow(f::verify);
        assertSame(f.blocks().get(0), f.entry());
        assertEquals(21, f.instructions().size());
    }

    @Test
    void reachableBlockWithoutTerminatorIsMalformed() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "open_end", IrType.I32, param("x", IrType.I32));
        BasicBlock entry = b.block("entry");
        BasicBlock tail = b.block("tail");
        b.at(entry).br(tail);
        b.at(tail).add("sum", b.param(0), Constant.i32(1));

        MalformedFunctionException e = assertThrows(MalformedFunctionException.class, b.function()::verify);
        assertEquals("open_end", e.functionName());
        assertTrue(e.getMessage().contains("no terminator"), e.getMessage());
    }

    @Test
    void unreachableBlockWithoutTerminatorIsAccepted() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "dead_tail", IrType.VOID);
        BasicBlock entry = b.block("entry");
        BasicBlock dead = b.block("dead");
        b.at(entry).retVoid();
        b.at(dead).add("x", Constant.i32(1), Constant.i32(2));

        assertDoesNotThrow(b.function()::verify);
        assertEquals(List.of(entry), List.copyOf(b.function().reachableBlocks()));
    }

    @Test
    void terminatorInTheMiddleOfABlockIsMalformed() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "mid", IrType.VOID);
        BasicBlock entry = b.block("entry");
        b.at(entry).retVoid();
        b.at(entry).retVoid();

        assertThrows(MalformedFunctionException.class, b.function()::verify);
    }

    @Test
    void branchIntoAnotherFunctionIsMalformed() {
        Module m = new Module("m");
        Function other = SampleFunctions.twoBlocks(m);
        FunctionBuilder b = FunctionBuilder.define(m, "jumper", IrType.VOID);
        BasicBlock entry = b.block("entry");
        b.at(entry).br(other.blocks().get(1));

        assertThrows(MalformedFunctionException.class, b.function()::verify);
    }

    @Test
    void entryOfADeclarationIsMalformed() {
        Module m = new Module("m");
        Function decl = m.declare("ext", IrType.VOID, List.of(IrType.I64));
        assertTrue(decl.isDeclaration());
        assertThrows(MalformedFunctionException.class, decl::entry);
    }

    @Test
    void declareIsIdempotent() {
        Module m = new Module("m");
        Function first = m.declare("logBranchOutcome", IrType.VOID, List.of(IrType.I64, IrType.I1));
        Function second = m.declare("logBranchOutcome", IrType.VOID, List.of(IrType.I64, IrType.I1));
        assertSame(first, second);
        assertEquals(1, m.declarations().size());
        assertTrue(m.functions().isEmpty());
    }

    @Test
    void duplicateDefinitionIsRejected() {
        Module m = new Module("m");
        SampleFunctions.sign(m);
        assertThrows(IllegalArgumentException.class, () -> SampleFunctions.sign(m));
    }

    @Test
    void edgesCountDistinctBlocks() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "same_target", IrType.VOID, param("c", IrType.I1));
        BasicBlock entry = b.block("entry");
        BasicBlock exit = b.block("exit");
        b.at(entry).condBr(b.param(0), exit, exit);
        b.at(exit).retVoid();

        assertEquals(List.of(exit), entry.successors());
        assertEquals(List.of(entry), exit.predecessors());
    }

    @Test
    void insertBeforeKeepsOrder() {
        Function f = SampleFunctions.pick(new Module("m"));
        BasicBlock entry = f.entry();
        Instruction br = entry.terminator();
        FunctionBuilder b = FunctionBuilder.edit(f).before(br);
        Instruction first = b.add("a", Constant.i32(1), Constant.i32(2));
        Instruction second = b.add("b", first, Constant.i32(3));

        assertEquals(List.of(first, second, br), entry.instructions());
        assertSame(f, second.function());
    }
}
