package com.branchprobe.extractor.ir;

import com.branchprobe.extractor.SampleFunctions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.branchprobe.extractor.ir.FunctionBuilder.param;
import static org.junit.jupiter.api.Assertions.*;

class InstructionPrinterTest {

    @Test
    void printsNamedAndNumberedValues() {
        Function f = SampleFunctions.sumTo(new Module("m"));
        InstructionPrinter p = InstructionPrinter.forFunction(f);
        List<Instruction> entry = f.blocks().get(0).instructions();
        List<Instruction> cond = f.blocks().get(1).instructions();

        assertEquals("%n.addr = alloca i32", p.print(entry.get(0)));
        assertEquals("store i32 %n, ptr %n.addr", p.print(entry.get(3)));
        assertEquals("store i32 0, ptr %s", p.print(entry.get(4)));
        assertEquals("br label %for.cond", p.print(entry.get(6)));
        assertEquals("%0 = load i32, ptr %i", p.print(cond.get(0)));
        assertEquals("%1 = load i32, ptr %n.addr", p.print(cond.get(1)));
        assertEquals("%cmp = icmp slt i32 %0, %1", p.print(cond.get(2)));
        assertEquals("br i1 %cmp, label %for.body, label %for.end", p.print(cond.get(3)));
    }

    @Test
    void unnamedParametersAndBlocksShareOneSequence() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.I32, param(null, IrType.I32));
        BasicBlock entry = b.block(null);
        BasicBlock then = b.block(null);
        BasicBlock other = b.block(null);
        b.at(entry);
        Instruction cmp = b.icmp(null, Predicate.EQ, b.param(0), Constant.i32(7));
        b.condBr(cmp, then, other);
        b.at(then).ret(b.add(null, b.param(0), Constant.i32(1)));
        b.at(other).ret(Constant.i32(0));

        InstructionPrinter p = InstructionPrinter.forFunction(b.function());
        // %0 = parameter, %1 = entry, %2 = cmp, %3 = then, %4 = add, %5 = other
        assertEquals("%2 = icmp eq i32 %0, 7", p.print(cmp));
        assertEquals("br i1 %2, label %3, label %5", p.print(entry.terminator()));
        assertEquals("%4 = add i32 %0, 1", p.print(then.instructions().get(0)));
        assertEquals("1", p.blockId(entry));
    }

    @Test
    void printsCallsSwitchesAndObjects() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "g", IrType.VOID, param("v", IrType.I32), param("c", IrType.I1));
        BasicBlock entry = b.block("entry");
        BasicBlock one = b.block("one");
        BasicBlock dflt = b.block("dflt");
        b.at(entry);
        Instruction hook = b.call("ignored", IrType.VOID, "logBranchOutcome", Constant.i64(0), b.param(1));
        Instruction obj = b.newObject("new", "java.lang.StringBuilder");
        Instruction field = b.loadField("f", IrType.I32, obj, "demo.Counter.count");
        Map<Constant, BasicBlock> cases = new LinkedHashMap<>();
        cases.put(Constant.i32(1), one);
        Instruction sw = b.switchOn(b.param(0), dflt, cases);
        b.at(one).retVoid();
        b.at(dflt).retVoid();

        InstructionPrinter p = InstructionPrinter.forFunction(b.function());
        assertEquals("call void @logBranchOutcome(i64 0, i1 %c)", p.print(hook));
        assertNull(hook.name(), "void calls are never named");
        assertEquals("%new = new ptr @java.lang.StringBuilder", p.print(obj));
        assertEquals("%f = load i32, ptr %new, @demo.Counter.count", p.print(field));
        assertEquals("switch i32 %v, label %dflt [i32 1, label %one]", p.print(sw));
        assertEquals("ret void", p.print(one.terminator()));
    }

    @Test
    void printsIndirectBranches() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "jump", IrType.VOID, param("addr", IrType.PTR));
        BasicBlock entry = b.block("entry");
        BasicBlock left = b.block("left");
        BasicBlock right = b.block("right");
        Instruction jump = b.at(entry).indirectBr(b.param(0), List.of(left, right));
        b.at(left).retVoid();
        b.at(right).retVoid();

        InstructionPrinter p = InstructionPrinter.forFunction(b.function());
        assertEquals("indirectbr ptr %addr, [label %left, label %right]", p.print(jump));
        assertEquals(TerminatorKind.INDIRECT_BRANCH, jump.opcode().terminatorKind());
        assertEquals(List.of(left, right), entry.successors());
    }

    @Test
    void quotesNamesOutsideThePlainAlphabet() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "h", IrType.I32, param("x", IrType.I32));
        BasicBlock entry = b.block("entry");
        BasicBlock target = b.block("Counter::next(I)I");
        b.at(entry).br(target);
        b.at(target).ret(b.param(0));

        InstructionPrinter p = InstructionPrinter.forFunction(b.function());
        assertEquals("br label %\"Counter::next(I)I\"", p.print(entry.terminator()));
    }

    @Test
    void valueOfAnotherFunctionPrintsAsBadref() {
        Module m = new Module("m");
        Function sign = SampleFunctions.sign(m);
        Instruction named = sign.blocks().get(0).instructions().get(0);

        FunctionBuilder b = FunctionBuilder.define(m, "k", IrType.I32);
        BasicBlock entry = b.block("entry");
        b.at(entry);
        Instruction unnamed = b.cast(Opcode.ZEXT, null, Constant.i1(true), IrType.I32);
        b.ret(unnamed);

        InstructionPrinter p = InstructionPrinter.forFunction(sign);
        assertEquals("%<badref>", p.ref(unnamed));
        assertEquals("%cmp", p.ref(named));
    }
}
