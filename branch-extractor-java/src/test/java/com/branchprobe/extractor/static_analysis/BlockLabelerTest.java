package com.branchprobe.extractor.static_analysis;

import com.branchprobe.extractor.SampleFunctions;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.FunctionBuilder;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.Module;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.branchprobe.extractor.ir.FunctionBuilder.param;
import static org.junit.jupiter.api.Assertions.*;

class BlockLabelerTest {

    private final BlockLabeler labeler = new BlockLabeler();

    @Test
    void branchTargetsTakeTheirPrintedIdentifier() {
        Function f = SampleFunctions.sign(new Module("m"));
        Map<BasicBlock, String> labels = labeler.label(f);
        assertEquals(List.of("entry", "if.then", "if.end", "if.then2", "if.end3"), List.copyOf(labels.values()));
    }

    @Test
    void unnamedBlocksUseTheirSlotNumbers() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.VOID, param("c", IrType.I1));
        BasicBlock entry = b.block(null);
        BasicBlock left = b.block(null);
        BasicBlock right = b.block(null);
        BasicBlock orphan = b.block(null);
        b.at(entry).condBr(b.param(0), left, right);
        b.at(left).retVoid();
        b.at(right).retVoid();
        b.at(orphan).retVoid();

        Map<BasicBlock, String> labels = labeler.label(b.function());
        assertEquals("<unnamed_0>", labels.get(entry));
        assertEquals("1", labels.get(left));
        assertEquals("2", labels.get(right));
        assertEquals("<unnamed_3>", labels.get(orphan));
    }

    @Test
    void blockNamedZeroKeepsPlaceholder() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.VOID);
        BasicBlock entry = b.block("0");
        b.at(entry).retVoid();

        assertEquals("<unnamed_0>", labeler.label(b.function()).get(entry));
    }

    @Test
    void switchTargetsAreNotScanned() {
        Module m = new Module("m");
        FunctionBuilder b = FunctionBuilder.define(m, "f", IrType.VOID, param("v", IrType.I32));
        BasicBlock entry = b.block(null);
        BasicBlock one = b.block(null);
        BasicBlock other = b.block(null);
        Map<Constant, BasicBlock> cases = new LinkedHashMap<>();
        cases.put(Constant.i32(1), one);
        b.at(entry).switchOn(b.param(0), other, cases);
        b.at(one).retVoid();
        b.at(other).retVoid();

        Map<BasicBlock, String> labels = labeler.label(b.function());
        assertEquals("<unnamed_1>", labels.get(one));
        assertEquals("<unnamed_2>", labels.get(other));
    }

    @Test
    void targetIdsAreReadInOrder() {
        assertEquals(List.of("a", "7"), BlockLabeler.targetIds("br i1 %c, label %a, label %7"));
        assertTrue(BlockLabeler.targetIds("ret void").isEmpty());
    }
}
