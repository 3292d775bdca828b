package com.branchprobe.extractor.bytecode;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SourceInterpreter;
import org.objectweb.asm.tree.analysis.SourceValue;

/**
 * Records, for every stack value, the instruction that produced it. Local loads produce a
 * fresh value; stores, {@code dup}s and {@code swap} move a value without producing one, so
 * a duplicated value still points at its original producer. The exception on entry to a
 * handler is attributed to the handler's label.
 */
final class OperandTracer extends SourceInterpreter {

    OperandTracer() {
        super(Opcodes.ASM9);
    }

    @Override
    public SourceValue copyOperation(AbstractInsnNode insn, SourceValue value) {
        int op = insn.getOpcode();
        if (op >= Opcodes.ILOAD && op <= Opcodes.ALOAD) {
            return super.copyOperation(insn, value);
        }
        return value;
    }

    @Override
    public SourceValue newExceptionValue(TryCatchBlockNode tryCatchBlockNode,
                                         Frame<SourceValue> handlerFrame,
                                         Type exceptionType) {
        return new SourceValue(1, tryCatchBlockNode.handler);
    }
}
