package com.branchprobe.agent;

import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.implementation.Implementation;
import net.bytebuddy.jar.asm.Label;
import net.bytebuddy.jar.asm.MethodVisitor;
import net.bytebuddy.jar.asm.Opcodes;
import net.bytebuddy.pool.TypePool;
import net.bytebuddy.utility.OpenedClassReader;

/**
 * Inserts a {@link BranchProbes} call in front of every conditional jump of one method.
 *
 * For a jump consuming one operand the inserted sequence is {@code DUP; LDC id; INVOKESTATIC},
 * for two operands {@code DUP2; LDC id; INVOKESTATIC}. The probe consumes the copies, so the
 * stack the jump sees is unchanged. No branches are added, which keeps existing stack map
 * frames valid; only max stack grows.
 */
public class BranchProbeVisitor extends MethodVisitor {

    /** DUP2 of two category-1 values plus a long ID. */
    private static final int EXTRA_STACK = 4;

    private final String owner;
    private final String methodName;
    private final String descriptor;
    private final BranchIdSequence ids;
    private final BranchIndex index;
    private int ordinal;

    public BranchProbeVisitor(MethodVisitor delegate, String owner, String methodName, String descriptor,
                              BranchIdSequence ids, BranchIndex index) {
        super(OpenedClassReader.ASM_API, delegate);
        this.owner = owner;
        this.methodName = methodName;
        this.descriptor = descriptor;
        this.ids = ids;
        this.index = index;
    }

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        Probe probe = Probe.forOpcode(opcode);
        if (probe != null) {
            long branchId = ids.next();
            index.record(branchId, owner, methodName, descriptor, ordinal++);
            super.visitInsn(probe.operands == 2 ? Opcodes.DUP2 : Opcodes.DUP);
            super.visitLdcInsn(branchId);
            super.visitMethodInsn(Opcodes.INVOKESTATIC, BranchProbes.INTERNAL_NAME,
                    probe.method, probe.descriptor, false);
        }
        super.visitJumpInsn(opcode, label);
    }

    @Override
    public void visitMaxs(int maxStack, int maxLocals) {
        super.visitMaxs(ordinal > 0 ? maxStack + EXTRA_STACK : maxStack, maxLocals);
    }

    enum Probe {
        IFEQ(Opcodes.IFEQ, "ifeq", 1, "(IJ)V"),
        IFNE(Opcodes.IFNE, "ifne", 1, "(IJ)V"),
        IFLT(Opcodes.IFLT, "iflt", 1, "(IJ)V"),
        IFGE(Opcodes.IFGE, "ifge", 1, "(IJ)V"),
        IFGT(Opcodes.IFGT, "ifgt", 1, "(IJ)V"),
        IFLE(Opcodes.IFLE, "ifle", 1, "(IJ)V"),
        IF_ICMPEQ(Opcodes.IF_ICMPEQ, "ifIcmpeq", 2, "(IIJ)V"),
        IF_ICMPNE(Opcodes.IF_ICMPNE, "ifIcmpne", 2, "(IIJ)V"),
        IF_ICMPLT(Opcodes.IF_ICMPLT, "ifIcmplt", 2, "(IIJ)V"),
        IF_ICMPGE(Opcodes.IF_ICMPGE, "ifIcmpge", 2, "(IIJ)V"),
        IF_ICMPGT(Opcodes.IF_ICMPGT, "ifIcmpgt", 2, "(IIJ)V"),
        IF_ICMPLE(Opcodes.IF_ICMPLE, "ifIcmple", 2, "(IIJ)V"),
        IF_ACMPEQ(Opcodes.IF_ACMPEQ, "ifAcmpeq", 2, "(Ljava/lang/Object;Ljava/lang/Object;J)V"),
        IF_ACMPNE(Opcodes.IF_ACMPNE, "ifAcmpne", 2, "(Ljava/lang/Object;Ljava/lang/Object;J)V"),
        IFNULL(Opcodes.IFNULL, "ifnull", 1, "(Ljava/lang/Object;J)V"),
        IFNONNULL(Opcodes.IFNONNULL, "ifnonnull", 1, "(Ljava/lang/Object;J)V");

        final int opcode;
        final String method;
        final int operands;
        final String descriptor;

        Probe(int opcode, String method, int operands, String descriptor) {
            this.opcode = opcode;
            this.method = method;
            this.operands = operands;
            this.descriptor = descriptor;
        }

        /** Returns the probe for a conditional jump opcode, or null for GOTO, JSR and non-jumps. */
        static Probe forOpcode(int opcode) {
            for (Probe p : values()) {
                if (p.opcode == opcode) return p;
            }
            return null;
        }
    }

    /**
     * ByteBuddy hook that wraps every method body of an instrumented type in a
     * {@link BranchProbeVisitor}. One wrapper is shared by all types of an agent run.
     */
    public static class Wrapper implements net.bytebuddy.asm.AsmVisitorWrapper.ForDeclaredMethods.MethodVisitorWrapper {

        private final BranchIdSequence ids;
        private final BranchIndex index;

        public Wrapper(BranchIdSequence ids, BranchIndex index) {
            this.ids = ids;
            this.index = index;
        }

        @Override
        public MethodVisitor wrap(TypeDescription instrumentedType,
                                  MethodDescription instrumentedMethod,
                                  MethodVisitor methodVisitor,
                                  Implementation.Context implementationContext,
                                  TypePool typePool,
                                  int writerFlags,
                                  int readerFlags) {
            return new BranchProbeVisitor(methodVisitor,
                    instrumentedType.getName(),
                    instrumentedMethod.getInternalName(),
                    instrumentedMethod.getDescriptor(),
                    ids, index);
        }
    }
}
