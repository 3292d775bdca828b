package com.branchprobe.agent;

/**
 * Targets of the INVOKESTATIC calls that {@link BranchProbeVisitor} inserts before conditional jumps.
 *
 * Each probe receives copies of the operands the jump is about to consume, evaluates the jump's
 * own predicate on them and reports whether the jump is taken. The operands are duplicated on the
 * operand stack, never recomputed.
 *
 * Must stay public: the calls are emitted into classes of arbitrary packages and class loaders.
 */
public final class BranchProbes {

    private BranchProbes() {}

    public static final String INTERNAL_NAME = "com/branchprobe/agent/BranchProbes";

    public static void ifeq(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value == 0);
    }

    public static void ifne(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value != 0);
    }

    public static void iflt(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value < 0);
    }

    public static void ifge(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value >= 0);
    }

    public static void ifgt(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value > 0);
    }

    public static void ifle(int value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value <= 0);
    }

    public static void ifIcmpeq(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left == right);
    }

    public static void ifIcmpne(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left != right);
    }

    public static void ifIcmplt(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left < right);
    }

    public static void ifIcmpge(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left >= right);
    }

    public static void ifIcmpgt(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left > right);
    }

    public static void ifIcmple(int left, int right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left <= right);
    }

    public static void ifAcmpeq(Object left, Object right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left == right);
    }

    public static void ifAcmpne(Object left, Object right, long branchId) {
        BranchLog.logBranchOutcome(branchId, left != right);
    }

    public static void ifnull(Object value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value == null);
    }

    public static void ifnonnull(Object value, long branchId) {
        BranchLog.logBranchOutcome(branchId, value != null);
    }
}
