package com.branchprobe.extractor.static_analysis;

/**
 * Static features of one instruction. {@code distToControlFlow} is in
 * {@code 0..}{@value DistancePropagator#MAX}, the maximum meaning no path was found.
 */
public record FeatureRecord(boolean inLoop,
                            int loopDepth,
                            int distToControlFlow,
                            int numPredecessors,
                            int numSuccessors,
                            int numOperands,
                            boolean opIsMemoryAccess,
                            boolean opIsRegisterOperand,
                            boolean opIsImmediate) {

    /** The bracketed feature list of a report line. */
    public String render() {
        return "[in_loop: " + bit(inLoop)
                + ", dist_to_control_flow: " + distToControlFlow
                + ", num_preds_BB: " + numPredecessors
                + ", num_succs_BB: " + numSuccessors
                + ", loop_depth_BB: " + loopDepth
                + ", op_is_mem_access: " + bit(opIsMemoryAccess)
                + ", op_is_reg_operand: " + bit(opIsRegisterOperand)
                + ", op_is_immediate: " + bit(opIsImmediate)
                + ", num_operands: " + numOperands + "]";
    }

    private static int bit(boolean b) {
        return b ? 1 : 0;
    }
}
