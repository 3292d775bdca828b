package com.branchprobe.extractor.interp;

import com.branchprobe.agent.BranchLog;

import java.util.List;

/** Executes calls to functions the interpreted module only declares. */
@FunctionalInterface
public interface CallHandler {

    /**
     * @param callee callee symbol
     * @param args   evaluated arguments ({@code Long} for integers, {@code Double} for floats)
     * @return the call's result, or null for {@code void}
     */
    Object call(String callee, List<Object> args);

    /** Routes {@code logBranchOutcome(i64, i1)} to {@link BranchLog}; any other callee is an error. */
    CallHandler BRANCH_LOG = (callee, args) -> {
        if (!callee.equals(BranchLog.HOOK_NAME)) {
            throw new IrInterpreter.IrExecutionException("No handler for external function @" + callee);
        }
        BranchLog.logBranchOutcome((Long) args.get(0), ((Long) args.get(1)) != 0);
        return null;
    };
}
