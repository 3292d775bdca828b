package com.branchprobe.extractor.instrument;

import com.branchprobe.agent.BranchIdSequence;
import com.branchprobe.agent.BranchLog;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.FunctionBuilder;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.MalformedFunctionException;
import com.branchprobe.extractor.ir.Module;
import com.branchprobe.extractor.ir.Value;
import com.branchprobe.extractor.static_analysis.BranchIdScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts {@code call void @logBranchOutcome(i64 <id>, i1 <cond>)} immediately before every
 * conditional branch. The branch's own condition value is passed, so nothing is evaluated
 * twice. The hook is declared once per module.
 *
 * IDs follow the same block-order discipline as
 * {@link com.branchprobe.extractor.static_analysis.BranchIdAssigner} and the same
 * {@link BranchIdScope}: instrumenting and extracting the same functions in the same order
 * with the same scope yields the same IDs.
 */
public class BranchInstrumenter {

    private final BranchIdScope scope;
    private final BranchIdSequence runSequence = new BranchIdSequence();

    public BranchInstrumenter() {
        this(BranchIdScope.FUNCTION);
    }

    public BranchInstrumenter(BranchIdScope scope) {
        this.scope = scope;
    }

    /**
     * Rewrites {@code function} in place and returns it.
     *
     * @throws MalformedFunctionException if a conditional branch has no {@code i1} condition;
     *         the function is left unchanged
     */
    public Function instrument(Function function) {
        List<Instruction> branches = new ArrayList<>();
        for (BasicBlock b : function.blocks()) {
            Instruction term = b.terminator();
            if (term == null || !term.isConditionalBranch()) {
                continue;
            }
            Value condition = term.condition();
            if (condition == null || condition.type() != IrType.I1) {
                throw new MalformedFunctionException(function.name(),
                        "conditional branch in block " + b.index() + " has no i1 condition");
            }
            branches.add(term);
        }

        Module module = function.parent();
        if (module == null) {
            throw new MalformedFunctionException(function.name(), "function is not part of a module");
        }
        module.declare(BranchLog.HOOK_NAME, IrType.VOID, List.of(IrType.I64, IrType.I1));

        BranchIdSequence ids = scope == BranchIdScope.RUN ? runSequence : new BranchIdSequence();
        FunctionBuilder builder = FunctionBuilder.edit(function);
        for (Instruction br : branches) {
            builder.before(br).call(null, IrType.VOID, BranchLog.HOOK_NAME,
                    Constant.i64(ids.next()), br.condition());
        }
        return function;
    }

    /** Instruments every defined function of {@code module}, in order. */
    public Module instrument(Module module) {
        for (Function f : module.functions()) {
            instrument(f);
        }
        return module;
    }
}
