package com.branchprobe.extractor.static_analysis;

import com.branchprobe.agent.BranchIdSequence;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.LoopNest;
import com.branchprobe.extractor.ir.MalformedFunctionException;
import com.branchprobe.extractor.ir.Module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the static engine over one function at a time:
 * labels, loop membership, control-flow distance, branch IDs, data dependencies, operand
 * classification.
 *
 * With {@link BranchIdScope#RUN} one extractor instance is one run: its counter continues
 * across every function it extracts, so functions must be extracted sequentially.
 */
public class FeatureExtractor {

    private final PropagationMode mode;
    private final BranchIdScope scope;
    private final BranchIdSequence runSequence = new BranchIdSequence();

    private final BlockLabeler labeler = new BlockLabeler();
    private final LoopAnnotator loopAnnotator = new LoopAnnotator();
    private final DistancePropagator distancePropagator;
    private final BranchIdAssigner branchIdAssigner = new BranchIdAssigner();
    private final DependencyCollector dependencyCollector = new DependencyCollector();
    private final InstructionClassifier classifier = new InstructionClassifier();

    public FeatureExtractor() {
        this(PropagationMode.PREDECESSORS, BranchIdScope.FUNCTION);
    }

    public FeatureExtractor(PropagationMode mode, BranchIdScope scope) {
        this.mode = mode;
        this.scope = scope;
        this.distancePropagator = new DistancePropagator(mode);
    }

    /**
     * @throws MalformedFunctionException if the function's CFG is structurally invalid
     */
    public FunctionFeatures extract(Function function) {
        function.verify();

        Map<BasicBlock, String> labels = labeler.label(function);
        LoopAnnotator.Result loops = loopAnnotator.annotate(function, LoopNest.compute(function));
        Map<Instruction, Integer> distances = distancePropagator.propagate(function);
        BranchIdSequence ids = scope == BranchIdScope.RUN ? runSequence : new BranchIdSequence();
        Map<Instruction, Long> branchIds = branchIdAssigner.assign(function, ids);
        Map<Instruction, Set<Instruction>> dependencies = dependencyCollector.collect(function);
        Map<Instruction, InstructionClassifier.Classification> classes = classifier.classify(function);

        Map<Instruction, FeatureRecord> records = new LinkedHashMap<>();
        for (Instruction i : function.instructions()) {
            InstructionClassifier.Classification c = classes.get(i);
            records.put(i, new FeatureRecord(
                    loops.inLoop(i),
                    loops.depth(i),
                    distances.get(i),
                    c.numPredecessors(),
                    c.numSuccessors(),
                    c.numOperands(),
                    c.memoryAccess(),
                    c.registerOperand(),
                    c.immediate()));
        }
        return new FunctionFeatures(function, labels, records, branchIds, dependencies, scope, mode);
    }

    /**
     * Extracts every defined function of {@code module} in order. A malformed function is
     * reported and skipped; the others are still extracted.
     */
    public List<FunctionFeatures> extractAll(Module module) {
        List<FunctionFeatures> all = new ArrayList<>();
        for (Function f : module.functions()) {
            try {
                all.add(extract(f));
            } catch (MalformedFunctionException e) {
                System.err.println("[branch-extractor] ERROR: skipping malformed function " + e.getMessage());
            }
        }
        return all;
    }

    public PropagationMode mode()  { return mode; }
    public BranchIdScope scope()   { return scope; }
}
