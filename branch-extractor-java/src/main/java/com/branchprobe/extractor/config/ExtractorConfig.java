package com.branchprobe.extractor.config;

import com.branchprobe.extractor.static_analysis.BranchIdScope;
import com.branchprobe.extractor.static_analysis.PropagationMode;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the extractor's JSON config file. Every field is optional.
 */
public class ExtractorConfig {

    /** "predecessors" (default) or "bidirectional". */
    @SerializedName("propagation_mode")
    private String propagationMode;

    /** "function" (default) or "run". */
    @SerializedName("branch_id_scope")
    private String branchIdScope;

    @SerializedName("output_dir")
    private String outputDir;

    /**
     * Method-name prefixes to extract from class files, matched against
     * {@code owner::name}. Empty means every method.
     */
    @SerializedName("include_methods")
    private List<String> includeMethods;

    public PropagationMode getPropagationMode() {
        return propagationMode != null ? PropagationMode.fromText(propagationMode) : PropagationMode.PREDECESSORS;
    }

    public BranchIdScope getBranchIdScope() {
        return branchIdScope != null ? BranchIdScope.fromText(branchIdScope) : BranchIdScope.FUNCTION;
    }

    public String getOutputDir()            { return outputDir; }
    public List<String> getIncludeMethods() { return includeMethods != null ? includeMethods : Collections.emptyList(); }
}
