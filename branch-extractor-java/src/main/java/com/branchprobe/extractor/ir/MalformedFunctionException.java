package com.branchprobe.extractor.ir;

/**
 * A function's control-flow graph violates a structural invariant (a reachable block
 * without terminator, a conditional branch without an {@code i1} condition). Fatal for
 * the function it names; other functions are still processed.
 */
public class MalformedFunctionException extends RuntimeException {

    private final String functionName;

    public MalformedFunctionException(String functionName, String message) {
        super(functionName + ": " + message);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}
