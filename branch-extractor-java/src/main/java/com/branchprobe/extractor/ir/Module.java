package com.branchprobe.extractor.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Translation unit: defined functions in insertion order plus external declarations. */
public class Module {

    private final String name;
    private final Map<String, Function> functions = new LinkedHashMap<>();
    private final Map<String, Function> declarations = new LinkedHashMap<>();

    public Module(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public List<Function> functions() {
        return Collections.unmodifiableList(new ArrayList<>(functions.values()));
    }

    public Function function(String functionName) {
        return functions.get(functionName);
    }

    public List<Function> declarations() {
        return Collections.unmodifiableList(new ArrayList<>(declarations.values()));
    }

    public Function declaration(String functionName) {
        return declarations.get(functionName);
    }

    /**
     * Declares an external function. Idempotent: a second call with the same name
     * returns the existing declaration.
     */
    public Function declare(String functionName, IrType returnType, List<IrType> parameterTypes) {
        Function existing = declarations.get(functionName);
        if (existing != null) {
            return existing;
        }
        List<Parameter> params = new ArrayList<>();
        for (int i = 0; i < parameterTypes.size(); i++) {
            params.add(new Parameter(i, parameterTypes.get(i), null));
        }
        Function decl = new Function(functionName, returnType, params);
        decl.setParent(this);
        declarations.put(functionName, decl);
        return decl;
    }

    void add(Function function) {
        if (functions.containsKey(function.name())) {
            throw new IllegalArgumentException("Duplicate function: " + function.name());
        }
        function.setParent(this);
        functions.put(function.name(), function);
    }
}
