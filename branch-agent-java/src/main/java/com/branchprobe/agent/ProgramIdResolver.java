package com.branchprobe.agent;

import java.util.function.Function;

/**
 * Resolves the identifier a run's branch log is keyed by.
 *
 * Resolution order: explicit value, then the {@code PROGRAM_NAME} environment variable,
 * then {@value #FALLBACK}.
 */
public class ProgramIdResolver {

    public static final String ENV_VARIABLE = "PROGRAM_NAME";
    public static final String FALLBACK = "unknown";

    private final Function<String, String> environment;

    public ProgramIdResolver() {
        this(System::getenv);
    }

    /** Test seam: {@code environment} stands in for {@link System#getenv(String)}. */
    public ProgramIdResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    public String resolve(String explicitId) {
        if (explicitId != null && !explicitId.isBlank()) {
            return explicitId.trim();
        }
        String fromEnv = environment.apply(ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return FALLBACK;
    }
}
