package com.branchprobe.agent;

import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.AsmVisitorWrapper;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:branch-agent-java.jar=program=linear_search,namespace=com.myapp -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   program  : program identifier the log is keyed by (default: PROGRAM_NAME env, then "unknown")
 *   log_dir  : directory holding the branch log and index (default: branch_history_logs)
 *   namespace: class name prefix to instrument, e.g. "com.company" (default: "com.")
 *   index    : "true" or "false", write the branch index on shutdown (default: true)
 */
public class AgentBootstrap {

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process class files newer than it officially supports.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = parseArgs(agentArgs);
        String programId = new ProgramIdResolver().resolve(config.program());
        System.err.println("[branch-agent] attaching to namespace: " + config.namespace());
        System.err.println("[branch-agent] program: " + programId + ", log dir: " + config.logDir());

        DynamicLogger logger = new DynamicLogger(Paths.get(config.logDir()));
        logger.setProgramId(config.program());
        BranchLog.install(logger);

        // Register shutdown hook first so the log is closed even if instrumentation fails
        BranchIndex index = new BranchIndex();
        Path indexPath = config.indexEnabled()
                ? Paths.get(config.logDir(), programId + "_branch_index.json")
                : null;
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(logger, index, indexPath, programId)));

        AsmVisitorWrapper probes = probeWrapper(new BranchIdSequence(), index);

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[branch-agent] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            // Never probe the agent itself: BranchLog runs inside every probe.
            .type(
                nameStartsWith(config.namespace())
                    .and(not(nameStartsWith("com.branchprobe.agent")))
                    .and(not(nameContains("$$Lambda")))
            )
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(probes)
            )
            .installOn(instrumentation);

        System.err.println("[branch-agent] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /** Visitor wrapper probing every method of a type, IDs drawn from {@code ids}. */
    static AsmVisitorWrapper probeWrapper(BranchIdSequence ids, BranchIndex index) {
        return new AsmVisitorWrapper.ForDeclaredMethods()
            .invokable(any(), new BranchProbeVisitor.Wrapper(ids, index));
    }

    static AgentConfig parseArgs(String agentArgs) {
        String program = null;
        String logDir = DynamicLogger.DEFAULT_LOG_DIR;
        String namespace = "com.";
        boolean indexEnabled = true;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    switch (kv[0].trim()) {
                        case "program"   -> program      = kv[1].trim();
                        case "log_dir"   -> logDir       = kv[1].trim();
                        case "namespace" -> namespace    = kv[1].trim();
                        case "index"     -> indexEnabled = !"false".equalsIgnoreCase(kv[1].trim());
                        default -> System.err.println("[branch-agent] WARNING: unknown agent arg ignored: " + kv[0]);
                    }
                }
            }
        }
        return new AgentConfig(program, logDir, namespace, indexEnabled);
    }

    record AgentConfig(
        String program,
        String logDir,
        String namespace,
        boolean indexEnabled
    ) {}
}
