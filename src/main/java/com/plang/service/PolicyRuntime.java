package com.plang.service;

import com.plang.ast.PolicyDeclaration;
import com.plang.ast.PolicySet;
import com.plang.config.ActivationConfig;
import com.plang.config.PlangConfig;
import com.plang.conflict.ConflictResolver;
import com.plang.conflict.PolicyConflict;
import com.plang.conflict.ResolutionResult;
import com.plang.exception.ConfigurationException;
import com.plang.exception.ParseException;
import com.plang.executor.DagExecutor;
import com.plang.executor.ExecutionPlan;
import com.plang.executor.ExecutionTrace;
import com.plang.ir.IrBuilder;
import com.plang.ir.IrModule;
import com.plang.parser.PlangParser;
import com.plang.runtime.DeterministicEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for compiling and evaluating PLang policy sets.
 * <p>
 * Compilation (parse, lower, resolve conflicts) happens off to the side; {@link #publish} swaps the
 * result in atomically, so evaluations already running keep the module they started with.
 * Thread-safe; each evaluation gets its own context.
 */
public class PolicyRuntime {

    private static final Logger log = LoggerFactory.getLogger(PolicyRuntime.class);

    private final IrBuilder irBuilder = new IrBuilder();
    private final ConflictResolver resolver;
    private final DagExecutor executor;
    private final ExecutionContextFactory contextFactory;
    private final ActivationConfig activation;

    private final AtomicReference<CompilationResult> active = new AtomicReference<>();
    private final Map<IrModule, ExecutionPlan> plans = Collections.synchronizedMap(new WeakHashMap<>());

    public PolicyRuntime() {
        this(PlangConfig.defaults());
    }

    public PolicyRuntime(PlangConfig config) {
        this(config, Clock.systemUTC());
    }

    public PolicyRuntime(PlangConfig config, Clock clock) {
        this.resolver = new ConflictResolver(config.resolver().signatureLength());
        this.executor = new DagExecutor(new DeterministicEngine());
        this.contextFactory = new ExecutionContextFactory(config.engine().maxSteps(), clock);
        this.activation = config.activation();
    }

    /**
     * Compile one source text.
     *
     * @param source PLang source
     * @return Resolved module and conflicts
     * @throws ParseException when the source is malformed
     */
    public CompilationResult compile(String source) {
        return compile(PlangParser.parse(source));
    }

    /**
     * Compile several named sources as one policy set, e.g. the files listed in the configuration.
     * Policy names must be unique across all of them.
     *
     * @param sources Source text keyed by location, in load order
     * @return Resolved module and conflicts
     * @throws ConfigurationException when a source is malformed or a name is declared twice
     */
    public CompilationResult compileAll(Map<String, String> sources) {
        List<PolicyDeclaration> declarations = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            PolicySet parsed;
            try {
                parsed = PlangParser.parse(source.getValue());
            } catch (ParseException e) {
                throw new ConfigurationException("Invalid policy source " + source.getKey() + ": " + e.getMessage(), e);
            }
            for (PolicyDeclaration declaration : parsed.policies()) {
                if (!names.add(declaration.name())) {
                    throw new ConfigurationException("Policy '" + declaration.name()
                            + "' is declared more than once (again in " + source.getKey() + ")");
                }
                declarations.add(declaration);
            }
        }
        return compile(new PolicySet(declarations));
    }

    private CompilationResult compile(PolicySet policySet) {
        IrModule module = irBuilder.build(policySet);
        ResolutionResult resolution = resolver.resolve(module);
        log.info("Compiled {} policies with {} conflict(s), {} unresolved",
                module.size(), resolution.conflicts().size(), resolution.unresolved().size());
        return new CompilationResult(resolution.module(), resolution.conflicts());
    }

    /**
     * Evaluate a request against a module.
     */
    public ExecutionTrace evaluate(IrModule module, EvaluationRequest request) {
        ExecutionPlan plan = getExecutionPlan(module);
        return executor.execute(module, plan, contextFactory.create(request));
    }

    /**
     * Evaluate a request against the published module.
     *
     * @throws IllegalStateException when nothing has been published
     */
    public ExecutionTrace evaluate(EvaluationRequest request) {
        IrModule module = activeModule()
                .orElseThrow(() -> new IllegalStateException("No policy set has been published"));
        return evaluate(module, request);
    }

    /**
     * Evaluate a request whose variables come as a JSON object.
     */
    public ExecutionTrace evaluateJson(IrModule module, String requestId, String userId, String agentId, String json) {
        ExecutionPlan plan = getExecutionPlan(module);
        return executor.execute(module, plan, contextFactory.fromJson(requestId, userId, agentId, json, null));
    }

    public ExecutionPlan getExecutionPlan(IrModule module) {
        return plans.computeIfAbsent(module, executor::buildPlan);
    }

    public String visualizePlan(IrModule module) {
        return executor.visualize(getExecutionPlan(module));
    }

    /**
     * Make a compiled module the active one.
     *
     * @throws ConfigurationException when an unresolved conflict reaches the blocking severity
     */
    public void publish(CompilationResult compilation) {
        for (PolicyConflict conflict : compilation.unresolvedConflicts()) {
            if (activation.blocks(conflict.getSeverity())) {
                throw new ConfigurationException("Refusing to publish: unresolved " + conflict.getType()
                        + " conflict (severity " + conflict.getSeverity() + ") between "
                        + conflict.getPolicies() + ": " + conflict.getDescription());
            }
        }
        CompilationResult previous = active.getAndSet(compilation);
        log.info("Published policy set {} (replaced {})", compilation.module(),
                previous == null ? "none" : previous.module());
    }

    public Optional<IrModule> activeModule() {
        CompilationResult current = active.get();
        return current == null ? Optional.empty() : Optional.of(current.module());
    }

    public Optional<CompilationResult> activeCompilation() {
        return Optional.ofNullable(active.get());
    }
}
