package com.plang.executor;

import com.plang.exception.PolicyExecutionException;
import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;
import com.plang.ir.IrFunction;
import com.plang.ir.IrModule;
import com.plang.runtime.DeterministicEngine;
import com.plang.runtime.ExecutionContext;
import com.plang.runtime.ExecutionResult;
import com.plang.runtime.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a module as ordered category stages.
 * <p>
 * Stages follow the fixed category order (SAFETY first, CUSTOM last); policies inside a stage keep
 * declaration order. The first DENY stops everything, including the rest of its stage.
 * A policy that fails is recorded and counted as ALLOW for that policy (fail-open).
 */
public class DagExecutor {

    private static final Logger log = LoggerFactory.getLogger(DagExecutor.class);

    private final DeterministicEngine engine;

    public DagExecutor() {
        this(new DeterministicEngine());
    }

    public DagExecutor(DeterministicEngine engine) {
        this.engine = engine;
    }

    /**
     * Build the staged plan for a module.
     */
    public ExecutionPlan buildPlan(IrModule module) {
        Map<GovernanceCategory, List<String>> byCategory = new EnumMap<>(GovernanceCategory.class);
        for (IrFunction function : module.functions()) {
            byCategory.computeIfAbsent(function.category(), k -> new ArrayList<>()).add(function.id());
        }

        List<Stage> stages = new ArrayList<>();
        byCategory.forEach((category, ids) -> stages.add(new Stage(category, ids)));
        return new ExecutionPlan(stages);
    }

    /**
     * Execute a plan against a fresh context.
     *
     * @param module  Module the plan was built from
     * @param plan    Plan to run
     * @param context PENDING context; COMPLETED on return
     * @return Final action, intents, events and counters
     */
    public ExecutionTrace execute(IrModule module, ExecutionPlan plan, ExecutionContext context) {
        context.start();
        GovernanceCounters counters = new GovernanceCounters();
        ActionType strongest = null;
        String deniedBy = null;

        context.record("plan_start", TraceEvent.data(
                "request_id", context.getRequestId(),
                "stages", plan.stages().size(),
                "policies", plan.policyCount()));

        stages:
        for (Stage stage : plan.stages()) {
            counters.increment(GovernanceCounters.STAGES_EXECUTED);
            context.record("stage_enter", TraceEvent.data(
                    "category", stage.category().name(),
                    "policies", stage.policyIds()));

            for (String policyId : stage.policyIds()) {
                IrFunction function = module.get(policyId)
                        .orElseThrow(() -> new IllegalStateException("Plan names unknown policy '" + policyId + "'"));
                counters.increment(GovernanceCounters.POLICIES_EVALUATED);

                ActionType action;
                try {
                    ExecutionResult result = engine.execute(function, context);
                    action = result.action();
                } catch (PolicyExecutionException e) {
                    log.warn("Policy '{}' failed open for request {}: {}",
                            policyId, context.getRequestId(), e.getMessage());
                    context.record("policy_failed", TraceEvent.data(
                            "policy", policyId,
                            "error", e.getMessage()));
                    counters.increment(GovernanceCounters.POLICIES_FAILED);
                    action = ActionType.ALLOW;
                }
                counters.passed(stage.category());
                strongest = ActionType.strongest(strongest, action);

                if (action == ActionType.DENY) {
                    deniedBy = policyId;
                    context.record("execution_halted", TraceEvent.data(
                            "policy", policyId,
                            "category", stage.category().name()));
                    context.record("stage_exit", TraceEvent.data("category", stage.category().name()));
                    break stages;
                }
            }
            context.record("stage_exit", TraceEvent.data("category", stage.category().name()));
        }

        ActionType finalAction = strongest == null ? ActionType.ALLOW : strongest;
        context.record("plan_complete", TraceEvent.data(
                "final_action", finalAction.keyword(),
                "total_steps", context.getTotalSteps()));
        context.complete();

        log.debug("Request {} finished with {} after {} policies", context.getRequestId(), finalAction,
                counters.get(GovernanceCounters.POLICIES_EVALUATED));
        return new ExecutionTrace(finalAction, deniedBy, context.getIntents().getEmitted(),
                context.getTrace(), counters.snapshot());
    }

    /**
     * Render a plan as an indented outline.
     */
    public String visualize(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("ExecutionPlan (").append(plan.stages().size()).append(" stages, ")
                .append(plan.policyCount()).append(" policies)\n");
        int index = 1;
        for (Stage stage : plan.stages()) {
            sb.append("  Stage ").append(index++).append(": ").append(stage.category()).append('\n');
            for (String policyId : stage.policyIds()) {
                sb.append("    - ").append(policyId).append('\n');
            }
        }
        return sb.toString();
    }
}
