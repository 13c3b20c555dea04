package com.plang.runtime;

import com.plang.exception.PolicyExecutionException;
import com.plang.governance.ActionType;
import com.plang.intent.Intent;
import com.plang.intent.IntentManager;
import com.plang.intent.IntentType;
import com.plang.ir.BasicBlock;
import com.plang.ir.Instruction;
import com.plang.ir.IrAction;
import com.plang.ir.IrBranch;
import com.plang.ir.IrCall;
import com.plang.ir.IrExpression;
import com.plang.ir.IrFunction;
import com.plang.ir.IrJump;
import com.plang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interprets one compiled policy against an execution context.
 * <p>
 * Execution starts at the entry block and follows branches and jumps until an action or the
 * end of a block without a terminator (the default ALLOW). Every instruction counts one step
 * against the context's per-policy budget.
 * <p>
 * When handed a PENDING context the engine owns its lifecycle: it starts it, completes or fails
 * it, and reports faults as a failed {@link ExecutionResult}. When handed a RUNNING context it
 * leaves the status to the caller and lets {@link PolicyExecutionException} propagate.
 * <p>
 * No I/O and no randomness: the same function over the same variables yields the same action,
 * intents and trace content.
 */
public class DeterministicEngine {

    private static final Logger log = LoggerFactory.getLogger(DeterministicEngine.class);

    private final ExpressionEvaluator evaluator;

    public DeterministicEngine() {
        this(new ExpressionEvaluator());
    }

    public DeterministicEngine(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Run a policy.
     *
     * @param function Compiled policy
     * @param context  PENDING or RUNNING context
     * @return Action, emitted intents and trace
     * @throws PolicyExecutionException on a fault, only when the context was already RUNNING
     * @throws IllegalStateException    when the context is COMPLETED or FAILED
     */
    public ExecutionResult execute(IrFunction function, ExecutionContext context) {
        boolean ownsLifecycle = context.getStatus() == ExecutionStatus.PENDING;
        if (ownsLifecycle) {
            context.start();
        } else if (context.getStatus() != ExecutionStatus.RUNNING) {
            throw new IllegalStateException("Cannot execute policy '" + function.id()
                    + "' in a " + context.getStatus() + " context");
        }

        try {
            ExecutionResult result = run(function, context);
            if (ownsLifecycle) {
                context.complete();
            }
            return result;
        } catch (PolicyExecutionException e) {
            if (!ownsLifecycle) {
                throw e;
            }
            log.debug("Policy '{}' failed: {}", function.id(), e.getMessage());
            context.fail();
            return ExecutionResult.failure(e.getMessage(), context.getTrace());
        }
    }

    private ExecutionResult run(IrFunction function, ExecutionContext context) {
        context.enterPolicy(function.id());
        try {
            context.record("function_enter", TraceEvent.data(
                    "policy", function.id(),
                    "category", function.category().name(),
                    "priority", function.priority()));

            IrAction action = interpret(function, context);
            List<Intent> emitted = new ArrayList<>();
            ActionType taken;

            if (action == null) {
                taken = ActionType.ALLOW;
            } else {
                taken = action.action();
                context.record("action", TraceEvent.data(
                        "policy", function.id(),
                        "action", taken.keyword(),
                        "target", action.target(),
                        "reason", action.reason()));
                emitIntent(function, action, context, emitted);
            }

            context.record("function_exit", TraceEvent.data(
                    "policy", function.id(),
                    "action", taken.keyword(),
                    "default", action == null,
                    "steps", context.getStepCount()));
            return ExecutionResult.success(taken, emitted, context.getTrace());
        } catch (RuntimeException e) {
            PolicyExecutionException failure = e instanceof PolicyExecutionException pe
                    ? pe
                    : new PolicyExecutionException(function.id(),
                            "Policy '" + function.id() + "' failed: " + e.getMessage(), e);
            context.record("function_exit", TraceEvent.data(
                    "policy", function.id(),
                    "failed", true,
                    "error", failure.getMessage(),
                    "steps", context.getStepCount()));
            throw failure;
        } finally {
            context.exitPolicy();
        }
    }

    /**
     * Walk blocks until an action or a fall-through.
     *
     * @return The action reached, or null for the default ALLOW
     */
    private IrAction interpret(IrFunction function, ExecutionContext context) {
        VariableResolver variables = new VariableResolver(context);
        Value[] temps = new Value[function.tempSlots()];
        BasicBlock block = function.entry();

        while (true) {
            Integer next = null;
            for (Instruction instruction : block.instructions()) {
                context.step(function.id());
                switch (instruction.kind()) {
                    case CALL -> call(function, (IrCall) instruction, variables, temps, context);
                    case BRANCH -> {
                        IrBranch branch = (IrBranch) instruction;
                        boolean taken = evaluator.evaluate(branch.condition(), variables, temps).isTruthy();
                        next = taken ? branch.thenBlock() : branch.elseBlock();
                        context.record("branch", TraceEvent.data(
                                "block", block.id(),
                                "condition", branch.condition().toString(),
                                "result", taken,
                                "target", next));
                    }
                    case JUMP -> next = ((IrJump) instruction).target();
                    case ACTION -> {
                        return (IrAction) instruction;
                    }
                }
            }
            if (next == null) {
                return null;
            }
            block = function.block(next);
        }
    }

    private void call(IrFunction function, IrCall call, VariableResolver variables, Value[] temps,
                      ExecutionContext context) {
        Builtin builtin = Builtin.lookup(call.function())
                .orElseThrow(() -> new PolicyExecutionException(function.id(),
                        "Unknown function '" + call.function() + "' in policy '" + function.id() + "'"));
        if (call.args().size() != builtin.arity()) {
            throw new PolicyExecutionException(function.id(), "Function '" + call.function() + "' expects "
                    + builtin.arity() + " argument(s), got " + call.args().size());
        }

        List<Value> args = new ArrayList<>(call.args().size());
        for (IrExpression arg : call.args()) {
            args.add(evaluator.evaluate(arg, variables, temps));
        }
        context.record("call_enter", TraceEvent.data(
                "function", call.function(),
                "args", args.stream().map(Value::toJava).toList()));

        Value result = builtin.invoke(args);
        temps[call.resultSlot()] = result;

        context.record("call_exit", TraceEvent.data(
                "function", call.function(),
                "result", result.toJava()));
    }

    private void emitIntent(IrFunction function, IrAction action, ExecutionContext context, List<Intent> emitted) {
        Map<String, Object> payload = new LinkedHashMap<>();
        IntentType type = switch (action.action()) {
            case ROUTE -> {
                payload.put("target_agent", action.target());
                yield IntentType.ROUTE;
            }
            case DENY -> {
                payload.put("reason", action.reason() != null ? action.reason() : "Denied by policy " + function.id());
                yield IntentType.DENY;
            }
            case ESCALATE -> {
                if (action.target() != null) {
                    payload.put("target", action.target());
                }
                payload.put("reason", action.reason() != null ? action.reason() : "Escalated by policy " + function.id());
                yield IntentType.ESCALATE;
            }
            case ALLOW -> IntentType.ALLOW;
        };

        IntentManager intents = context.getIntents();
        Intent intent = intents.create(type, payload, function.priority(), function.id());
        if (intents.emit(intent)) {
            emitted.add(intent);
        } else {
            context.record("intent_rejected", TraceEvent.data(
                    "policy", function.id(),
                    "intent", intent.getId(),
                    "errors", intent.getValidationErrors()));
        }
    }
}
