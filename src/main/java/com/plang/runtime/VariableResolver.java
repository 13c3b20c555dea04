package com.plang.runtime;

import com.plang.value.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves dotted variable paths against an execution context.
 * <p>
 * Root names are looked up among the synthetic bindings first ({@code ctx}, {@code request},
 * {@code user}), then among the context variables. Later segments walk map members.
 * Anything missing resolves to {@link Value#NULL}.
 */
public class VariableResolver {

    public static final String CTX = "ctx";
    public static final String REQUEST = "request";
    public static final String USER = "user";

    private final ExecutionContext context;

    public VariableResolver(ExecutionContext context) {
        this.context = context;
    }

    public Value resolve(List<String> path) {
        if (path.isEmpty()) {
            return Value.NULL;
        }
        Value current = root(path.get(0));
        for (int i = 1; i < path.size(); i++) {
            if (!(current instanceof Value.MapValue map)) {
                return Value.NULL;
            }
            current = map.get(path.get(i));
        }
        return current;
    }

    private Value root(String name) {
        return switch (name) {
            case CTX -> ctxBinding();
            case REQUEST -> singleton("id", context.getRequestId());
            case USER -> singleton("id", context.getUserId());
            default -> {
                Value value = context.getVariables().get(name);
                yield value == null ? Value.NULL : value;
            }
        };
    }

    // Built on every lookup because step_count moves while a policy runs
    private Value ctxBinding() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("request_id", Value.of(context.getRequestId()));
        entries.put("user_id", Value.of(context.getUserId()));
        entries.put("agent_id", Value.of(context.getAgentId()));
        entries.put("execution_id", Value.of(context.getExecutionId()));
        entries.put("status", Value.of(context.getStatus().name()));
        entries.put("step_count", Value.of((long) context.getStepCount()));
        entries.put("max_steps", Value.of((long) context.getMaxSteps()));
        entries.put("variables", new Value.MapValue(context.getVariables()));
        return new Value.MapValue(entries);
    }

    private static Value singleton(String key, String value) {
        return new Value.MapValue(Map.of(key, Value.of(value)));
    }
}
