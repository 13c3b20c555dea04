package com.plang.runtime;

import com.plang.governance.ActionType;
import com.plang.intent.Intent;

import java.util.List;

/**
 * Outcome of running one policy.
 *
 * @param success true unless the policy failed
 * @param action  Action taken; ALLOW when the policy fell off its end or failed
 * @param intents Intents this policy emitted
 * @param trace   Trace of the context after the run
 * @param error   Failure message, null on success
 */
public record ExecutionResult(
        boolean success,
        ActionType action,
        List<Intent> intents,
        List<TraceEvent> trace,
        String error
) {
    public ExecutionResult {
        intents = List.copyOf(intents);
        trace = List.copyOf(trace);
    }

    public static ExecutionResult success(ActionType action, List<Intent> intents, List<TraceEvent> trace) {
        return new ExecutionResult(true, action, intents, trace, null);
    }

    public static ExecutionResult failure(String error, List<TraceEvent> trace) {
        return new ExecutionResult(false, ActionType.ALLOW, List.of(), trace, error);
    }
}
