package com.plang.service;

import java.util.Map;

/**
 * Input to one evaluation.
 *
 * @param requestId Caller's request id, required
 * @param userId    Acting user, may be null
 * @param agentId   Acting agent, may be null
 * @param variables Context variables as plain Java values
 * @param maxSteps  Per-policy step budget, or null for the configured default
 */
public record EvaluationRequest(
        String requestId,
        String userId,
        String agentId,
        Map<String, Object> variables,
        Integer maxSteps
) {
    public EvaluationRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        variables = variables == null ? Map.of() : variables;
    }

    public static EvaluationRequest of(String requestId, Map<String, Object> variables) {
        return new EvaluationRequest(requestId, null, null, variables, null);
    }
}
