package com.plang.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plang.runtime.ExecutionContext;

import java.time.Clock;
import java.util.Map;

/**
 * Factory for creating ExecutionContext from requests or JSON variable documents.
 * Nested JSON objects stay nested and are reached with dotted paths (e.g. {@code user_profile.tier}).
 */
public class ExecutionContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final int defaultMaxSteps;
    private final Clock clock;

    public ExecutionContextFactory(int defaultMaxSteps) {
        this(defaultMaxSteps, Clock.systemUTC());
    }

    public ExecutionContextFactory(int defaultMaxSteps, Clock clock) {
        this.defaultMaxSteps = defaultMaxSteps;
        this.clock = clock;
    }

    /**
     * Create a PENDING context for a request.
     */
    public ExecutionContext create(EvaluationRequest request) {
        return ExecutionContext.builder()
                .requestId(request.requestId())
                .userId(request.userId())
                .agentId(request.agentId())
                .variables(request.variables())
                .maxSteps(request.maxSteps() != null ? request.maxSteps() : defaultMaxSteps)
                .clock(clock)
                .build();
    }

    /**
     * Create a PENDING context from a JSON object of variables.
     *
     * @param requestId Request id
     * @param userId    User id, may be null
     * @param agentId   Agent id, may be null
     * @param json      JSON object; null or blank means no variables
     * @param maxSteps  Step budget, or null for the default
     * @return New context
     */
    public ExecutionContext fromJson(String requestId, String userId, String agentId, String json, Integer maxSteps) {
        Map<String, Object> variables = json == null || json.isBlank() ? Map.of() : parseJson(json);
        return create(new EvaluationRequest(requestId, userId, agentId, variables, maxSteps));
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON variables: " + e.getMessage(), e);
        }
    }
}
