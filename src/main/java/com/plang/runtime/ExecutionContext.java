package com.plang.runtime;

import com.plang.exception.StepLimitExceededException;
import com.plang.intent.IntentManager;
import com.plang.value.Value;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable state of one evaluation: status, variables, call stack, trace, step budget and intents.
 * <p>
 * Created per request and never shared between threads.
 */
public final class ExecutionContext {

    public static final int DEFAULT_MAX_STEPS = 200;

    private final String requestId;
    private final String userId;
    private final String agentId;
    private final String executionId;
    private final Map<String, Value> variables;
    private final int maxSteps;
    private final Clock clock;

    private final Deque<String> callStack = new ArrayDeque<>();
    private final List<TraceEvent> trace = new ArrayList<>();
    private final IntentManager intents = new IntentManager();
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private int stepCount;
    private int totalSteps;

    private ExecutionContext(Builder builder) {
        this.requestId = builder.requestId;
        this.userId = builder.userId;
        this.agentId = builder.agentId;
        this.executionId = builder.executionId != null ? builder.executionId : "exec-" + builder.requestId;
        this.variables = Collections.unmodifiableMap(new TreeMap<>(builder.variables));
        this.maxSteps = builder.maxSteps;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getUserId() {
        return userId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Value> getVariables() {
        return variables;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public int getStepCount() {
        return stepCount;
    }

    /**
     * Steps taken across all policies run with this context.
     */
    public int getTotalSteps() {
        return totalSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public List<String> getCallStack() {
        return List.copyOf(callStack);
    }

    public List<TraceEvent> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    public IntentManager getIntents() {
        return intents;
    }

    // Lifecycle

    public void start() {
        transition(ExecutionStatus.RUNNING);
    }

    public void complete() {
        transition(ExecutionStatus.COMPLETED);
    }

    public void fail() {
        transition(ExecutionStatus.FAILED);
    }

    private void transition(ExecutionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + status + " -> " + next
                    + " for request " + requestId);
        }
        status = next;
    }

    // Policy frames

    /**
     * Enter a policy: push it on the call stack and reset the per-policy step budget.
     */
    void enterPolicy(String policyId) {
        callStack.push(policyId);
        stepCount = 0;
    }

    void exitPolicy() {
        callStack.pop();
    }

    /**
     * Count one instruction against the budget.
     *
     * @throws StepLimitExceededException when the budget is exhausted
     */
    void step(String policyId) {
        if (stepCount >= maxSteps) {
            throw new StepLimitExceededException(policyId, maxSteps);
        }
        stepCount++;
        totalSteps++;
    }

    /**
     * Append an event to the trace, stamped with the current step and clock time.
     */
    public void record(String event, Map<String, Object> data) {
        trace.add(new TraceEvent(event, stepCount, data, clock.instant()));
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
                "requestId='" + requestId + '\'' +
                ", executionId='" + executionId + '\'' +
                ", status=" + status +
                ", steps=" + totalSteps +
                '}';
    }

    /**
     * Builder for ExecutionContext.
     */
    public static final class Builder {
        private String requestId;
        private String userId;
        private String agentId;
        private String executionId;
        private final Map<String, Value> variables = new LinkedHashMap<>();
        private int maxSteps = DEFAULT_MAX_STEPS;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(name, Value.from(value));
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            if (variables != null) {
                variables.forEach(this::variable);
            }
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            if (maxSteps < 1) {
                throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ExecutionContext build() {
            if (requestId == null || requestId.isBlank()) {
                throw new IllegalArgumentException("requestId is required");
            }
            return new ExecutionContext(this);
        }
    }
}
