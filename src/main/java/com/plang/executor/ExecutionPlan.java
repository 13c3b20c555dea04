package com.plang.executor;

import java.util.List;

/**
 * Ordered stages for one module. Immutable and shareable.
 *
 * @param stages Stages in category order, one per category present
 */
public record ExecutionPlan(List<Stage> stages) {

    public ExecutionPlan {
        stages = List.copyOf(stages);
    }

    public int policyCount() {
        return stages.stream().mapToInt(Stage::size).sum();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }
}
