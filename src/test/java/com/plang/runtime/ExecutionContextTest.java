package com.plang.runtime;

import com.plang.exception.StepLimitExceededException;
import com.plang.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionContext.
 */
class ExecutionContextTest {

    @Test
    @DisplayName("Status moves PENDING -> RUNNING -> COMPLETED")
    void happyLifecycle() {
        ExecutionContext ctx = ExecutionContext.builder().requestId("r").build();
        assertEquals(ExecutionStatus.PENDING, ctx.getStatus());
        ctx.start();
        assertEquals(ExecutionStatus.RUNNING, ctx.getStatus());
        ctx.complete();
        assertEquals(ExecutionStatus.COMPLETED, ctx.getStatus());
    }

    @Test
    @DisplayName("Illegal transitions throw")
    void illegalTransitions() {
        ExecutionContext ctx = ExecutionContext.builder().requestId("r").build();
        assertThrows(IllegalStateException.class, ctx::complete);
        ctx.start();
        assertThrows(IllegalStateException.class, ctx::start);
        ctx.fail();
        assertThrows(IllegalStateException.class, ctx::complete);
        assertThrows(IllegalStateException.class, ctx::start);
    }

    @Test
    @DisplayName("Step budget resets per policy and totals accumulate")
    void stepBudget() {
        ExecutionContext ctx = ExecutionContext.builder().requestId("r").maxSteps(2).build();

        ctx.enterPolicy("a");
        ctx.step("a");
        ctx.step("a");
        assertThrows(StepLimitExceededException.class, () -> ctx.step("a"));
        ctx.exitPolicy();

        ctx.enterPolicy("b");
        assertEquals(0, ctx.getStepCount());
        ctx.step("b");
        ctx.exitPolicy();

        assertEquals(3, ctx.getTotalSteps());
    }

    @Test
    @DisplayName("Variables are converted to tagged values")
    void variablesAreTagged() {
        ExecutionContext ctx = ExecutionContext.builder()
                .requestId("r")
                .variables(Map.of("n", 3, "s", "x"))
                .build();

        assertEquals(Value.of(3L), ctx.getVariables().get("n"));
        assertEquals(Value.of("x"), ctx.getVariables().get("s"));
        assertEquals("exec-r", ctx.getExecutionId());
    }

    @Test
    @DisplayName("Builder validates its inputs")
    void builderValidation() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionContext.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionContext.builder().maxSteps(0));
        assertThrows(IllegalArgumentException.class,
                () -> ExecutionContext.builder().variable("bad", new Object()));
    }
}
