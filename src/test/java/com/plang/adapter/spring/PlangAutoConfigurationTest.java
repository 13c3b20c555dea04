package com.plang.adapter.spring;

import com.plang.config.PlangConfig;
import com.plang.exception.ConfigurationException;
import com.plang.executor.ExecutionTrace;
import com.plang.governance.ActionType;
import com.plang.service.EvaluationRequest;
import com.plang.service.PolicyRuntime;
import com.plang.spring.EnablePlang;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlangAutoConfiguration.
 */
class PlangAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PlangAutoConfiguration.class));

    @Test
    @DisplayName("Should publish the bundled baseline policies by default")
    void defaultConfiguration() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            PolicyRuntime runtime = context.getBean(PolicyRuntime.class);

            assertEquals(List.of("block_harmful_content", "protect_pii", "throttle_heavy_requests", "route_experts"),
                    runtime.activeModule().orElseThrow().ids());

            ExecutionTrace trace = runtime.evaluate(EvaluationRequest.of("r1",
                    Map.of("message", "hello", "risk_score", 0.1, "topic", "medical")));
            assertEquals(ActionType.ROUTE, trace.finalAction());
        });
    }

    @Test
    @DisplayName("Should load the configured file")
    void customConfigPath() {
        contextRunner
                .withPropertyValues("plang.config-path=classpath:plang-test.yaml")
                .run(context -> {
                    PlangConfig config = context.getBean(PlangConfig.class);
                    assertEquals("test-governance", config.name());
                    assertEquals(25, config.engine().maxSteps());

                    PolicyRuntime runtime = context.getBean(PolicyRuntime.class);
                    assertEquals(List.of("block_exploits", "route_legal"), runtime.activeModule().orElseThrow().ids());

                    ExecutionTrace trace = runtime.evaluate(EvaluationRequest.of("r2",
                            Map.of("message", "exploit kit", "topic", "legal")));
                    assertTrue(trace.isDenied());
                    assertEquals("block_exploits", trace.deniedBy());
                });
    }

    @Test
    @DisplayName("Should create no beans when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("plang.enabled=false")
                .run(context -> {
                    assertFalse(context.containsBean("policyRuntime"));
                    assertTrue(context.getBeansOfType(PolicyRuntime.class).isEmpty());
                });
    }

    @Test
    @DisplayName("Should fail startup on a blocking conflict")
    void blockingConflictFailsStartup() {
        contextRunner
                .withPropertyValues("plang.config-path=classpath:plang-cycle.yaml")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    assertTrue(hasCause(failure, ConfigurationException.class));
                });
    }

    @Test
    @DisplayName("Should fail startup when the configuration file is missing")
    void missingConfigFailsStartup() {
        contextRunner
                .withPropertyValues("plang.config-path=classpath:does-not-exist.yaml")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should back off when a runtime bean already exists")
    void userDefinedRuntime() {
        PolicyRuntime custom = new PolicyRuntime();
        contextRunner
                .withBean(PolicyRuntime.class, () -> custom)
                .run(context -> {
                    assertSame(custom, context.getBean(PolicyRuntime.class));
                    assertTrue(custom.activeModule().isEmpty());
                });
    }

    @Test
    @DisplayName("@EnablePlang wires the runtime without auto-configuration")
    void enableAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(EnabledApplication.class)
                .withPropertyValues("plang.config-path=classpath:plang-test.yaml")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertTrue(context.getBean(PolicyRuntime.class).activeModule().isPresent());
                });
    }

    @Configuration
    @EnablePlang
    static class EnabledApplication {
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }
}
