package com.plang.spring;

import com.plang.adapter.spring.PlangAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers a {@code PolicyRuntime} bean for applications that do not rely on
 * auto-configuration. The policy sources named in {@code plang.config-path} are compiled and
 * published while the context starts; a parse error or a blocking conflict stops startup.
 *
 * <pre>
 * &#64;Configuration
 * &#64;EnablePlang
 * public class GovernanceConfig {
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PlangAutoConfiguration.class)
public @interface EnablePlang {
}
