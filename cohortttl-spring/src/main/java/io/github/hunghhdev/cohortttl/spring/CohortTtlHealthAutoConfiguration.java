package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link CohortTtlHealthIndicator} when Actuator is on the classpath.
 */
@Configuration
@ConditionalOnClass({HealthIndicator.class, CohortTtlHealthIndicator.class})
@ConditionalOnBean(CleanupEngine.class)
@AutoConfigureAfter(CohortTtlAutoConfiguration.class)
public class CohortTtlHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "cohortTtlHealthIndicator")
    public CohortTtlHealthIndicator cohortTtlHealthIndicator(CleanupEngine engine) {
        return new CohortTtlHealthIndicator(engine);
    }
}
