package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for cohort TTL Micrometer metrics.
 * Automatically binds engine metrics when Micrometer is on the classpath.
 */
@Configuration
@ConditionalOnClass({MeterRegistry.class, CohortTtlMetrics.class})
@ConditionalOnBean(CleanupEngine.class)
@AutoConfigureAfter({CohortTtlAutoConfiguration.class, CompositeMeterRegistryAutoConfiguration.class})
public class CohortTtlMetricsAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CohortTtlMetricsAutoConfiguration.class);

    @Bean
    public MeterBinder cohortTtlMetricsBinder(CleanupEngine engine) {
        return registry -> {
            new CohortTtlMetrics(engine).bindTo(registry);
            logger.info("Cohort TTL metrics enabled for worker {}", engine.getWorkerId());
        };
    }
}
