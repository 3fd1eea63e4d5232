package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.CleanupStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the cohort TTL engine.
 * UP while the engine runs, whether or not this instance coordinates; DOWN once it has shut down.
 */
public class CohortTtlHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(CohortTtlHealthIndicator.class);

    private final CleanupEngine engine;

    public CohortTtlHealthIndicator(CleanupEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        try {
            CleanupStatistics stats = engine.getStats();
            Health.Builder builder = stats.isRunning() ? Health.up() : Health.down();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("workerId", stats.getWorkerId());
            details.put("coordinator", stats.isCoordinator());
            details.put("coordinator.state", stats.getCoordinatorState().name());
            details.put("coordinator.epoch", stats.getEpoch());
            String coordinatorId = engine.getCoordinatorId();
            if (coordinatorId != null) {
                details.put("coordinator.id", coordinatorId);
            }
            details.put("resources", stats.getResources());
            details.put("stats.scans", stats.getTotalScans());
            details.put("stats.expired", stats.getTotalExpired());
            details.put("stats.errors", stats.getTotalErrors());
            details.put("stats.relocated", stats.getTotalRelocated());
            if (stats.getLastScanAt() != null) {
                details.put("stats.lastScanAt", stats.getLastScanAt().toString());
                details.put("stats.lastScanDurationMs", stats.getLastScanDuration().toMillis());
            }

            return builder.withDetails(details).build();

        } catch (Exception e) {
            logger.error("Cohort TTL health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("workerId", engine.getWorkerId())
                    .build();
        }
    }
}
