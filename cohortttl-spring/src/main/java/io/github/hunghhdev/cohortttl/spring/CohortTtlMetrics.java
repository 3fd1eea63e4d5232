package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.ExpireStrategy;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics binder for the cohort TTL engine.
 *
 * <p>Metrics exposed:</p>
 * <ul>
 *   <li>{@code cohortttl.scans} - Counter for completed scan passes</li>
 *   <li>{@code cohortttl.expired} - Counter for disposed records (tagged by strategy)</li>
 *   <li>{@code cohortttl.errors} - Counter for record and scan failures</li>
 *   <li>{@code cohortttl.relocated} - Counter for index entries moved to a new cohort</li>
 *   <li>{@code cohortttl.last.scan.duration} - Gauge for the duration of the last scan</li>
 *   <li>{@code cohortttl.coordinator} - Gauge, 1 while this instance coordinates, else 0</li>
 * </ul>
 */
public class CohortTtlMetrics implements MeterBinder {

    private final CleanupEngine engine;
    private final Iterable<Tag> tags;

    public CohortTtlMetrics(CleanupEngine engine) {
        this(engine, Collections.emptyList());
    }

    /**
     * Create metrics for an engine with additional tags.
     *
     * @param engine the engine to monitor
     * @param tags additional tags to apply to all metrics
     */
    public CohortTtlMetrics(CleanupEngine engine, Iterable<Tag> tags) {
        this.engine = engine;
        this.tags = tags;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        String workerId = engine.getWorkerId();

        FunctionCounter.builder("cohortttl.scans", engine, e -> e.getStats().getTotalScans())
                .tags(tags)
                .tag("worker", workerId)
                .description("The number of completed scan passes")
                .register(registry);

        for (ExpireStrategy strategy : ExpireStrategy.values()) {
            FunctionCounter.builder("cohortttl.expired", engine, e -> e.getStats().getExpired(strategy))
                    .tags(tags)
                    .tag("worker", workerId)
                    .tag("strategy", strategy.value())
                    .description("The number of expired records disposed of")
                    .register(registry);
        }

        FunctionCounter.builder("cohortttl.errors", engine, e -> e.getStats().getTotalErrors())
                .tags(tags)
                .tag("worker", workerId)
                .description("The number of failed record disposals and aborted scans")
                .register(registry);

        FunctionCounter.builder("cohortttl.relocated", engine, e -> e.getStats().getTotalRelocated())
                .tags(tags)
                .tag("worker", workerId)
                .description("The number of index entries moved to a later cohort")
                .register(registry);

        TimeGauge.builder("cohortttl.last.scan.duration", engine, TimeUnit.MILLISECONDS,
                        e -> e.getStats().getLastScanDuration().toMillis())
                .tags(tags)
                .tag("worker", workerId)
                .description("The duration of the last scan pass")
                .register(registry);

        Gauge.builder("cohortttl.coordinator", engine, e -> e.isCoordinator() ? 1.0 : 0.0)
                .tags(tags)
                .tag("worker", workerId)
                .description("Whether this instance is the cleanup coordinator (1) or not (0)")
                .register(registry);
    }
}
