package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.CleanupOptions;
import io.github.hunghhdev.cohortttl.core.Document;
import io.github.hunghhdev.cohortttl.core.ExpireStrategy;
import io.github.hunghhdev.cohortttl.core.Granularity;
import io.github.hunghhdev.cohortttl.core.InMemoryDocumentStore;
import io.github.hunghhdev.cohortttl.core.TtlRule;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CohortTtlMetricsTest {

    private InMemoryDocumentStore store;
    private CleanupEngine engine;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        CleanupOptions.Builder options = CleanupOptions.builder()
                .enableCoordinator(false)
                .workerId("worker-a");
        for (Granularity granularity : Granularity.values()) {
            options.schedule(granularity, "PT1H");
        }
        engine = CleanupEngine.builder()
                .store(store)
                .rule(TtlRule.builder("sessions").ttlSeconds(60).onExpire(ExpireStrategy.HARD_DELETE).build())
                .options(options.build())
                .registerShutdownHook(false)
                .build();
        engine.start();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void testMetricsReflectEngineStatistics() {
        // Arrange
        new CohortTtlMetrics(engine, Tags.of("app", "test")).bindTo(registry);
        store.insert("sessions", Document.of("s1",
            Collections.singletonMap("createdAt", Instant.now().minusSeconds(3600).toString())));

        // Act
        engine.runCleanup();

        // Assert
        assertEquals(1.0, registry.get("cohortttl.scans").tag("worker", "worker-a").functionCounter().count());
        assertEquals(1.0, registry.get("cohortttl.expired").tag("strategy", "hard-delete").functionCounter().count());
        assertEquals(0.0, registry.get("cohortttl.expired").tag("strategy", "archive").functionCounter().count());
        assertEquals(0.0, registry.get("cohortttl.errors").functionCounter().count());
        assertEquals(0.0, registry.get("cohortttl.relocated").functionCounter().count());
        assertEquals(1.0, registry.get("cohortttl.coordinator").tag("app", "test").gauge().value());
        assertNotNull(registry.get("cohortttl.last.scan.duration").timeGauge());
    }

    @Test
    void testCoordinatorGaugeDropsAfterShutdown() {
        new CohortTtlMetrics(engine).bindTo(registry);

        engine.shutdown();

        assertEquals(0.0, registry.get("cohortttl.coordinator").gauge().value());
    }
}
