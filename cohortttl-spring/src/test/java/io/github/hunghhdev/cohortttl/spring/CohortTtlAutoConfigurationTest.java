package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.CleanupEventListener;
import io.github.hunghhdev.cohortttl.core.DocumentStore;
import io.github.hunghhdev.cohortttl.core.ExpireStrategy;
import io.github.hunghhdev.cohortttl.core.ExpiryCallback;
import io.github.hunghhdev.cohortttl.core.InMemoryDocumentStore;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class CohortTtlAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                CohortTtlAutoConfiguration.class,
                CohortTtlHealthAutoConfiguration.class))
            .withPropertyValues(
                "cohortttl.coordinator.enabled=false",
                "cohortttl.coordinator.worker-id=node-1",
                "cohortttl.schedules.minute=PT1H",
                "cohortttl.resources.sessions.ttl=PT5M",
                "cohortttl.resources.sessions.on-expire=hard-delete");

    @Test
    void engine_isCreatedAndStarted_whenStoreIsAvailable() {
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .run(context -> {
                assertNull(context.getStartupFailure());
                CleanupEngine engine = context.getBean(CleanupEngine.class);
                assertTrue(engine.isRunning());
                assertTrue(engine.isCoordinator());
                assertEquals("node-1", engine.getWorkerId());
                assertEquals(ExpireStrategy.HARD_DELETE, engine.getRule("sessions").orElseThrow().getStrategy());
                assertEquals(1, context.getBeansOfType(CohortTtlHealthIndicator.class).size());
            });
    }

    @Test
    void engine_isShutDown_whenContextCloses() {
        CleanupEngine[] captured = new CleanupEngine[1];
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .run(context -> captured[0] = context.getBean(CleanupEngine.class));

        assertFalse(captured[0].isRunning());
    }

    @Test
    void engine_registersCallbackBeansByName() {
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .withBean("notifyOwner", ExpiryCallback.class, () -> record -> true)
            .withPropertyValues(
                "cohortttl.resources.reports.ttl=P30D",
                "cohortttl.resources.reports.on-expire=callback",
                "cohortttl.resources.reports.callback=notifyOwner")
            .run(context -> {
                assertNull(context.getStartupFailure());
                CleanupEngine engine = context.getBean(CleanupEngine.class);
                assertEquals("notifyOwner", engine.getRule("reports").orElseThrow().getCallbackName());
            });
    }

    @Test
    void context_fails_whenCallbackIsMissing() {
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .withPropertyValues(
                "cohortttl.resources.reports.ttl=P30D",
                "cohortttl.resources.reports.on-expire=callback",
                "cohortttl.resources.reports.callback=missing")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void engine_notifiesListenerBeans() {
        RecordingListener listener = new RecordingListener();
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .withBean(CleanupEventListener.class, () -> listener)
            .run(context -> assertEquals("node-1", listener.electedWorker));
    }

    @Test
    void metricsBinder_isRegistered_whenMicrometerIsPresent() {
        contextRunner
            .withConfiguration(AutoConfigurations.of(CohortTtlMetricsAutoConfiguration.class))
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .run(context -> {
                MeterBinder binder = context.getBean("cohortTtlMetricsBinder", MeterBinder.class);
                SimpleMeterRegistry registry = new SimpleMeterRegistry();
                binder.bindTo(registry);

                assertEquals(1.0, registry.get("cohortttl.coordinator").tag("worker", "node-1").gauge().value());
            });
    }

    @Test
    void engine_isNotCreated_whenDisabled() {
        contextRunner
            .withBean(InMemoryDocumentStore.class, InMemoryDocumentStore::new)
            .withPropertyValues("cohortttl.enabled=false")
            .run(context -> {
                assertTrue(context.getBeansOfType(CleanupEngine.class).isEmpty());
                assertTrue(context.getBeansOfType(CohortTtlHealthIndicator.class).isEmpty());
            });
    }

    @Test
    void engine_isNotCreated_withoutStore() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBeansOfType(DocumentStore.class).isEmpty());
            assertTrue(context.getBeansOfType(CleanupEngine.class).isEmpty());
        });
    }

    private static final class RecordingListener implements CleanupEventListener {
        private volatile String electedWorker;

        @Override
        public void onCoordinatorElected(String workerId, long epoch) {
            electedWorker = workerId;
        }
    }
}
