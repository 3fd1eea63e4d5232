package io.github.hunghhdev.cohortttl.spring;

import io.github.hunghhdev.cohortttl.core.CleanupEngine;
import io.github.hunghhdev.cohortttl.core.CleanupStatistics;
import io.github.hunghhdev.cohortttl.core.CoordinatorState;
import io.github.hunghhdev.cohortttl.core.ExpireStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CohortTtlHealthIndicatorTest {

    @Mock
    private CleanupEngine engine;

    private CohortTtlHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new CohortTtlHealthIndicator(engine);
    }

    private static CleanupStatistics stats(boolean running, boolean coordinator, CoordinatorState state,
                                           Instant lastScanAt) {
        Map<ExpireStrategy, Long> byStrategy = new EnumMap<>(ExpireStrategy.class);
        byStrategy.put(ExpireStrategy.HARD_DELETE, 7L);
        return new CleanupStatistics(12, 7, 7, 0, 0, 0, 2, 1, lastScanAt, Duration.ofMillis(40), 3,
            running, coordinator, state, "worker-a", 4, byStrategy);
    }

    @Test
    void health_returnsUp_whenCoordinating() {
        when(engine.getStats()).thenReturn(stats(true, true, CoordinatorState.COORDINATOR,
            Instant.parse("2024-03-01T10:00:00Z")));
        when(engine.getCoordinatorId()).thenReturn("worker-a");

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("worker-a", health.getDetails().get("workerId"));
        assertEquals(true, health.getDetails().get("coordinator"));
        assertEquals("COORDINATOR", health.getDetails().get("coordinator.state"));
        assertEquals(4L, health.getDetails().get("coordinator.epoch"));
        assertEquals("worker-a", health.getDetails().get("coordinator.id"));
        assertEquals(3, health.getDetails().get("resources"));
        assertEquals(12L, health.getDetails().get("stats.scans"));
        assertEquals(7L, health.getDetails().get("stats.expired"));
        assertEquals(1L, health.getDetails().get("stats.errors"));
        assertEquals(2L, health.getDetails().get("stats.relocated"));
        assertEquals("2024-03-01T10:00:00Z", health.getDetails().get("stats.lastScanAt"));
        assertEquals(40L, health.getDetails().get("stats.lastScanDurationMs"));
    }

    @Test
    void health_returnsUp_whenFollowing() {
        when(engine.getStats()).thenReturn(stats(true, false, CoordinatorState.FOLLOWER, null));
        when(engine.getCoordinatorId()).thenReturn("worker-b");

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(false, health.getDetails().get("coordinator"));
        assertEquals("worker-b", health.getDetails().get("coordinator.id"));
        assertFalse(health.getDetails().containsKey("stats.lastScanAt"));
    }

    @Test
    void health_omitsCoordinatorId_whenUnknown() {
        when(engine.getStats()).thenReturn(stats(true, false, CoordinatorState.OBSERVING, null));
        when(engine.getCoordinatorId()).thenReturn(null);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertFalse(health.getDetails().containsKey("coordinator.id"));
    }

    @Test
    void health_returnsDown_whenEngineStopped() {
        when(engine.getStats()).thenReturn(stats(false, false, CoordinatorState.STOPPED, null));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("STOPPED", health.getDetails().get("coordinator.state"));
    }

    @Test
    void health_returnsDown_whenExceptionOccurs() {
        when(engine.getStats()).thenThrow(new RuntimeException("Store unavailable"));
        when(engine.getWorkerId()).thenReturn("worker-a");

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Store unavailable", health.getDetails().get("error"));
        assertEquals("worker-a", health.getDetails().get("workerId"));
    }
}
