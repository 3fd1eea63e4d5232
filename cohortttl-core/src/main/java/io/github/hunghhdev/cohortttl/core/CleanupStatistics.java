package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time snapshot of an engine's counters and state.
 *
 * @since 1.0.0
 */
public class CleanupStatistics {
    private final long totalScans;
    private final long totalExpired;
    private final long totalDeleted;
    private final long totalArchived;
    private final long totalSoftDeleted;
    private final long totalCallbacks;
    private final long totalRelocated;
    private final long totalErrors;
    private final Instant lastScanAt;
    private final Duration lastScanDuration;
    private final int resources;
    private final boolean running;
    private final boolean coordinator;
    private final CoordinatorState coordinatorState;
    private final String workerId;
    private final long epoch;
    private final Map<ExpireStrategy, Long> expiredByStrategy;

    public CleanupStatistics(long totalScans, long totalExpired, long totalDeleted, long totalArchived,
                      long totalSoftDeleted, long totalCallbacks, long totalRelocated, long totalErrors,
                      Instant lastScanAt, Duration lastScanDuration, int resources, boolean running,
                      boolean coordinator, CoordinatorState coordinatorState, String workerId, long epoch,
                      Map<ExpireStrategy, Long> expiredByStrategy) {
        this.totalScans = totalScans;
        this.totalExpired = totalExpired;
        this.totalDeleted = totalDeleted;
        this.totalArchived = totalArchived;
        this.totalSoftDeleted = totalSoftDeleted;
        this.totalCallbacks = totalCallbacks;
        this.totalRelocated = totalRelocated;
        this.totalErrors = totalErrors;
        this.lastScanAt = lastScanAt;
        this.lastScanDuration = lastScanDuration;
        this.resources = resources;
        this.running = running;
        this.coordinator = coordinator;
        this.coordinatorState = coordinatorState;
        this.workerId = workerId;
        this.epoch = epoch;
        Map<ExpireStrategy, Long> byStrategy = new EnumMap<>(ExpireStrategy.class);
        byStrategy.putAll(expiredByStrategy);
        this.expiredByStrategy = Collections.unmodifiableMap(byStrategy);
    }

    /**
     * Returns the number of completed scan passes.
     */
    public long getTotalScans() {
        return totalScans;
    }

    /**
     * Returns the number of records disposed of, all strategies together.
     */
    public long getTotalExpired() {
        return totalExpired;
    }

    /**
     * Returns the number of records removed from their resource (hard delete, archive, accepted callbacks).
     */
    public long getTotalDeleted() {
        return totalDeleted;
    }

    /**
     * Returns the number of records disposed of by {@code strategy}.
     */
    public long getExpired(ExpireStrategy strategy) {
        return expiredByStrategy.getOrDefault(strategy, 0L);
    }

    public long getTotalArchived() {
        return totalArchived;
    }

    public long getTotalSoftDeleted() {
        return totalSoftDeleted;
    }

    /**
     * Returns the number of callback invocations, whatever the callback answered.
     */
    public long getTotalCallbacks() {
        return totalCallbacks;
    }

    public long getTotalRelocated() {
        return totalRelocated;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    /**
     * Returns when the last scan started, or null before the first one.
     */
    public Instant getLastScanAt() {
        return lastScanAt;
    }

    public Duration getLastScanDuration() {
        return lastScanDuration;
    }

    public int getResources() {
        return resources;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCoordinator() {
        return coordinator;
    }

    public CoordinatorState getCoordinatorState() {
        return coordinatorState;
    }

    public String getWorkerId() {
        return workerId;
    }

    public long getEpoch() {
        return epoch;
    }

    @Override
    public String toString() {
        return String.format(
            "CleanupStatistics{scans=%d, expired=%d, deleted=%d, archived=%d, softDeleted=%d, callbacks=%d, "
                + "relocated=%d, errors=%d, coordinator=%s}",
            totalScans, totalExpired, totalDeleted, totalArchived, totalSoftDeleted, totalCallbacks,
            totalRelocated, totalErrors, coordinator
        );
    }
}
