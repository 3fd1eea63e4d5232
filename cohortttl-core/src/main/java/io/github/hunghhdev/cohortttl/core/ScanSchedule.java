package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timer state of one granularity: its fire schedule, when it runs next, and how far each resource has been
 * drained.
 */
public final class ScanSchedule {

    private final Granularity granularity;
    private final FireSchedule fireSchedule;
    private final Map<String, String> lastProcessedCohorts = new ConcurrentHashMap<>();
    private volatile Instant nextRunAt;
    private volatile Instant lastRunAt;

    ScanSchedule(Granularity granularity, FireSchedule fireSchedule) {
        this.granularity = granularity;
        this.fireSchedule = fireSchedule;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public FireSchedule getFireSchedule() {
        return fireSchedule;
    }

    /**
     * @return the newest cohort of {@code resource} known to be fully drained, or null before the first pass
     */
    public String getLastProcessedCohort(String resource) {
        return lastProcessedCohorts.get(resource);
    }

    void setLastProcessedCohort(String resource, String cohort) {
        lastProcessedCohorts.put(resource, cohort);
    }

    public Map<String, String> getLastProcessedCohorts() {
        return Collections.unmodifiableMap(lastProcessedCohorts);
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    @Override
    public String toString() {
        return "ScanSchedule{" + granularity.value() + ", " + fireSchedule + ", nextRunAt=" + nextRunAt + '}';
    }
}
