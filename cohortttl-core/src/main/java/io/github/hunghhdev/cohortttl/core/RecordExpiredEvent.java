package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;

/**
 * A record was disposed of.
 *
 * @since 1.0.0
 */
public final class RecordExpiredEvent {
    private final String resource;
    private final String recordId;
    private final ExpireStrategy strategy;
    private final String cohort;
    private final Instant expiredAt;

    public RecordExpiredEvent(String resource, String recordId, ExpireStrategy strategy, String cohort, Instant expiredAt) {
        this.resource = resource;
        this.recordId = recordId;
        this.strategy = strategy;
        this.cohort = cohort;
        this.expiredAt = expiredAt;
    }

    public String getResource() {
        return resource;
    }

    public String getRecordId() {
        return recordId;
    }

    public ExpireStrategy getStrategy() {
        return strategy;
    }

    public String getCohort() {
        return cohort;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }

    @Override
    public String toString() {
        return "RecordExpiredEvent{" + resource + ":" + recordId + ", strategy=" + strategy + ", cohort=" + cohort + '}';
    }
}
