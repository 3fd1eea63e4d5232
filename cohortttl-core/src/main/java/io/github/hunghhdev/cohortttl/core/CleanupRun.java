package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one scan pass over one granularity (or one resource).
 *
 * @since 1.0.0
 */
public final class CleanupRun {

    /**
     * Why a pass did nothing.
     */
    public enum SkipReason {
        /** This instance does not hold the coordinator lease. */
        NOT_COORDINATOR,
        /** A pass for the same granularity is still running. */
        ALREADY_RUNNING,
        /** The engine is shutting down. */
        STOPPED
    }

    private final Granularity granularity;
    private final List<String> resources;
    private final List<String> cohortsVisited;
    private final long processed;
    private final long expired;
    private final long relocated;
    private final long deferred;
    private final long errors;
    private final Map<ExpireStrategy, Long> expiredByStrategy;
    private final Instant startedAt;
    private final Duration duration;
    private final boolean aborted;
    private final SkipReason skipReason;

    private CleanupRun(Recorder recorder, Duration duration, SkipReason skipReason) {
        this.granularity = recorder.granularity;
        this.resources = Collections.unmodifiableList(new ArrayList<>(recorder.resources));
        this.cohortsVisited = Collections.unmodifiableList(new ArrayList<>(recorder.cohortsVisited));
        this.processed = recorder.processed;
        this.expired = recorder.expired;
        this.relocated = recorder.relocated;
        this.deferred = recorder.deferred;
        this.errors = recorder.errors;
        this.expiredByStrategy = Collections.unmodifiableMap(new EnumMap<>(recorder.expiredByStrategy));
        this.startedAt = recorder.startedAt;
        this.duration = duration;
        this.aborted = recorder.aborted;
        this.skipReason = skipReason;
    }

    static CleanupRun skipped(Granularity granularity, List<String> resources, SkipReason reason, Instant now) {
        Recorder recorder = new Recorder(granularity, now);
        recorder.resources.addAll(resources);
        return new CleanupRun(recorder, Duration.ZERO, reason);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public List<String> getResources() {
        return resources;
    }

    public List<String> getCohortsVisited() {
        return cohortsVisited;
    }

    /**
     * @return index entries examined
     */
    public long getProcessed() {
        return processed;
    }

    /**
     * @return records disposed of by this pass
     */
    public long getExpired() {
        return expired;
    }

    /**
     * @return entries moved to another cohort because the live record's expiry changed
     */
    public long getRelocated() {
        return relocated;
    }

    /**
     * @return callback records kept and rescheduled
     */
    public long getDeferred() {
        return deferred;
    }

    public long getErrors() {
        return errors;
    }

    public long getExpired(ExpireStrategy strategy) {
        return expiredByStrategy.getOrDefault(strategy, 0L);
    }

    public Map<ExpireStrategy, Long> getExpiredByStrategy() {
        return expiredByStrategy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * @return true if the pass stopped early on shutdown or a storage failure
     */
    public boolean isAborted() {
        return aborted;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public SkipReason getSkipReason() {
        return skipReason;
    }

    @Override
    public String toString() {
        if (skipReason != null) {
            return "CleanupRun{granularity=" + granularity + ", skipped=" + skipReason + '}';
        }
        return "CleanupRun{" +
               "granularity=" + granularity +
               ", resources=" + resources +
               ", cohorts=" + cohortsVisited.size() +
               ", processed=" + processed +
               ", expired=" + expired +
               ", relocated=" + relocated +
               ", deferred=" + deferred +
               ", errors=" + errors +
               ", duration=" + duration.toMillis() + "ms" +
               (aborted ? ", aborted" : "") +
               '}';
    }

    /**
     * Mutable tally filled in while a pass runs.
     */
    static final class Recorder {
        private final Granularity granularity;
        private final Instant startedAt;
        private final List<String> resources = new ArrayList<>();
        private final List<String> cohortsVisited = new ArrayList<>();
        private final Map<ExpireStrategy, Long> expiredByStrategy = new EnumMap<>(ExpireStrategy.class);
        private long processed;
        private long expired;
        private long relocated;
        private long deferred;
        private long errors;
        private boolean aborted;

        Recorder(Granularity granularity, Instant startedAt) {
            this.granularity = granularity;
            this.startedAt = startedAt;
        }

        void resource(String resource) {
            resources.add(resource);
        }

        void cohort(String cohort) {
            if (!cohortsVisited.contains(cohort)) {
                cohortsVisited.add(cohort);
            }
        }

        void processed() {
            processed++;
        }

        void expired(ExpireStrategy strategy) {
            expired++;
            expiredByStrategy.merge(strategy, 1L, Long::sum);
        }

        void relocated() {
            relocated++;
        }

        void deferred() {
            deferred++;
        }

        void error() {
            errors++;
        }

        void abort() {
            aborted = true;
        }

        CleanupRun finish(Clock clock) {
            return new CleanupRun(this, Duration.between(startedAt, clock.instant()), null);
        }
    }
}
