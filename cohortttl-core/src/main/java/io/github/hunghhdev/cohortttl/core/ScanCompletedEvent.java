package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;

/**
 * A scan pass finished, possibly early.
 *
 * @since 1.0.0
 */
public final class ScanCompletedEvent {
    private final CleanupRun run;

    public ScanCompletedEvent(CleanupRun run) {
        this.run = run;
    }

    public Granularity getGranularity() {
        return run.getGranularity();
    }

    public long getTotalExpired() {
        return run.getExpired();
    }

    public long getTotalProcessed() {
        return run.getProcessed();
    }

    public long getTotalErrors() {
        return run.getErrors();
    }

    public Duration getDuration() {
        return run.getDuration();
    }

    public CleanupRun getRun() {
        return run;
    }

    @Override
    public String toString() {
        return "ScanCompletedEvent{" + run + '}';
    }
}
