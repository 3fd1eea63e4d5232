package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Fires at a fixed interval after the previous fire.
 */
public final class IntervalSchedule implements FireSchedule {

    private final Duration interval;

    public IntervalSchedule(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Schedule interval must be positive, got " + interval);
        }
        this.interval = interval;
    }

    static IntervalSchedule parse(String expression) {
        try {
            return new IntervalSchedule(Duration.parse(expression));
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid schedule interval '" + expression + "'", e);
        }
    }

    @Override
    public Instant nextFireAfter(Instant instant) {
        return instant.plus(interval);
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public String toString() {
        return "every " + interval;
    }
}
