package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;

/**
 * Next-fire-time function of a scan timer.
 */
public interface FireSchedule {

    /**
     * @return the first fire time strictly after {@code instant}
     */
    Instant nextFireAfter(Instant instant);

    /**
     * Parses a schedule string: an ISO-8601 duration ({@code PT10S}) for a fixed interval, otherwise a
     * 5- or 6-field cron expression evaluated in UTC.
     *
     * @throws ConfigurationException if the string is neither
     */
    static FireSchedule parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ConfigurationException("Schedule expression cannot be null or empty");
        }
        String trimmed = expression.trim();
        if (trimmed.charAt(0) == 'P' || trimmed.charAt(0) == 'p') {
            return IntervalSchedule.parse(trimmed);
        }
        return CronFireSchedule.parse(trimmed);
    }
}
