package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.util.Locale;

/**
 * Bucket size used to group expiring records into cohorts.
 *
 * <p>Each granularity carries the default firing rule of its scan loop and the number of
 * cohorts a freshly elected coordinator looks back on before it has a checkpoint of its own.</p>
 */
public enum Granularity {

    /**
     * One-minute cohorts. Used for rules with a TTL below one hour.
     * Scanned every 10 seconds by default.
     */
    MINUTE(Duration.ofMinutes(1), "*/10 * * * * *", 3),

    /**
     * One-hour cohorts. Used for rules with a TTL between one hour and one day.
     * Scanned every 10 minutes by default.
     */
    HOUR(Duration.ofHours(1), "0 */10 * * * *", 2),

    /**
     * One-day cohorts. Used for rules with a TTL of one day or more.
     * Scanned hourly by default.
     */
    DAY(Duration.ofDays(1), "0 0 * * * *", 2),

    /**
     * ISO-week cohorts. Only used when a rule asks for it explicitly.
     * Scanned daily by default.
     */
    WEEK(Duration.ofDays(7), "0 0 0 * * *", 2);

    private final Duration width;
    private final String defaultSchedule;
    private final int lookbackCohorts;

    Granularity(Duration width, String defaultSchedule, int lookbackCohorts) {
        this.width = width;
        this.defaultSchedule = defaultSchedule;
        this.lookbackCohorts = lookbackCohorts;
    }

    public Duration getWidth() {
        return width;
    }

    public String getDefaultSchedule() {
        return defaultSchedule;
    }

    public int getLookbackCohorts() {
        return lookbackCohorts;
    }

    /**
     * Lower-case name used in configuration, index documents and events.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration value such as {@code "hour"} (case-insensitive).
     *
     * @throws ConfigurationException if the value is not a known granularity
     */
    public static Granularity fromValue(String value) {
        if (value != null) {
            for (Granularity granularity : values()) {
                if (granularity.value().equalsIgnoreCase(value.trim())) {
                    return granularity;
                }
            }
        }
        throw new ConfigurationException("Unknown granularity '" + value + "', expected one of minute, hour, day, week");
    }
}
