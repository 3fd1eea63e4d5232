package io.github.hunghhdev.cohortttl.core;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps expiry instants to cohort labels. All calculations are in UTC.
 *
 * <p>Labels of one granularity have a fixed width, so their natural string order is their time order:</p>
 * <ul>
 *   <li>minute: {@code 2024-03-01T10:15}</li>
 *   <li>hour: {@code 2024-03-01T10}</li>
 *   <li>day: {@code 2024-03-01}</li>
 *   <li>week: {@code 2024-W09} (ISO week-based year and week)</li>
 * </ul>
 */
public final class CohortCalculator {

    static final long ONE_HOUR_SECONDS = 3600;
    static final long ONE_DAY_SECONDS = 86400;

    private static final DateTimeFormatter MINUTE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HOUR_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DAY_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MINUTE_PARSE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm", Locale.ROOT);

    private CohortCalculator() {
    }

    /**
     * Picks the cohort granularity for a relative TTL.
     * Below one hour: minute. Below one day: hour. Otherwise: day.
     * {@link Granularity#WEEK} is never derived, a rule has to ask for it.
     */
    public static Granularity deriveGranularity(long ttlSeconds) {
        if (ttlSeconds < ONE_HOUR_SECONDS) {
            return Granularity.MINUTE;
        }
        if (ttlSeconds < ONE_DAY_SECONDS) {
            return Granularity.HOUR;
        }
        return Granularity.DAY;
    }

    /**
     * Returns the label of the cohort that contains {@code instant}.
     */
    public static String cohortFor(Instant instant, Granularity granularity) {
        switch (granularity) {
            case MINUTE:
                return MINUTE_FORMAT.format(instant);
            case HOUR:
                return HOUR_FORMAT.format(instant);
            case DAY:
                return DAY_FORMAT.format(instant);
            case WEEK:
                ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
                return String.format(Locale.ROOT, "%04d-W%02d",
                    utc.get(IsoFields.WEEK_BASED_YEAR), utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    /**
     * Returns the first instant of the cohort that contains {@code instant}.
     */
    public static Instant cohortStart(Instant instant, Granularity granularity) {
        switch (granularity) {
            case MINUTE:
                return instant.truncatedTo(ChronoUnit.MINUTES);
            case HOUR:
                return instant.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return instant.truncatedTo(ChronoUnit.DAYS);
            case WEEK:
                return instant.atZone(ZoneOffset.UTC)
                    .toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant();
            default:
                throw new IllegalArgumentException("Unsupported granularity: " + granularity);
        }
    }

    /**
     * Returns the first instant of the cohort named by {@code label}.
     *
     * @throws IllegalArgumentException if the label does not match the granularity's format
     */
    public static Instant startOf(String label, Granularity granularity) {
        try {
            switch (granularity) {
                case MINUTE:
                    return LocalDateTime.parse(label, MINUTE_PARSE).toInstant(ZoneOffset.UTC);
                case HOUR:
                    return LocalDateTime.parse(label + ":00", MINUTE_PARSE).toInstant(ZoneOffset.UTC);
                case DAY:
                    return LocalDate.parse(label).atStartOfDay(ZoneOffset.UTC).toInstant();
                case WEEK:
                    int separator = label.indexOf("-W");
                    if (separator < 0) {
                        throw new IllegalArgumentException("Not a week cohort label: " + label);
                    }
                    int year = Integer.parseInt(label.substring(0, separator));
                    int week = Integer.parseInt(label.substring(separator + 2));
                    return LocalDate.of(year, 1, 4)
                        .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                        .atStartOfDay(ZoneOffset.UTC)
                        .toInstant();
                default:
                    throw new IllegalArgumentException("Unsupported granularity: " + granularity);
            }
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + granularity.value() + " cohort label: " + label, e);
        }
    }

    /**
     * @return true if {@code label} is a cohort label of {@code granularity}
     */
    public static boolean isLabel(String label, Granularity granularity) {
        if (label == null) {
            return false;
        }
        try {
            return label.equals(cohortFor(startOf(label, granularity), granularity));
        } catch (IllegalArgumentException | DateTimeException e) {
            return false;
        }
    }

    /**
     * Returns the first instant after the cohort named by {@code label}.
     */
    public static Instant endOf(String label, Granularity granularity) {
        return startOf(label, granularity).plus(granularity.getWidth());
    }

    /**
     * Returns the label of the cohort immediately after {@code label}.
     */
    public static String next(String label, Granularity granularity) {
        return cohortFor(endOf(label, granularity), granularity);
    }

    /**
     * Returns the label {@code count} cohorts before {@code label}.
     */
    public static String previous(String label, Granularity granularity, int count) {
        Instant start = startOf(label, granularity);
        return cohortFor(start.minus(granularity.getWidth().multipliedBy(count)), granularity);
    }

    /**
     * Lists cohorts after {@code afterExclusive} up to and including {@code uptoInclusive}, oldest first.
     * A null {@code afterExclusive} yields just {@code uptoInclusive}.
     */
    public static List<String> cohortsBetween(String afterExclusive, String uptoInclusive, Granularity granularity) {
        List<String> cohorts = new ArrayList<>();
        if (afterExclusive == null) {
            cohorts.add(uptoInclusive);
            return cohorts;
        }
        String cursor = afterExclusive;
        while (cursor.compareTo(uptoInclusive) < 0) {
            cursor = next(cursor, granularity);
            cohorts.add(cursor);
        }
        return cohorts;
    }
}
