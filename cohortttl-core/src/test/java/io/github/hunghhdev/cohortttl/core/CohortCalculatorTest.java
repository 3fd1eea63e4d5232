package io.github.hunghhdev.cohortttl.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class CohortCalculatorTest {

    private static final Instant INSTANT = Instant.parse("2024-03-01T10:15:42Z");

    @Test
    void testDeriveGranularityBoundaries() {
        assertEquals(Granularity.MINUTE, CohortCalculator.deriveGranularity(1));
        assertEquals(Granularity.MINUTE, CohortCalculator.deriveGranularity(3599));
        assertEquals(Granularity.HOUR, CohortCalculator.deriveGranularity(3600));
        assertEquals(Granularity.HOUR, CohortCalculator.deriveGranularity(86399));
        assertEquals(Granularity.DAY, CohortCalculator.deriveGranularity(86400));
        assertEquals(Granularity.DAY, CohortCalculator.deriveGranularity(30L * 86400));
    }

    @Test
    void testCohortLabels() {
        assertEquals("2024-03-01T10:15", CohortCalculator.cohortFor(INSTANT, Granularity.MINUTE));
        assertEquals("2024-03-01T10", CohortCalculator.cohortFor(INSTANT, Granularity.HOUR));
        assertEquals("2024-03-01", CohortCalculator.cohortFor(INSTANT, Granularity.DAY));
        assertEquals("2024-W09", CohortCalculator.cohortFor(INSTANT, Granularity.WEEK));
    }

    @Test
    void testWeekLabelUsesIsoWeekBasedYear() {
        // 2024-12-30 is a Monday in ISO week 1 of 2025
        assertEquals("2025-W01", CohortCalculator.cohortFor(Instant.parse("2024-12-30T00:00:00Z"), Granularity.WEEK));
        // 2021-01-03 is a Sunday in ISO week 53 of 2020
        assertEquals("2020-W53", CohortCalculator.cohortFor(Instant.parse("2021-01-03T23:59:59Z"), Granularity.WEEK));
    }

    @Test
    void testWeekLabelIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

            assertEquals("2024-W09", CohortCalculator.cohortFor(INSTANT, Granularity.WEEK));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void testIsLabel() {
        assertTrue(CohortCalculator.isLabel("2024-03-01T10:15", Granularity.MINUTE));
        assertTrue(CohortCalculator.isLabel("2024-03-01T10", Granularity.HOUR));
        assertTrue(CohortCalculator.isLabel("2024-03-01", Granularity.DAY));
        assertTrue(CohortCalculator.isLabel("2024-W09", Granularity.WEEK));
        assertFalse(CohortCalculator.isLabel("2024-03-01T10", Granularity.MINUTE));
        assertFalse(CohortCalculator.isLabel("2024-03-01T10:15", Granularity.HOUR));
        assertFalse(CohortCalculator.isLabel("2024-03-01", Granularity.WEEK));
        assertFalse(CohortCalculator.isLabel("2024-02-30", Granularity.DAY));
        assertFalse(CohortCalculator.isLabel("not-a-cohort", Granularity.DAY));
    }

    @Test
    void testCohortStart() {
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), CohortCalculator.cohortStart(INSTANT, Granularity.MINUTE));
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), CohortCalculator.cohortStart(INSTANT, Granularity.HOUR));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), CohortCalculator.cohortStart(INSTANT, Granularity.DAY));
        assertEquals(Instant.parse("2024-02-26T00:00:00Z"), CohortCalculator.cohortStart(INSTANT, Granularity.WEEK));
    }

    @Test
    void testStartOfIsInverseOfCohortFor() {
        for (Granularity granularity : Granularity.values()) {
            String label = CohortCalculator.cohortFor(INSTANT, granularity);
            Instant start = CohortCalculator.startOf(label, granularity);

            assertEquals(CohortCalculator.cohortStart(INSTANT, granularity), start, granularity.value());
            assertEquals(label, CohortCalculator.cohortFor(start, granularity), granularity.value());
        }
    }

    @Test
    void testStartOfRejectsMalformedLabel() {
        assertThrows(IllegalArgumentException.class, () -> CohortCalculator.startOf("2024-03-01", Granularity.MINUTE));
        assertThrows(IllegalArgumentException.class, () -> CohortCalculator.startOf("2024-03", Granularity.DAY));
        assertThrows(IllegalArgumentException.class, () -> CohortCalculator.startOf("2024-09", Granularity.WEEK));
    }

    @Test
    void testNextAndPreviousCrossBoundaries() {
        assertEquals("2024-03-01T00:00", CohortCalculator.next("2024-02-29T23:59", Granularity.MINUTE));
        assertEquals("2025-01-01T00", CohortCalculator.next("2024-12-31T23", Granularity.HOUR));
        assertEquals("2024-02-29", CohortCalculator.next("2024-02-28", Granularity.DAY));
        assertEquals("2021-W01", CohortCalculator.next("2020-W53", Granularity.WEEK));

        assertEquals("2024-02-29T23:57", CohortCalculator.previous("2024-03-01T00:00", Granularity.MINUTE, 3));
        assertEquals("2024-02-28", CohortCalculator.previous("2024-03-01", Granularity.DAY, 2));
    }

    @Test
    void testLabelsSortChronologically() {
        String earlier = CohortCalculator.cohortFor(Instant.parse("2024-03-01T09:59:00Z"), Granularity.MINUTE);
        String later = CohortCalculator.cohortFor(Instant.parse("2024-03-01T10:00:00Z"), Granularity.MINUTE);

        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void testCohortsBetween() {
        List<String> cohorts = CohortCalculator.cohortsBetween("2024-03-01T08", "2024-03-01T11", Granularity.HOUR);

        assertEquals(Arrays.asList("2024-03-01T09", "2024-03-01T10", "2024-03-01T11"), cohorts);
    }

    @Test
    void testCohortsBetweenEdgeCases() {
        assertEquals(Collections.singletonList("2024-03-01"),
            CohortCalculator.cohortsBetween(null, "2024-03-01", Granularity.DAY));
        assertTrue(CohortCalculator.cohortsBetween("2024-03-01", "2024-03-01", Granularity.DAY).isEmpty());
        assertTrue(CohortCalculator.cohortsBetween("2024-03-02", "2024-03-01", Granularity.DAY).isEmpty());
    }
}
