package io.github.hunghhdev.cohortttl.core;

import java.util.Collections;
import java.util.List;

/**
 * One page of index entries from a single cohort.
 */
public final class IndexPage {

    private final String cohort;
    private final List<ExpirationIndexEntry> entries;
    private final boolean lastOfCohort;

    public IndexPage(String cohort, List<ExpirationIndexEntry> entries, boolean lastOfCohort) {
        this.cohort = cohort;
        this.entries = Collections.unmodifiableList(entries);
        this.lastOfCohort = lastOfCohort;
    }

    public String getCohort() {
        return cohort;
    }

    public List<ExpirationIndexEntry> getEntries() {
        return entries;
    }

    /**
     * @return true when no further page of this cohort follows
     */
    public boolean isLastOfCohort() {
        return lastOfCohort;
    }
}
