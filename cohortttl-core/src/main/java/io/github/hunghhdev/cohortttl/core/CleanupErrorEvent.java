package io.github.hunghhdev.cohortttl.core;

/**
 * A record could not be disposed of, or a scan stopped early. The work is retried on a later scan.
 *
 * @since 1.0.0
 */
public final class CleanupErrorEvent {
    private final String resource;
    private final String recordId;
    private final Granularity granularity;
    private final CohortTtlException error;

    public CleanupErrorEvent(String resource, String recordId, Granularity granularity, CohortTtlException error) {
        this.resource = resource;
        this.recordId = recordId;
        this.granularity = granularity;
        this.error = error;
    }

    public String getResource() {
        return resource;
    }

    /**
     * @return the failed record, or null when a whole scan failed
     */
    public String getRecordId() {
        return recordId;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public CohortTtlException getError() {
        return error;
    }

    public String getMessage() {
        return error.getMessage();
    }

    @Override
    public String toString() {
        return "CleanupErrorEvent{resource=" + resource +
               (recordId != null ? ", recordId=" + recordId : "") +
               ", error=" + error.getMessage() + '}';
    }
}
