package io.github.hunghhdev.cohortttl.core;

/**
 * Failure while disposing of one expired record. Never aborts a scan.
 */
public class StrategyExecutionException extends CohortTtlException {

    private final String resourceName;
    private final String recordId;

    public StrategyExecutionException(String resourceName, String recordId, String message, Throwable cause) {
        super(message, cause);
        this.resourceName = resourceName;
        this.recordId = recordId;
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getRecordId() {
        return recordId;
    }
}
