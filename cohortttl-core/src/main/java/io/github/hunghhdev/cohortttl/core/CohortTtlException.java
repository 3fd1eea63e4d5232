package io.github.hunghhdev.cohortttl.core;

/**
 * Base exception for cohort-ttl errors.
 */
public class CohortTtlException extends RuntimeException {
    public CohortTtlException(String message) {
        super(message);
    }

    public CohortTtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
