package io.github.hunghhdev.cohortttl.core;

/**
 * Thrown by a {@link DocumentStore} when the backing storage cannot serve a request.
 */
public class StorageException extends CohortTtlException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
