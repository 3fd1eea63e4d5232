package io.github.hunghhdev.cohortttl.core;

/**
 * Thrown when a rule or engine option is invalid. Always fatal: the engine refuses to start.
 */
public class ConfigurationException extends CohortTtlException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
