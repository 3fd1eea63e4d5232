package io.github.hunghhdev.cohortttl.core;

/**
 * Disposal action applied to a record once its TTL has elapsed.
 */
public enum ExpireStrategy {

    /**
     * Stamps the delete field and sets the deleted flag. The record stays in place.
     */
    SOFT_DELETE("soft-delete"),

    /**
     * Deletes the record.
     */
    HARD_DELETE("hard-delete"),

    /**
     * Copies the record into an archive resource, then deletes it.
     */
    ARCHIVE("archive"),

    /**
     * Hands the record to a registered {@link ExpiryCallback}; deletes it only if the callback agrees.
     */
    CALLBACK("callback");

    private final String value;

    ExpireStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a configuration value such as {@code "soft-delete"}.
     *
     * @throws ConfigurationException if the value names no strategy
     */
    public static ExpireStrategy fromValue(String value) {
        if (value != null) {
            for (ExpireStrategy strategy : values()) {
                if (strategy.value.equalsIgnoreCase(value.trim()) || strategy.name().equalsIgnoreCase(value.trim())) {
                    return strategy;
                }
            }
        }
        throw new ConfigurationException(
            "Invalid onExpire strategy '" + value + "', expected one of soft-delete, hard-delete, archive, callback");
    }

    @Override
    public String toString() {
        return value;
    }
}
