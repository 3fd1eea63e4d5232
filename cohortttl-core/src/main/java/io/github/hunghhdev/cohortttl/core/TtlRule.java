package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Expiration rule for one resource. Immutable.
 *
 * <p>With a {@code ttlSeconds} the record expires {@code ttlSeconds} after its timestamp field.
 * Without one the timestamp field itself holds the absolute expiry instant.</p>
 *
 * @since 1.0.0
 */
public final class TtlRule {

    public static final String DEFAULT_TIMESTAMP_FIELD = "createdAt";
    public static final String DEFAULT_DELETE_FIELD = "deletedAt";
    public static final String DEFAULT_DELETED_FLAG_FIELD = "isDeleted";

    private final String resourceName;
    private final String timestampField;
    private final Long ttlSeconds;
    private final Granularity granularity;
    private final ExpireStrategy strategy;
    private final String deleteField;
    private final String deletedFlagField;
    private final String archiveResourceName;
    private final boolean keepOriginalId;
    private final String callbackName;

    private TtlRule(Builder builder, Granularity granularity) {
        this.resourceName = builder.resourceName;
        this.timestampField = builder.timestampField != null ? builder.timestampField : DEFAULT_TIMESTAMP_FIELD;
        this.ttlSeconds = builder.ttlSeconds;
        this.granularity = granularity;
        this.strategy = builder.strategy;
        this.deleteField = builder.deleteField != null ? builder.deleteField : DEFAULT_DELETE_FIELD;
        this.deletedFlagField = builder.deletedFlagField != null ? builder.deletedFlagField : DEFAULT_DELETED_FLAG_FIELD;
        this.archiveResourceName = builder.archiveResourceName;
        this.keepOriginalId = builder.keepOriginalId;
        this.callbackName = builder.callbackName;
    }

    /**
     * Computes when {@code record} expires under this rule.
     *
     * @return the expiry instant, or empty when the record has no readable timestamp
     */
    public Optional<Instant> expiresAt(Document record) {
        Optional<Instant> timestamp = record.getInstant(timestampField);
        if (ttlSeconds == null) {
            return timestamp;
        }
        return timestamp.map(t -> t.plusSeconds(ttlSeconds));
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getTimestampField() {
        return timestampField;
    }

    /**
     * @return the relative TTL, or null for absolute-expiry rules
     */
    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public boolean isAbsolute() {
        return ttlSeconds == null;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public ExpireStrategy getStrategy() {
        return strategy;
    }

    public String getDeleteField() {
        return deleteField;
    }

    public String getDeletedFlagField() {
        return deletedFlagField;
    }

    public String getArchiveResourceName() {
        return archiveResourceName;
    }

    public boolean isKeepOriginalId() {
        return keepOriginalId;
    }

    public String getCallbackName() {
        return callbackName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TtlRule)) {
            return false;
        }
        TtlRule other = (TtlRule) o;
        return keepOriginalId == other.keepOriginalId
            && resourceName.equals(other.resourceName)
            && timestampField.equals(other.timestampField)
            && Objects.equals(ttlSeconds, other.ttlSeconds)
            && granularity == other.granularity
            && strategy == other.strategy
            && deleteField.equals(other.deleteField)
            && deletedFlagField.equals(other.deletedFlagField)
            && Objects.equals(archiveResourceName, other.archiveResourceName)
            && Objects.equals(callbackName, other.callbackName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceName, timestampField, ttlSeconds, granularity, strategy);
    }

    @Override
    public String toString() {
        return "TtlRule{" +
               "resource='" + resourceName + '\'' +
               ", field='" + timestampField + '\'' +
               ", ttlSeconds=" + ttlSeconds +
               ", granularity=" + granularity.value() +
               ", strategy=" + strategy +
               '}';
    }

    public static Builder builder(String resourceName) {
        return new Builder().resourceName(resourceName);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link TtlRule}. {@link #build()} validates the combination and throws
     * {@link ConfigurationException} for anything the engine could not act on.
     */
    public static class Builder {
        private String resourceName;
        private String timestampField;
        private Long ttlSeconds;
        private Granularity granularity;
        private ExpireStrategy strategy;
        private String deleteField;
        private String deletedFlagField;
        private String archiveResourceName;
        private boolean keepOriginalId;
        private String callbackName;

        private Builder() {
        }

        public Builder resourceName(String resourceName) {
            this.resourceName = resourceName;
            return this;
        }

        /**
         * Sets the timestamp attribute. Defaults to {@value TtlRule#DEFAULT_TIMESTAMP_FIELD}.
         */
        public Builder field(String timestampField) {
            this.timestampField = timestampField;
            return this;
        }

        public Builder ttlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttlSeconds = ttl != null ? ttl.getSeconds() : null;
            return this;
        }

        /**
         * Overrides the derived granularity. {@link Granularity#WEEK} is only reachable this way.
         */
        public Builder granularity(Granularity granularity) {
            this.granularity = granularity;
            return this;
        }

        public Builder onExpire(ExpireStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder onExpire(String strategy) {
            this.strategy = ExpireStrategy.fromValue(strategy);
            return this;
        }

        public Builder deleteField(String deleteField) {
            this.deleteField = deleteField;
            return this;
        }

        public Builder deletedFlagField(String deletedFlagField) {
            this.deletedFlagField = deletedFlagField;
            return this;
        }

        public Builder archiveResource(String archiveResourceName) {
            this.archiveResourceName = archiveResourceName;
            return this;
        }

        public Builder keepOriginalId(boolean keepOriginalId) {
            this.keepOriginalId = keepOriginalId;
            return this;
        }

        public Builder callback(String callbackName) {
            this.callbackName = callbackName;
            return this;
        }

        public TtlRule build() {
            if (isBlank(resourceName)) {
                throw new ConfigurationException("Rule resource name cannot be null or empty");
            }
            if (ttlSeconds != null && ttlSeconds <= 0) {
                throw new ConfigurationException(
                    "Resource '" + resourceName + "' must have a positive ttl, got " + ttlSeconds);
            }
            if (ttlSeconds == null && isBlank(timestampField)) {
                throw new ConfigurationException(
                    "Resource '" + resourceName + "' must have either a ttl or an absolute expiry field");
            }
            if (timestampField != null && timestampField.isEmpty()) {
                throw new ConfigurationException("Resource '" + resourceName + "' has an empty field name");
            }
            if (strategy == null) {
                throw new ConfigurationException(
                    "Resource '" + resourceName + "' must have an onExpire strategy: soft-delete, hard-delete, archive or callback");
            }
            if (strategy == ExpireStrategy.ARCHIVE) {
                if (isBlank(archiveResourceName)) {
                    throw new ConfigurationException(
                        "Resource '" + resourceName + "' with onExpire=archive must have an archive resource");
                }
                if (archiveResourceName.equals(resourceName)) {
                    throw new ConfigurationException(
                        "Resource '" + resourceName + "' cannot archive into itself");
                }
            }
            if (strategy == ExpireStrategy.CALLBACK && isBlank(callbackName)) {
                throw new ConfigurationException(
                    "Resource '" + resourceName + "' with onExpire=callback must name a callback");
            }
            Granularity resolved = granularity;
            if (resolved == null) {
                resolved = ttlSeconds != null ? CohortCalculator.deriveGranularity(ttlSeconds) : Granularity.DAY;
            }
            return new TtlRule(this, resolved);
        }

        private static boolean isBlank(String value) {
            return value == null || value.trim().isEmpty();
        }
    }
}
