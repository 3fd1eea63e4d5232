package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record's membership in a cohort of the expiration index. Stored as an ordinary document whose id is
 * {@code <resource>:<recordId>}, partitioned by {@link #COHORT}.
 *
 * @since 1.0.0
 */
public final class ExpirationIndexEntry {

    public static final String RESOURCE_NAME = "resourceName";
    public static final String RECORD_ID = "recordId";
    public static final String COHORT = "cohort";
    public static final String EXPIRES_AT = "expiresAt";
    public static final String GRANULARITY = "granularity";
    public static final String STRATEGY = "strategy";
    public static final String DEFERRED_UNTIL = "deferredUntil";
    public static final String INDEXED_AT = "indexedAt";

    private final String resourceName;
    private final String recordId;
    private final String cohort;
    private final Instant expiresAt;
    private final Granularity granularity;
    private final ExpireStrategy strategy;
    private final Instant deferredUntil;
    private final Instant indexedAt;

    public ExpirationIndexEntry(String resourceName, String recordId, String cohort, Instant expiresAt,
                                Granularity granularity, ExpireStrategy strategy, Instant deferredUntil,
                                Instant indexedAt) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        this.recordId = Objects.requireNonNull(recordId, "recordId");
        this.cohort = Objects.requireNonNull(cohort, "cohort");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.deferredUntil = deferredUntil;
        this.indexedAt = indexedAt;
    }

    public static String idFor(String resourceName, String recordId) {
        return resourceName + ":" + recordId;
    }

    /**
     * Reads an entry back from its stored form.
     *
     * @throws StorageException if a required attribute is missing or unreadable
     */
    public static ExpirationIndexEntry fromDocument(Document document) {
        String resourceName = document.getString(RESOURCE_NAME);
        String recordId = document.getString(RECORD_ID);
        String cohort = document.getString(COHORT);
        Instant expiresAt = document.getInstant(EXPIRES_AT).orElse(null);
        String granularity = document.getString(GRANULARITY);
        String strategy = document.getString(STRATEGY);
        if (resourceName == null || recordId == null || cohort == null || expiresAt == null
            || granularity == null || strategy == null) {
            throw new StorageException("Malformed expiration index entry '" + document.getId() + "'");
        }
        try {
            return new ExpirationIndexEntry(resourceName, recordId, cohort, expiresAt,
                Granularity.fromValue(granularity), ExpireStrategy.fromValue(strategy),
                document.getInstant(DEFERRED_UNTIL).orElse(null),
                document.getInstant(INDEXED_AT).orElse(null));
        } catch (ConfigurationException e) {
            throw new StorageException("Malformed expiration index entry '" + document.getId() + "'", e);
        }
    }

    public Document toDocument() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Document.ID, getId());
        fields.put(RESOURCE_NAME, resourceName);
        fields.put(RECORD_ID, recordId);
        fields.put(COHORT, cohort);
        fields.put(EXPIRES_AT, expiresAt.toString());
        fields.put(GRANULARITY, granularity.value());
        fields.put(STRATEGY, strategy.value());
        if (deferredUntil != null) {
            fields.put(DEFERRED_UNTIL, deferredUntil.toString());
        }
        if (indexedAt != null) {
            fields.put(INDEXED_AT, indexedAt.toString());
        }
        return new Document(fields);
    }

    /**
     * Returns a copy placed in {@code newCohort}.
     */
    public ExpirationIndexEntry movedTo(String newCohort, Instant newDeferredUntil, Instant now) {
        return new ExpirationIndexEntry(resourceName, recordId, newCohort, expiresAt, granularity, strategy,
            newDeferredUntil, now);
    }

    public String getId() {
        return idFor(resourceName, recordId);
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getCohort() {
        return cohort;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public ExpireStrategy getStrategy() {
        return strategy;
    }

    public Instant getDeferredUntil() {
        return deferredUntil;
    }

    public Instant getIndexedAt() {
        return indexedAt;
    }

    public boolean isDeferred(Instant now) {
        return deferredUntil != null && deferredUntil.isAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpirationIndexEntry)) {
            return false;
        }
        ExpirationIndexEntry other = (ExpirationIndexEntry) o;
        return resourceName.equals(other.resourceName)
            && recordId.equals(other.recordId)
            && cohort.equals(other.cohort)
            && expiresAt.equals(other.expiresAt)
            && granularity == other.granularity
            && strategy == other.strategy
            && Objects.equals(deferredUntil, other.deferredUntil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceName, recordId, cohort, expiresAt);
    }

    @Override
    public String toString() {
        return "ExpirationIndexEntry{" +
               "id='" + getId() + '\'' +
               ", cohort='" + cohort + '\'' +
               ", expiresAt=" + expiresAt +
               ", strategy=" + strategy +
               (deferredUntil != null ? ", deferredUntil=" + deferredUntil : "") +
               '}';
    }
}
