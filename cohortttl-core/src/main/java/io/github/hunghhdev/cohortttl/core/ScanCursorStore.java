package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last fully drained cohort of every (resource, granularity) pair, kept as one document per pair in the shared
 * {@link DocumentStore}. A newly elected coordinator resumes from here instead of from its own memory.
 *
 * <p>Document id: {@code <resource>:<granularity>}.</p>
 */
public class ScanCursorStore {

    public static final String DEFAULT_RESOURCE_NAME = "cohortttl_scan_cursor";

    static final String RESOURCE_NAME = "resourceName";
    static final String GRANULARITY = "granularity";
    static final String LAST_PROCESSED_COHORT = "lastProcessedCohort";
    static final String UPDATED_AT = "updatedAt";
    static final String UPDATED_BY = "updatedBy";

    private final DocumentStore store;
    private final String resourceName;
    private final String workerId;

    public ScanCursorStore(DocumentStore store, String resourceName, String workerId) {
        this.store = store;
        this.resourceName = resourceName;
        this.workerId = workerId;
    }

    public void initialize() {
        store.declareResource(resourceName, null);
    }

    /**
     * @return the last drained cohort, empty if no instance has advanced past any cohort yet
     * @throws StorageException if the store cannot be read
     */
    public Optional<String> read(String resource, Granularity granularity) {
        return store.get(resourceName, idFor(resource, granularity))
            .map(document -> document.getString(LAST_PROCESSED_COHORT));
    }

    public void write(String resource, Granularity granularity, String cohort, Instant now) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(RESOURCE_NAME, resource);
        fields.put(GRANULARITY, granularity.value());
        fields.put(LAST_PROCESSED_COHORT, cohort);
        fields.put(UPDATED_AT, now.toString());
        fields.put(UPDATED_BY, workerId);
        store.put(resourceName, Document.of(idFor(resource, granularity), fields));
    }

    public String getResourceName() {
        return resourceName;
    }

    static String idFor(String resource, Granularity granularity) {
        return resource + ":" + granularity.value();
    }
}
