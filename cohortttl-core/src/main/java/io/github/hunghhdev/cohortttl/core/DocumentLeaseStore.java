package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link LeaseStore} kept as one document, id {@code leaseName}, in the shared {@link DocumentStore}.
 */
public class DocumentLeaseStore implements LeaseStore {

    public static final String DEFAULT_RESOURCE_NAME = "cohortttl_coordinator_lease";
    public static final String DEFAULT_LEASE_NAME = "default";

    private final DocumentStore store;
    private final String resourceName;
    private final String leaseName;
    private final Duration leaseTtl;

    public DocumentLeaseStore(DocumentStore store, String resourceName, String leaseName, Duration leaseTtl) {
        this.store = store;
        this.resourceName = resourceName;
        this.leaseName = leaseName;
        this.leaseTtl = leaseTtl;
    }

    public void initialize() {
        store.declareResource(resourceName, null);
    }

    @Override
    public Optional<CoordinatorLease> read() {
        return store.get(resourceName, leaseName).map(CoordinatorLease::fromDocument);
    }

    @Override
    public CoordinatorLease acquire(String workerId, long epoch, Instant now) {
        CoordinatorLease lease = new CoordinatorLease(workerId, now, now, leaseTtl, epoch);
        store.put(resourceName, lease.toDocument(leaseName));
        return lease;
    }

    @Override
    public CoordinatorLease renew(CoordinatorLease lease, Instant now) {
        CoordinatorLease renewed = lease.renewedAt(now);
        store.put(resourceName, renewed.toDocument(leaseName));
        return renewed;
    }

    @Override
    public boolean release(String workerId) {
        Optional<CoordinatorLease> current = read();
        if (current.isPresent() && current.get().isHeldBy(workerId)) {
            return store.delete(resourceName, leaseName);
        }
        return false;
    }

    public String getLeaseName() {
        return leaseName;
    }
}
