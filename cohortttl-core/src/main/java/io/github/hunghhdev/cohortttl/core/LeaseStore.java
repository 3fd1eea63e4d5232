package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage of the single coordinator lease.
 *
 * <p>Implementations make no atomicity promise: two instances may write concurrently and a read may return
 * a stale lease. The elector resolves contention by re-reading and a deterministic tie-break. Duplicate work
 * during the resulting overlap is harmless because every disposal strategy is idempotent.</p>
 */
public interface LeaseStore {

    /**
     * @return the lease as currently visible, or empty if none is stored
     */
    Optional<CoordinatorLease> read();

    /**
     * Writes a fresh claim for {@code workerId}, replacing whatever is stored.
     */
    CoordinatorLease acquire(String workerId, long epoch, Instant now);

    /**
     * Rewrites {@code lease} with a new heartbeat time.
     */
    CoordinatorLease renew(CoordinatorLease lease, Instant now);

    /**
     * Deletes the lease if it is still visibly held by {@code workerId}.
     *
     * @return true if a lease was deleted
     */
    boolean release(String workerId);
}
