package io.github.hunghhdev.cohortttl.core;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A coordinator claim as stored in the lease resource.
 *
 * @since 1.0.0
 */
public final class CoordinatorLease {

    public static final String WORKER_ID = "workerId";
    public static final String CLAIMED_AT = "claimedAt";
    public static final String LAST_HEARTBEAT_AT = "lastHeartbeatAt";
    public static final String LEASE_TTL_MS = "leaseTtlMs";
    public static final String EPOCH = "epoch";

    private final String workerId;
    private final Instant claimedAt;
    private final Instant lastHeartbeatAt;
    private final Duration leaseTtl;
    private final long epoch;

    public CoordinatorLease(String workerId, Instant claimedAt, Instant lastHeartbeatAt, Duration leaseTtl, long epoch) {
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.claimedAt = Objects.requireNonNull(claimedAt, "claimedAt");
        this.lastHeartbeatAt = Objects.requireNonNull(lastHeartbeatAt, "lastHeartbeatAt");
        this.leaseTtl = Objects.requireNonNull(leaseTtl, "leaseTtl");
        this.epoch = epoch;
    }

    /**
     * @return true while the last heartbeat is younger than the lease TTL
     */
    public boolean isValid(Instant now) {
        return lastHeartbeatAt.plus(leaseTtl).isAfter(now);
    }

    public boolean isHeldBy(String candidate) {
        return workerId.equals(candidate);
    }

    public CoordinatorLease renewedAt(Instant now) {
        return new CoordinatorLease(workerId, claimedAt, now, leaseTtl, epoch);
    }

    static CoordinatorLease fromDocument(Document document) {
        String workerId = document.getString(WORKER_ID);
        Instant claimedAt = document.getInstant(CLAIMED_AT).orElse(null);
        Instant lastHeartbeatAt = document.getInstant(LAST_HEARTBEAT_AT).orElse(null);
        Object ttl = document.get(LEASE_TTL_MS);
        if (workerId == null || claimedAt == null || lastHeartbeatAt == null || ttl == null) {
            throw new StorageException("Malformed coordinator lease '" + document.getId() + "'");
        }
        Object epoch = document.get(EPOCH);
        try {
            return new CoordinatorLease(workerId, claimedAt, lastHeartbeatAt,
                Duration.ofMillis(Long.parseLong(ttl.toString())),
                epoch != null ? Long.parseLong(epoch.toString()) : 0L);
        } catch (NumberFormatException e) {
            throw new StorageException("Malformed coordinator lease '" + document.getId() + "'", e);
        }
    }

    Document toDocument(String leaseName) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Document.ID, leaseName);
        fields.put(WORKER_ID, workerId);
        fields.put(CLAIMED_AT, claimedAt.toString());
        fields.put(LAST_HEARTBEAT_AT, lastHeartbeatAt.toString());
        fields.put(LEASE_TTL_MS, leaseTtl.toMillis());
        fields.put(EPOCH, epoch);
        return new Document(fields);
    }

    public String getWorkerId() {
        return workerId;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public Duration getLeaseTtl() {
        return leaseTtl;
    }

    public long getEpoch() {
        return epoch;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoordinatorLease)) {
            return false;
        }
        CoordinatorLease other = (CoordinatorLease) o;
        return epoch == other.epoch
            && workerId.equals(other.workerId)
            && claimedAt.equals(other.claimedAt)
            && lastHeartbeatAt.equals(other.lastHeartbeatAt)
            && leaseTtl.equals(other.leaseTtl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, claimedAt, lastHeartbeatAt, leaseTtl, epoch);
    }

    @Override
    public String toString() {
        return "CoordinatorLease{" +
               "workerId='" + workerId + '\'' +
               ", epoch=" + epoch +
               ", lastHeartbeatAt=" + lastHeartbeatAt +
               ", leaseTtl=" + leaseTtl +
               '}';
    }
}
