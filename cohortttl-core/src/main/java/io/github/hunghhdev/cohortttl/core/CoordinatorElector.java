package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elects one coordinator among instances sharing a {@link LeaseStore}, without locks or compare-and-swap.
 *
 * <p><strong>Protocol:</strong></p>
 * <ul>
 *   <li>Observe the lease read-only for the cold-start window, after an optional random startup delay</li>
 *   <li>A valid lease held by someone else makes this instance a follower</li>
 *   <li>Otherwise write a claim, wait a random jitter and read it back. The lexicographically larger worker
 *       id wins a collision; the smaller one defers</li>
 *   <li>The coordinator rewrites the lease every heartbeat interval and steps down when it sees a larger
 *       holder or has not renewed successfully for a whole lease TTL</li>
 *   <li>A follower re-runs the election when the lease is gone, has expired or its heartbeat has not moved
 *       for the missed-heartbeat threshold</li>
 *   <li>Stopping releases a held lease so a follower can take over without waiting for expiry</li>
 * </ul>
 *
 * <p>Two coordinators can briefly coexist. Scans stay correct in that window because disposal is idempotent.</p>
 */
public class CoordinatorElector implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CoordinatorElector.class);

    /**
     * Blocking pause between writing a claim and reading it back. Replaced in tests.
     */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final LeaseStore leases;
    private final String workerId;
    private final CleanupOptions options;
    private final Clock clock;
    private final Random random;
    private final Sleeper sleeper;
    private final CoordinatorListener listener;

    private volatile CoordinatorState state = CoordinatorState.OBSERVING;
    private volatile String leaderId;
    private volatile long epoch;
    private CoordinatorLease ownLease;
    private Instant lastRenewedAt;
    private Instant lastSeenHeartbeat;
    private int missedHeartbeats;

    private volatile ScheduledExecutorService heartbeatExecutor;

    CoordinatorElector(LeaseStore leases, CleanupOptions options, Clock clock, CoordinatorListener listener) {
        this(leases, options, clock, new Random(), duration -> Thread.sleep(duration.toMillis()), listener);
    }

    CoordinatorElector(LeaseStore leases, CleanupOptions options, Clock clock, Random random, Sleeper sleeper,
                       CoordinatorListener listener) {
        this.leases = leases;
        this.workerId = options.getWorkerId();
        this.options = options;
        this.clock = clock;
        this.random = random;
        this.sleeper = sleeper;
        this.listener = listener;
    }

    /**
     * Starts the observation window and the heartbeat timer.
     */
    synchronized void start() {
        if (heartbeatExecutor != null) {
            return;
        }
        state = CoordinatorState.OBSERVING;
        heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cohortttl-coordinator");
            t.setDaemon(true);
            return t;
        });

        long observeMillis = randomMillis(options.getStartupJitter()) + options.getColdStartObservationWindow().toMillis();
        long heartbeatMillis = options.getHeartbeatInterval().toMillis();
        logger.info("Worker {} observing coordinator lease for {}ms", workerId, observeMillis);

        heartbeatExecutor.schedule(this::safeCompleteObservation, observeMillis, TimeUnit.MILLISECONDS);
        heartbeatExecutor.scheduleWithFixedDelay(this::safeHeartbeat,
            observeMillis + heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
    }

    private void safeCompleteObservation() {
        try {
            completeObservation();
        } catch (RuntimeException e) {
            logger.warn("Coordinator election failed for {}", workerId, e);
        }
    }

    private void safeHeartbeat() {
        try {
            heartbeat();
        } catch (RuntimeException e) {
            logger.warn("Coordinator heartbeat failed for {}", workerId, e);
        }
    }

    /**
     * Ends the observation window: follow a valid foreign lease, otherwise run an election.
     */
    synchronized void completeObservation() {
        if (state != CoordinatorState.OBSERVING) {
            return;
        }
        Optional<CoordinatorLease> current;
        try {
            current = leases.read();
        } catch (StorageException e) {
            logger.warn("Could not read coordinator lease, staying follower: {}", e.getMessage());
            becomeFollower(null);
            return;
        }
        Instant now = clock.instant();
        if (current.isPresent() && current.get().isValid(now) && !current.get().isHeldBy(workerId)) {
            becomeFollower(current.get());
        } else {
            elect(current.orElse(null));
        }
    }

    /**
     * One heartbeat tick: renew as coordinator, poll as follower.
     */
    synchronized void heartbeat() {
        switch (state) {
            case COORDINATOR:
                renew();
                break;
            case FOLLOWER:
                poll();
                break;
            default:
                break;
        }
    }

    private void elect(CoordinatorLease previous) {
        long nextEpoch = (previous != null ? previous.getEpoch() : 0L) + 1;
        CoordinatorLease seen = previous;
        for (int round = 1; round <= options.getMaxElectionRounds(); round++) {
            if (state == CoordinatorState.STOPPED) {
                return;
            }
            Optional<CoordinatorLease> readBack;
            try {
                leases.acquire(workerId, nextEpoch, clock.instant());
                sleeper.sleep(Duration.ofMillis(randomMillis(options.getElectionJitter())));
                readBack = leases.read();
            } catch (StorageException e) {
                logger.warn("Election round {} for {} failed: {}", round, workerId, e.getMessage());
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Election interrupted for {}", workerId);
                return;
            }
            if (!readBack.isPresent()) {
                logger.debug("Claim of {} not visible yet (round {})", workerId, round);
                continue;
            }
            seen = readBack.get();
            if (seen.isHeldBy(workerId)) {
                becomeCoordinator(seen);
                return;
            }
            if (seen.getWorkerId().compareTo(workerId) > 0) {
                logger.debug("Lease contention: {} defers to {}", workerId, seen.getWorkerId());
                becomeFollower(seen);
                return;
            }
            logger.debug("Lease contention: {} outranks {}, claiming again (round {})", workerId, seen.getWorkerId(), round);
            nextEpoch = Math.max(nextEpoch, seen.getEpoch() + 1);
        }
        becomeFollower(seen);
    }

    private void renew() {
        Instant now = clock.instant();
        try {
            Optional<CoordinatorLease> current = leases.read();
            if (current.isPresent() && !current.get().isHeldBy(workerId) && current.get().isValid(now)
                && current.get().getWorkerId().compareTo(workerId) > 0) {
                logger.info("Worker {} sees lease held by {}, stepping down", workerId, current.get().getWorkerId());
                demote();
                becomeFollower(current.get());
                return;
            }
            ownLease = leases.renew(ownLease, now);
            lastRenewedAt = now;
        } catch (StorageException e) {
            logger.warn("Lease renewal failed for {}: {}", workerId, e.getMessage());
            if (!Duration.between(lastRenewedAt, now).minus(options.getLeaseTtl()).isNegative()) {
                logger.warn("Worker {} could not renew its lease for {}, stepping down", workerId, options.getLeaseTtl());
                demote();
                becomeFollower(null);
            }
        }
    }

    private void poll() {
        Optional<CoordinatorLease> current;
        try {
            current = leases.read();
        } catch (StorageException e) {
            logger.warn("Could not read coordinator lease: {}", e.getMessage());
            return;
        }
        Instant now = clock.instant();
        if (!current.isPresent() || !current.get().isValid(now) || current.get().isHeldBy(workerId)) {
            logger.info("Coordinator lease is {}, worker {} starts an election",
                current.isPresent() ? "stale" : "absent", workerId);
            elect(current.orElse(null));
            return;
        }
        CoordinatorLease lease = current.get();
        leaderId = lease.getWorkerId();
        if (lastSeenHeartbeat == null || lease.getLastHeartbeatAt().isAfter(lastSeenHeartbeat)) {
            lastSeenHeartbeat = lease.getLastHeartbeatAt();
            missedHeartbeats = 0;
            return;
        }
        missedHeartbeats++;
        logger.debug("Heartbeat of {} unchanged ({}/{})", leaderId, missedHeartbeats,
            options.getMissedHeartbeatThreshold());
        if (missedHeartbeats >= options.getMissedHeartbeatThreshold()) {
            logger.info("Coordinator {} missed {} heartbeats, worker {} starts an election",
                leaderId, missedHeartbeats, workerId);
            elect(lease);
        }
    }

    private void becomeCoordinator(CoordinatorLease lease) {
        ownLease = lease;
        lastRenewedAt = clock.instant();
        leaderId = workerId;
        epoch = lease.getEpoch();
        state = CoordinatorState.COORDINATOR;
        logger.info("Worker {} elected coordinator (epoch {})", workerId, epoch);
        listener.elected(workerId, epoch);
    }

    private void becomeFollower(CoordinatorLease lease) {
        state = CoordinatorState.FOLLOWER;
        leaderId = lease != null ? lease.getWorkerId() : null;
        lastSeenHeartbeat = lease != null ? lease.getLastHeartbeatAt() : null;
        missedHeartbeats = 0;
        if (lease != null) {
            logger.info("Worker {} following coordinator {} (epoch {})", workerId, lease.getWorkerId(), lease.getEpoch());
        }
    }

    private void demote() {
        ownLease = null;
        state = CoordinatorState.FOLLOWER;
        logger.info("Worker {} lost coordinator role", workerId);
        listener.lost(workerId);
    }

    /**
     * Stops the heartbeat and releases the lease if this instance holds it.
     */
    synchronized void stop() {
        ScheduledExecutorService executor = heartbeatExecutor;
        heartbeatExecutor = null;
        if (executor != null) {
            executor.shutdownNow();
        }
        boolean wasCoordinator = state == CoordinatorState.COORDINATOR;
        state = CoordinatorState.STOPPED;
        if (wasCoordinator) {
            try {
                if (leases.release(workerId)) {
                    logger.info("Worker {} released coordinator lease", workerId);
                }
            } catch (StorageException e) {
                logger.warn("Could not release coordinator lease of {}: {}", workerId, e.getMessage());
            }
            listener.lost(workerId);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isCoordinator() {
        return state == CoordinatorState.COORDINATOR;
    }

    public CoordinatorState getState() {
        return state;
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * @return the worker currently believed to coordinate, or null if unknown
     */
    public String getLeaderId() {
        return leaderId;
    }

    public long getEpoch() {
        return epoch;
    }

    private long randomMillis(Duration bound) {
        long millis = bound.toMillis();
        if (millis <= 0) {
            return 0L;
        }
        return (long) (random.nextDouble() * millis);
    }
}
