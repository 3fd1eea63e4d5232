package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one timer per granularity and walks the due cohorts of every rule at that granularity.
 *
 * <p><strong>Scan semantics:</strong></p>
 * <ul>
 *   <li>A pass only runs while the coordinator gate is open</li>
 *   <li>Passes of one granularity never overlap; different granularities run independently</li>
 *   <li>Each entry is checked against the live record before anything is disposed of</li>
 *   <li>A resource's last processed cohort only advances over cohorts that were fully drained and have
 *       settled (ended at least one cohort width ago)</li>
 *   <li>The last processed cohort is shared through the {@link ScanCursorStore}; without one, a pass starts
 *       at the oldest indexed cohort</li>
 *   <li>Shutdown is checked between records; a record already being disposed of is finished first</li>
 * </ul>
 */
public class ScanScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ScanScheduler.class);

    private static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(5);

    private final ExpirationIndex index;
    private final ScanCursorStore cursors;
    private final StrategyExecutor executor;
    private final DocumentStore store;
    private final Map<Granularity, List<TtlRule>> rulesByGranularity;
    private final Map<Granularity, ScanSchedule> schedules;
    private final Map<Granularity, ReentrantLock> locks;
    private final int batchSize;
    private final Clock clock;
    private final BooleanSupplier coordinatorGate;
    private final ScanObserver observer;
    private final Duration shutdownGrace;

    private volatile ScheduledExecutorService timer;
    private volatile boolean stopped = false;

    /**
     * @param perRecordTimeout longest a single disposal may run; {@link #stop()} waits at least this long
     */
    ScanScheduler(ExpirationIndex index, ScanCursorStore cursors, StrategyExecutor executor, DocumentStore store,
                  Collection<TtlRule> rules, Map<Granularity, FireSchedule> fireSchedules, int batchSize,
                  Duration perRecordTimeout, Clock clock, BooleanSupplier coordinatorGate, ScanObserver observer) {
        this.index = index;
        this.cursors = cursors;
        this.executor = executor;
        this.store = store;
        this.batchSize = batchSize;
        this.clock = clock;
        this.coordinatorGate = coordinatorGate;
        this.observer = observer;
        this.shutdownGrace = perRecordTimeout.plus(SHUTDOWN_MARGIN);

        this.rulesByGranularity = new EnumMap<>(Granularity.class);
        for (TtlRule rule : rules) {
            rulesByGranularity.computeIfAbsent(rule.getGranularity(), g -> new ArrayList<>()).add(rule);
        }
        this.schedules = new EnumMap<>(Granularity.class);
        this.locks = new EnumMap<>(Granularity.class);
        for (Granularity granularity : Granularity.values()) {
            FireSchedule fireSchedule = fireSchedules.get(granularity);
            if (fireSchedule == null) {
                fireSchedule = FireSchedule.parse(granularity.getDefaultSchedule());
            }
            schedules.put(granularity, new ScanSchedule(granularity, fireSchedule));
            locks.put(granularity, new ReentrantLock());
        }
    }

    /**
     * Starts a timer for every granularity that has at least one rule.
     */
    synchronized void start() {
        if (timer != null) {
            return;
        }
        stopped = false;
        AtomicInteger threadCount = new AtomicInteger();
        timer = Executors.newScheduledThreadPool(Granularity.values().length, r -> {
            Thread t = new Thread(r, "cohortttl-scan-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (Granularity granularity : rulesByGranularity.keySet()) {
            scheduleNext(granularity);
            logger.info("Scheduled {} scans ({}) for resources {}", granularity.value(),
                schedules.get(granularity).getFireSchedule(), resourceNames(rulesByGranularity.get(granularity)));
        }
    }

    private void scheduleNext(Granularity granularity) {
        ScheduledExecutorService current = timer;
        if (stopped || current == null) {
            return;
        }
        ScanSchedule schedule = schedules.get(granularity);
        Instant now = clock.instant();
        Instant next = schedule.getFireSchedule().nextFireAfter(now);
        schedule.setNextRunAt(next);
        long delayMillis = Math.max(0L, Duration.between(now, next).toMillis());
        try {
            current.schedule(() -> tick(granularity), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Timer for {} scans is shut down", granularity.value());
        }
    }

    private void tick(Granularity granularity) {
        try {
            CleanupRun run = runGranularity(granularity, false);
            if (run.isSkipped()) {
                logger.debug("{} scan skipped: {}", granularity.value(), run.getSkipReason());
            }
        } catch (RuntimeException e) {
            logger.error("{} scan failed unexpectedly", granularity.value(), e);
        } finally {
            scheduleNext(granularity);
        }
    }

    /**
     * Runs a pass over every rule of {@code granularity}.
     *
     * @param wait true to wait for a pass that is already running, false to skip instead
     */
    public CleanupRun runGranularity(Granularity granularity, boolean wait) {
        return run(granularity, rulesByGranularity.getOrDefault(granularity, Collections.emptyList()), wait);
    }

    /**
     * Runs a pass over a single rule, waiting for any running pass of its granularity.
     */
    public CleanupRun runRule(TtlRule rule) {
        return run(rule.getGranularity(), Collections.singletonList(rule), true);
    }

    private CleanupRun run(Granularity granularity, List<TtlRule> rules, boolean wait) {
        List<String> resources = resourceNames(rules);
        if (stopped) {
            return CleanupRun.skipped(granularity, resources, CleanupRun.SkipReason.STOPPED, clock.instant());
        }
        if (!coordinatorGate.getAsBoolean()) {
            return CleanupRun.skipped(granularity, resources, CleanupRun.SkipReason.NOT_COORDINATOR, clock.instant());
        }
        ReentrantLock lock = locks.get(granularity);
        if (wait) {
            lock.lock();
        } else if (!lock.tryLock()) {
            return CleanupRun.skipped(granularity, resources, CleanupRun.SkipReason.ALREADY_RUNNING, clock.instant());
        }
        try {
            ScanSchedule schedule = schedules.get(granularity);
            CleanupRun.Recorder recorder = new CleanupRun.Recorder(granularity, clock.instant());
            for (TtlRule rule : rules) {
                if (stopped) {
                    recorder.abort();
                    break;
                }
                recorder.resource(rule.getResourceName());
                scanRule(rule, schedule, recorder);
            }
            CleanupRun run = recorder.finish(clock);
            schedule.setLastRunAt(run.getStartedAt());
            if (run.getProcessed() > 0 || run.getErrors() > 0) {
                logger.info("{} scan completed in {}ms - processed: {}, expired: {}, relocated: {}, errors: {}",
                    granularity.value(), run.getDuration().toMillis(), run.getProcessed(), run.getExpired(),
                    run.getRelocated(), run.getErrors());
            } else {
                logger.debug("{} scan completed, nothing due", granularity.value());
            }
            observer.scanCompleted(run);
            return run;
        } finally {
            lock.unlock();
        }
    }

    private void scanRule(TtlRule rule, ScanSchedule schedule, CleanupRun.Recorder recorder) {
        Granularity granularity = rule.getGranularity();
        String resource = rule.getResourceName();
        String current = CohortCalculator.cohortFor(clock.instant(), granularity);

        String stored = null;
        String lastProcessed = null;
        List<String> drained = new ArrayList<>();
        Set<String> retained = new HashSet<>();
        try {
            stored = cursors.read(resource, granularity).orElse(null);
            lastProcessed = later(stored, schedule.getLastProcessedCohort(resource));
            if (lastProcessed == null) {
                lastProcessed = catchUpStart(granularity, current);
            }

            Iterator<IndexPage> pages = index.due(resource, granularity, lastProcessed, current, batchSize);
            while (pages.hasNext()) {
                if (stopped) {
                    recorder.abort();
                    break;
                }
                IndexPage page = pages.next();
                recorder.cohort(page.getCohort());
                boolean pageCompleted = true;
                for (ExpirationIndexEntry entry : page.getEntries()) {
                    if (stopped) {
                        pageCompleted = false;
                        break;
                    }
                    recorder.processed();
                    if (processEntry(rule, entry, recorder)) {
                        retained.add(page.getCohort());
                    }
                }
                if (!pageCompleted) {
                    recorder.abort();
                    break;
                }
                if (page.isLastOfCohort()) {
                    drained.add(page.getCohort());
                }
            }
        } catch (StorageException e) {
            recorder.abort();
            recorder.error();
            logger.error("Scan of {} aborted: {}", resource, e.getMessage());
            observer.scanFailed(granularity, resource, e);
        }

        if (lastProcessed == null) {
            return;
        }
        String advanced = advance(lastProcessed, drained, retained, granularity);
        schedule.setLastProcessedCohort(resource, advanced);
        if (!advanced.equals(stored)) {
            saveCursor(resource, granularity, advanced);
        }
    }

    /**
     * Where a resource without a saved cursor starts: just before the oldest indexed cohort, or the default
     * lookback before the current cohort when nothing older is indexed.
     */
    private String catchUpStart(Granularity granularity, String current) {
        String start = CohortCalculator.previous(current, granularity, granularity.getLookbackCohorts() + 1);
        Optional<String> oldest = index.oldestCohort(granularity);
        if (oldest.isPresent() && oldest.get().compareTo(start) <= 0) {
            start = CohortCalculator.previous(oldest.get(), granularity, 1);
        }
        logger.info("No {} scan cursor saved yet, catching up from cohort after {}", granularity.value(), start);
        return start;
    }

    private void saveCursor(String resource, Granularity granularity, String cohort) {
        try {
            cursors.write(resource, granularity, cohort, clock.instant());
        } catch (StorageException e) {
            logger.warn("Failed to save {} scan cursor of {} at {}: {}", granularity.value(), resource, cohort,
                e.getMessage());
        }
    }

    /**
     * Later of two cursors, either of which may be null.
     */
    private static String later(String first, String second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.compareTo(second) >= 0 ? first : second;
    }

    /**
     * Moves the last processed cohort forward over consecutive drained cohorts that have settled.
     */
    private String advance(String lastProcessed, List<String> drained, Set<String> retained, Granularity granularity) {
        Instant settledBefore = clock.instant().minus(granularity.getWidth());
        String result = lastProcessed;
        for (String cohort : drained) {
            if (retained.contains(cohort)) {
                break;
            }
            if (CohortCalculator.endOf(cohort, granularity).isAfter(settledBefore)) {
                break;
            }
            result = cohort;
        }
        return result;
    }

    /**
     * Handles one index entry.
     *
     * @return true if the entry stays in its cohort and the cohort is not yet drained
     */
    private boolean processEntry(TtlRule rule, ExpirationIndexEntry entry, CleanupRun.Recorder recorder) {
        try {
            Optional<Document> live = store.get(rule.getResourceName(), entry.getRecordId());
            if (!live.isPresent()) {
                index.remove(entry);
                logger.debug("Dropped stale index entry {}", entry.getId());
                return false;
            }
            Document record = live.get();
            if (rule.getStrategy() == ExpireStrategy.SOFT_DELETE && record.isTrue(rule.getDeletedFlagField())) {
                index.remove(entry);
                return false;
            }
            Optional<Instant> expiresAt = rule.expiresAt(record);
            if (!expiresAt.isPresent()) {
                index.remove(entry);
                logger.debug("Dropped index entry {}, record has no '{}'", entry.getId(), rule.getTimestampField());
                return false;
            }

            Instant now = clock.instant();
            if (expiresAt.get().isAfter(now)) {
                ExpirationIndex.UpsertOutcome outcome = index.upsert(rule, record);
                if (outcome == ExpirationIndex.UpsertOutcome.RELOCATED) {
                    recorder.relocated();
                    logger.debug("Record {} now expires at {}, relocated", entry.getId(), expiresAt.get());
                    return false;
                }
                return true;
            }
            if (entry.isDeferred(now)) {
                return true;
            }

            Disposition disposition = executor.execute(rule, record);
            observer.strategyApplied(rule, disposition);
            switch (disposition.getKind()) {
                case DISPOSED:
                    index.remove(entry);
                    if (disposition.isChanged()) {
                        recorder.expired(disposition.getStrategy());
                        observer.recordExpired(rule, entry, disposition);
                    }
                    return false;
                case RELOCATED:
                    Instant retryAt = disposition.getRetryAt();
                    index.relocate(entry, CohortCalculator.cohortFor(retryAt, rule.getGranularity()), retryAt);
                    recorder.deferred();
                    observer.recordDeferred(rule, entry, retryAt);
                    return false;
                case ERROR:
                default:
                    recorder.error();
                    observer.recordFailed(rule, entry, disposition.getError());
                    return true;
            }
        } catch (StorageException e) {
            logger.warn("Failed to process index entry {}: {}", entry.getId(), e.getMessage());
            recorder.error();
            observer.recordFailed(rule, entry, e);
            return true;
        }
    }

    public ScanSchedule getSchedule(Granularity granularity) {
        return schedules.get(granularity);
    }

    public Set<Granularity> getActiveGranularities() {
        return Collections.unmodifiableSet(rulesByGranularity.keySet());
    }

    /**
     * Stops the timers. A pass in progress finishes the record it is disposing of and returns.
     */
    synchronized void stop() {
        stopped = true;
        long deadline = System.nanoTime() + shutdownGrace.toNanos();
        awaitRunningPasses(deadline);

        ScheduledExecutorService current = timer;
        timer = null;
        if (current != null && !current.isShutdown()) {
            current.shutdown();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                if (!current.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    logger.warn("Scan timers did not stop within {}ms, interrupting", shutdownGrace.toMillis());
                    current.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                current.shutdownNow();
            }
            logger.info("Scan timers shutdown completed");
        }
    }

    /**
     * Waits until no pass holds a granularity lock, scheduled or manual.
     */
    private void awaitRunningPasses(long deadline) {
        for (Map.Entry<Granularity, ReentrantLock> entry : locks.entrySet()) {
            ReentrantLock lock = entry.getValue();
            if (lock.isHeldByCurrentThread()) {
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                if (lock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
                    lock.unlock();
                } else {
                    logger.warn("{} scan still running after {}ms", entry.getKey().value(), shutdownGrace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static List<String> resourceNames(List<TtlRule> rules) {
        List<String> names = new ArrayList<>(rules.size());
        for (TtlRule rule : rules) {
            names.add(rule.getResourceName());
        }
        return names;
    }
}
