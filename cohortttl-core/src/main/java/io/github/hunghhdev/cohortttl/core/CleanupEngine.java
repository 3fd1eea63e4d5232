package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cohort-based TTL cleanup for the resources of a {@link DocumentStore}.
 *
 * <p>The engine indexes every governed record by the cohort its expiry falls into, elects one coordinator
 * among all instances sharing the store, and lets only the coordinator scan due cohorts and dispose of
 * expired records.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * CleanupEngine engine = CleanupEngine.builder()
 *     .store(store)
 *     .rule(TtlRule.builder("sessions").ttlSeconds(1800).onExpire(ExpireStrategy.HARD_DELETE).build())
 *     .build();
 * engine.start();
 * }</pre>
 *
 * <p>Scheduled scans report failures only through {@link CleanupEventListener#onCleanupError} and the
 * error counter. Configuration problems are the only errors thrown, from {@link Builder#build()}.</p>
 *
 * @since 1.0.0
 */
public class CleanupEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CleanupEngine.class);

    private final DocumentStore store;
    private final Map<String, TtlRule> rules;
    private final CleanupOptions options;
    private final Clock clock;
    private final boolean registerShutdownHook;

    private final CleanupEventDispatcher dispatcher = new CleanupEventDispatcher();
    private final ExpirationIndex index;
    private final StrategyExecutor executor;
    private final DocumentLeaseStore leaseStore;
    private final ScanCursorStore cursorStore;
    private final CoordinatorElector elector;
    private final ScanScheduler scheduler;
    private final IndexMaintenanceHook indexHook = new IndexMaintenanceHook();

    private final AtomicLong totalScans = new AtomicLong();
    private final AtomicLong totalExpired = new AtomicLong();
    private final AtomicLong totalDeleted = new AtomicLong();
    private final AtomicLong totalArchived = new AtomicLong();
    private final AtomicLong totalSoftDeleted = new AtomicLong();
    private final AtomicLong totalCallbacks = new AtomicLong();
    private final AtomicLong totalRelocated = new AtomicLong();
    private final Map<ExpireStrategy, AtomicLong> expiredByStrategy = new EnumMap<>(ExpireStrategy.class);
    private final AtomicLong totalErrors = new AtomicLong();
    private final AtomicReference<Instant> lastScanAt = new AtomicReference<>();
    private final AtomicReference<Duration> lastScanDuration = new AtomicReference<>(Duration.ZERO);

    private volatile boolean running = false;
    private volatile boolean closed = false;

    private CleanupEngine(Builder builder, Map<String, TtlRule> rules) {
        this.store = builder.store;
        this.rules = Collections.unmodifiableMap(rules);
        this.options = builder.options;
        this.clock = builder.clock;
        this.registerShutdownHook = builder.registerShutdownHook;

        for (ExpireStrategy strategy : ExpireStrategy.values()) {
            expiredByStrategy.put(strategy, new AtomicLong());
        }
        for (CleanupEventListener listener : builder.listeners) {
            dispatcher.add(listener);
        }

        EngineObserver observer = new EngineObserver();
        this.index = new ExpirationIndex(store, options.getIndexResourceName(), clock);
        this.executor = new StrategyExecutor(store, builder.callbacks, options.getPerRecordTimeout(),
            options.getCallbackRetryDelay(), clock);
        this.leaseStore = new DocumentLeaseStore(store, options.getLeaseResourceName(), options.getLeaseName(),
            options.getLeaseTtl());
        this.cursorStore = new ScanCursorStore(store, options.getCursorResourceName(), options.getWorkerId());
        this.elector = options.isEnableCoordinator()
            ? new CoordinatorElector(leaseStore, options, clock, observer)
            : null;
        this.scheduler = new ScanScheduler(index, cursorStore, executor, store, this.rules.values(),
            options.getSchedules(), options.getBatchSize(), options.getPerRecordTimeout(), clock, this::isCoordinator,
            observer);

        index.initialize();
        leaseStore.initialize();
        cursorStore.initialize();
    }

    /**
     * Starts index maintenance, the scan timers and the coordinator election.
     *
     * @throws IllegalStateException if the engine was already shut down
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CleanupEngine has been shut down");
        }
        if (running) {
            return;
        }
        store.addHook(indexHook);
        scheduler.start();
        running = true;
        if (elector != null) {
            elector.start();
        } else {
            logger.info("Coordinator election disabled, worker {} always coordinates", options.getWorkerId());
            dispatcher.fireCoordinatorElected(options.getWorkerId(), 0L);
        }
        if (registerShutdownHook) {
            registerShutdownHook();
        }
        logger.info("Cohort TTL engine started for {} resources (worker {})", rules.size(), options.getWorkerId());
    }

    /**
     * Registers a shutdown hook to ensure proper cleanup on JVM shutdown.
     */
    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down cohort TTL engine via shutdown hook...");
            shutdown();
        }, "cohortttl-shutdown-hook"));
    }

    /**
     * Indexes a governed record directly, for records written before the engine started or outside the
     * store's hooks.
     *
     * @return the index outcome, or {@link ExpirationIndex.UpsertOutcome#SKIPPED} for ungoverned resources
     */
    public ExpirationIndex.UpsertOutcome index(String resource, Document record) {
        TtlRule rule = rules.get(resource);
        if (rule == null) {
            return ExpirationIndex.UpsertOutcome.SKIPPED;
        }
        return index.upsert(rule, record);
    }

    /**
     * Runs a pass over every granularity that has rules, waiting for passes already in progress.
     * Only the coordinator scans; other instances get skipped runs.
     */
    public List<CleanupRun> runCleanup() {
        List<CleanupRun> runs = new ArrayList<>();
        for (Granularity granularity : Granularity.values()) {
            if (scheduler.getActiveGranularities().contains(granularity)) {
                runs.add(scheduler.runGranularity(granularity, true));
            }
        }
        return runs;
    }

    /**
     * Runs a pass over one resource. Only the coordinator scans.
     *
     * @throws IllegalArgumentException if no rule governs {@code resource}
     */
    public CleanupRun cleanupResource(String resource) {
        TtlRule rule = rules.get(resource);
        if (rule == null) {
            throw new IllegalArgumentException("Resource '" + resource + "' has no TTL rule");
        }
        return scheduler.runRule(rule);
    }

    public CleanupStatistics getStats() {
        Map<ExpireStrategy, Long> byStrategy = new EnumMap<>(ExpireStrategy.class);
        for (Map.Entry<ExpireStrategy, AtomicLong> entry : expiredByStrategy.entrySet()) {
            byStrategy.put(entry.getKey(), entry.getValue().get());
        }
        return new CleanupStatistics(
            totalScans.get(), totalExpired.get(), totalDeleted.get(), totalArchived.get(),
            totalSoftDeleted.get(), totalCallbacks.get(), totalRelocated.get(), totalErrors.get(),
            lastScanAt.get(), lastScanDuration.get(), rules.size(), running, isCoordinator(),
            getCoordinatorState(), options.getWorkerId(), elector != null ? elector.getEpoch() : 0L, byStrategy);
    }

    public void resetStatistics() {
        totalScans.set(0);
        totalExpired.set(0);
        totalDeleted.set(0);
        totalArchived.set(0);
        totalSoftDeleted.set(0);
        totalCallbacks.set(0);
        totalRelocated.set(0);
        totalErrors.set(0);
        expiredByStrategy.values().forEach(counter -> counter.set(0));
        lastScanAt.set(null);
        lastScanDuration.set(Duration.ZERO);
    }

    public void addListener(CleanupEventListener listener) {
        dispatcher.add(listener);
    }

    public void removeListener(CleanupEventListener listener) {
        dispatcher.remove(listener);
    }

    /**
     * @return true if this instance may scan; with the coordinator disabled, true until shutdown
     */
    public boolean isCoordinator() {
        if (elector == null) {
            return !closed;
        }
        return elector.isCoordinator();
    }

    public CoordinatorState getCoordinatorState() {
        if (elector == null) {
            return closed ? CoordinatorState.STOPPED : CoordinatorState.COORDINATOR;
        }
        return elector.getState();
    }

    /**
     * @return the worker believed to coordinate, or null while unknown
     */
    public String getCoordinatorId() {
        return elector != null ? elector.getLeaderId() : options.getWorkerId();
    }

    public String getWorkerId() {
        return options.getWorkerId();
    }

    public Map<String, TtlRule> getRules() {
        return rules;
    }

    public Optional<TtlRule> getRule(String resource) {
        return Optional.ofNullable(rules.get(resource));
    }

    public CleanupOptions getOptions() {
        return options;
    }

    public ScanSchedule getScanSchedule(Granularity granularity) {
        return scheduler.getSchedule(granularity);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops scanning, releases the coordinator lease if held and detaches from the store. Scans in progress
     * finish the record they are disposing of.
     */
    public synchronized void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.stop();
        if (elector != null) {
            elector.stop();
        } else if (running) {
            dispatcher.fireCoordinatorLost(options.getWorkerId());
        }
        executor.close();
        store.removeHook(indexHook);
        running = false;
        logger.info("Cohort TTL engine shutdown completed");
    }

    /**
     * Implementation of AutoCloseable for try-with-resources support.
     */
    @Override
    public void close() {
        shutdown();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Keeps the expiration index in step with writes to governed resources.
     */
    private final class IndexMaintenanceHook implements DocumentHook {

        @Override
        public void afterInsert(String resource, Document document) {
            TtlRule rule = rules.get(resource);
            if (rule != null) {
                index.upsert(rule, document);
            }
        }

        @Override
        public void afterUpdate(String resource, Document document) {
            afterInsert(resource, document);
        }

        @Override
        public void afterDelete(String resource, String id) {
            if (rules.containsKey(resource)) {
                index.remove(resource, id);
            }
        }
    }

    private final class EngineObserver implements ScanObserver, CoordinatorListener {

        @Override
        public void recordExpired(TtlRule rule, ExpirationIndexEntry entry, Disposition disposition) {
            totalExpired.incrementAndGet();
            expiredByStrategy.get(disposition.getStrategy()).incrementAndGet();
            switch (disposition.getStrategy()) {
                case SOFT_DELETE:
                    totalSoftDeleted.incrementAndGet();
                    break;
                case HARD_DELETE:
                    totalDeleted.incrementAndGet();
                    break;
                case ARCHIVE:
                    totalArchived.incrementAndGet();
                    totalDeleted.incrementAndGet();
                    break;
                case CALLBACK:
                    totalDeleted.incrementAndGet();
                    break;
                default:
                    break;
            }
            dispatcher.fireRecordExpired(new RecordExpiredEvent(rule.getResourceName(), entry.getRecordId(),
                disposition.getStrategy(), entry.getCohort(), clock.instant()));
        }

        @Override
        public void strategyApplied(TtlRule rule, Disposition disposition) {
            if (rule.getStrategy() == ExpireStrategy.CALLBACK) {
                totalCallbacks.incrementAndGet();
            }
        }

        @Override
        public void recordDeferred(TtlRule rule, ExpirationIndexEntry entry, Instant retryAt) {
            logger.debug("Record {} of {} deferred until {}", entry.getRecordId(), rule.getResourceName(), retryAt);
        }

        @Override
        public void recordFailed(TtlRule rule, ExpirationIndexEntry entry, CohortTtlException error) {
            dispatcher.fireCleanupError(new CleanupErrorEvent(rule.getResourceName(), entry.getRecordId(),
                rule.getGranularity(), error));
        }

        @Override
        public void scanCompleted(CleanupRun run) {
            totalScans.incrementAndGet();
            totalRelocated.addAndGet(run.getRelocated());
            totalErrors.addAndGet(run.getErrors());
            lastScanAt.set(run.getStartedAt());
            lastScanDuration.set(run.getDuration());
            dispatcher.fireScanCompleted(new ScanCompletedEvent(run));
        }

        @Override
        public void scanFailed(Granularity granularity, String resource, CohortTtlException error) {
            dispatcher.fireCleanupError(new CleanupErrorEvent(resource, null, granularity, error));
        }

        @Override
        public void elected(String workerId, long epoch) {
            dispatcher.fireCoordinatorElected(workerId, epoch);
        }

        @Override
        public void lost(String workerId) {
            dispatcher.fireCoordinatorLost(workerId);
        }
    }

    /**
     * Builder for CleanupEngine.
     */
    public static class Builder {
        private DocumentStore store;
        private final List<TtlRule> rules = new ArrayList<>();
        private final Map<String, ExpiryCallback> callbacks = new LinkedHashMap<>();
        private final List<CleanupEventListener> listeners = new ArrayList<>();
        private CleanupOptions options;
        private Clock clock = Clock.systemUTC();
        private boolean registerShutdownHook = true;

        private Builder() {
        }

        /**
         * Sets the store holding the governed resources, the index and the lease.
         */
        public Builder store(DocumentStore store) {
            this.store = store;
            return this;
        }

        public Builder rule(TtlRule rule) {
            this.rules.add(rule);
            return this;
        }

        public Builder rules(Collection<TtlRule> rules) {
            this.rules.addAll(rules);
            return this;
        }

        /**
         * Registers a handler that callback rules refer to by {@code name}.
         */
        public Builder callback(String name, ExpiryCallback callback) {
            this.callbacks.put(name, callback);
            return this;
        }

        public Builder callbacks(Map<String, ? extends ExpiryCallback> callbacks) {
            this.callbacks.putAll(callbacks);
            return this;
        }

        public Builder options(CleanupOptions options) {
            this.options = options;
            return this;
        }

        public Builder listener(CleanupEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets whether {@link #start()} registers a JVM shutdown hook. Defaults to true.
         */
        public Builder registerShutdownHook(boolean registerShutdownHook) {
            this.registerShutdownHook = registerShutdownHook;
            return this;
        }

        /**
         * Validates the rule set and builds the engine.
         *
         * @throws ConfigurationException if the store is missing, two rules govern one resource, a rule governs
         *                                an internal resource, or a callback rule names no registered callback
         */
        public CleanupEngine build() {
            if (store == null) {
                throw new ConfigurationException("DocumentStore must be set");
            }
            if (clock == null) {
                throw new ConfigurationException("Clock must be set");
            }
            if (options == null) {
                options = CleanupOptions.defaults();
            }
            Map<String, TtlRule> accepted = new LinkedHashMap<>();
            for (TtlRule rule : rules) {
                String resource = rule.getResourceName();
                if (accepted.containsKey(resource)) {
                    throw new ConfigurationException("Resource '" + resource + "' has more than one TTL rule");
                }
                if (resource.equals(options.getIndexResourceName()) || resource.equals(options.getLeaseResourceName())
                    || resource.equals(options.getCursorResourceName())) {
                    throw new ConfigurationException("Resource '" + resource + "' is reserved for the cleanup engine");
                }
                if (rule.getStrategy() == ExpireStrategy.CALLBACK && !callbacks.containsKey(rule.getCallbackName())) {
                    throw new ConfigurationException("Resource '" + resource + "' refers to callback '"
                        + rule.getCallbackName() + "', which is not registered");
                }
                if (!options.accepts(resource)) {
                    logger.warn("TTL rule for '{}' excluded by resource filter", resource);
                    continue;
                }
                accepted.put(resource, rule);
            }
            for (Map.Entry<String, ExpiryCallback> callback : callbacks.entrySet()) {
                if (callback.getValue() == null) {
                    throw new ConfigurationException("Callback '" + callback.getKey() + "' is null");
                }
            }
            return new CleanupEngine(this, accepted);
        }
    }
}
