package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a rule's disposal strategy to one expired record.
 *
 * <p>Every strategy is safe to repeat: soft-deleting a flagged record, deleting a missing record and
 * re-archiving an archived record all leave the same end state. Two instances that both believe they
 * coordinate therefore cannot corrupt data, only duplicate work.</p>
 *
 * <p>Each execution runs on a worker thread bounded by the per-record timeout.
 * Failures and timeouts come back as {@link Disposition.Kind#ERROR}, never as exceptions.</p>
 */
public class StrategyExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StrategyExecutor.class);

    public static final String ARCHIVED_AT = "archivedAt";
    public static final String ARCHIVED_FROM = "archivedFrom";
    public static final String ORIGINAL_ID = "originalId";

    private final DocumentStore store;
    private final Map<String, ExpiryCallback> callbacks;
    private final Duration perRecordTimeout;
    private final Duration callbackRetryDelay;
    private final Clock clock;
    private final ExecutorService workers;

    /**
     * @param callbackRetryDelay delay before a declined callback record is offered again;
     *                           null to retry in the cohort after the current one
     */
    public StrategyExecutor(DocumentStore store, Map<String, ExpiryCallback> callbacks, Duration perRecordTimeout,
                            Duration callbackRetryDelay, Clock clock) {
        this.store = store;
        this.callbacks = new HashMap<>(callbacks);
        this.perRecordTimeout = perRecordTimeout;
        this.callbackRetryDelay = callbackRetryDelay;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "cohortttl-strategy-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Disposes of {@code record} according to {@code rule}, waiting at most the per-record timeout.
     * An interrupt does not abandon a disposal already started: it is waited for and the interrupt is
     * restored afterwards.
     */
    public Disposition execute(TtlRule rule, Document record) {
        ExpireStrategy strategy = rule.getStrategy();
        Future<Disposition> future;
        try {
            future = workers.submit(() -> apply(rule, record));
        } catch (RuntimeException e) {
            return failure(rule, record, "Strategy executor rejected the record", e);
        }
        long deadline = System.nanoTime() + perRecordTimeout.toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    return future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                    logger.debug("Interrupted while {} of record {} in {} is in flight, finishing it first",
                        strategy, record.getId(), rule.getResourceName());
                } catch (TimeoutException e) {
                    future.cancel(true);
                    return failure(rule, record, strategy + " timed out after " + perRecordTimeout, e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    return failure(rule, record, strategy + " failed: " + cause.getMessage(), cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Disposition apply(TtlRule rule, Document record) throws Exception {
        switch (rule.getStrategy()) {
            case SOFT_DELETE:
                return softDelete(rule, record);
            case HARD_DELETE:
                return Disposition.disposed(ExpireStrategy.HARD_DELETE, hardDelete(rule, record));
            case ARCHIVE:
                return archive(rule, record);
            case CALLBACK:
                return callback(rule, record);
            default:
                throw new IllegalStateException("Unsupported strategy: " + rule.getStrategy());
        }
    }

    private Disposition softDelete(TtlRule rule, Document record) {
        if (record.isTrue(rule.getDeletedFlagField())) {
            logger.debug("Record {} in {} is already soft-deleted", record.getId(), rule.getResourceName());
            return Disposition.disposed(ExpireStrategy.SOFT_DELETE, false);
        }
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(rule.getDeleteField(), clock.instant().toString());
        changes.put(rule.getDeletedFlagField(), Boolean.TRUE);
        boolean updated = store.update(rule.getResourceName(), record.getId(), changes).isPresent();
        if (updated) {
            logger.debug("Soft-deleted record {} in {}", record.getId(), rule.getResourceName());
        }
        return Disposition.disposed(ExpireStrategy.SOFT_DELETE, updated);
    }

    private boolean hardDelete(TtlRule rule, Document record) {
        boolean deleted = store.delete(rule.getResourceName(), record.getId());
        if (deleted) {
            logger.debug("Hard-deleted record {} from {}", record.getId(), rule.getResourceName());
        }
        return deleted;
    }

    private Disposition archive(TtlRule rule, Document record) {
        String originalId = record.getId();
        String archiveId = rule.isKeepOriginalId() ? originalId : rule.getResourceName() + ":" + originalId;

        Map<String, Object> archived = new LinkedHashMap<>(record.asMap());
        archived.put(Document.ID, archiveId);
        archived.put(ARCHIVED_AT, clock.instant().toString());
        archived.put(ARCHIVED_FROM, rule.getResourceName());
        archived.put(ORIGINAL_ID, originalId);

        // Keyed by source and original id, so a repeated archive overwrites instead of duplicating
        store.put(rule.getArchiveResourceName(), new Document(archived));
        boolean deleted = hardDelete(rule, record);
        logger.debug("Archived record {} from {} to {}", originalId, rule.getResourceName(), rule.getArchiveResourceName());
        return Disposition.disposed(ExpireStrategy.ARCHIVE, deleted);
    }

    private Disposition callback(TtlRule rule, Document record) throws Exception {
        ExpiryCallback handler = callbacks.get(rule.getCallbackName());
        if (handler == null) {
            throw new ConfigurationException("No callback registered under '" + rule.getCallbackName() + "'");
        }
        if (handler.onExpire(record)) {
            return Disposition.disposed(ExpireStrategy.CALLBACK, hardDelete(rule, record));
        }
        Instant retryAt = retryAt(rule.getGranularity());
        logger.debug("Callback '{}' kept record {} in {}, retrying at {}",
            rule.getCallbackName(), record.getId(), rule.getResourceName(), retryAt);
        return Disposition.relocated(ExpireStrategy.CALLBACK, retryAt);
    }

    /**
     * When a declined callback record is offered again: after the configured delay, or at the start of the
     * cohort following the current one.
     */
    Instant retryAt(Granularity granularity) {
        Instant now = clock.instant();
        if (callbackRetryDelay != null) {
            return now.plus(callbackRetryDelay);
        }
        return CohortCalculator.cohortStart(now, granularity).plus(granularity.getWidth());
    }

    private Disposition failure(TtlRule rule, Document record, String message, Throwable cause) {
        logger.warn("Failed to expire record {} in {}: {}", record.getId(), rule.getResourceName(), message);
        return Disposition.error(rule.getStrategy(),
            new StrategyExecutionException(rule.getResourceName(), record.getId(), message, cause));
    }

    /**
     * Waits for in-flight executions to finish, then stops the worker threads.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(perRecordTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
