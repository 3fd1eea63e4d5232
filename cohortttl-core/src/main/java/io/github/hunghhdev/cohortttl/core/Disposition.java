package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;

/**
 * Outcome of applying a strategy to one record; tells the scan what to do with the index entry.
 */
public final class Disposition {

    public enum Kind {
        /** The record is gone or flagged; remove the entry. */
        DISPOSED,
        /** The record stays; move the entry to a later cohort. */
        RELOCATED,
        /** Disposal failed; keep the entry for the next scan. */
        ERROR
    }

    private final Kind kind;
    private final ExpireStrategy strategy;
    private final boolean changed;
    private final boolean callbackInvoked;
    private final Instant retryAt;
    private final StrategyExecutionException error;

    private Disposition(Kind kind, ExpireStrategy strategy, boolean changed, boolean callbackInvoked,
                        Instant retryAt, StrategyExecutionException error) {
        this.kind = kind;
        this.strategy = strategy;
        this.changed = changed;
        this.callbackInvoked = callbackInvoked;
        this.retryAt = retryAt;
        this.error = error;
    }

    /**
     * @param changed false when the record was already in its disposed state (already flagged, already gone)
     */
    static Disposition disposed(ExpireStrategy strategy, boolean changed) {
        return new Disposition(Kind.DISPOSED, strategy, changed, strategy == ExpireStrategy.CALLBACK, null, null);
    }

    static Disposition relocated(ExpireStrategy strategy, Instant retryAt) {
        return new Disposition(Kind.RELOCATED, strategy, false, strategy == ExpireStrategy.CALLBACK, retryAt, null);
    }

    static Disposition error(ExpireStrategy strategy, StrategyExecutionException error) {
        return new Disposition(Kind.ERROR, strategy, false, false, null, error);
    }

    public Kind getKind() {
        return kind;
    }

    public ExpireStrategy getStrategy() {
        return strategy;
    }

    public boolean isChanged() {
        return changed;
    }

    public boolean isCallbackInvoked() {
        return callbackInvoked;
    }

    /**
     * @return when a relocated record should be looked at again, null otherwise
     */
    public Instant getRetryAt() {
        return retryAt;
    }

    public StrategyExecutionException getError() {
        return error;
    }

    @Override
    public String toString() {
        return "Disposition{" + kind + ", strategy=" + strategy +
               (retryAt != null ? ", retryAt=" + retryAt : "") +
               (error != null ? ", error=" + error.getMessage() : "") + '}';
    }
}
