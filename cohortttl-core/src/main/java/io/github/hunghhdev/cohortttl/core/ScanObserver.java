package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;

/**
 * Receives the outcomes of a scan as they happen.
 */
interface ScanObserver {

    /**
     * A disposal strategy ran for one record, whatever its outcome.
     */
    void strategyApplied(TtlRule rule, Disposition disposition);

    void recordExpired(TtlRule rule, ExpirationIndexEntry entry, Disposition disposition);

    void recordDeferred(TtlRule rule, ExpirationIndexEntry entry, Instant retryAt);

    void recordFailed(TtlRule rule, ExpirationIndexEntry entry, CohortTtlException error);

    void scanCompleted(CleanupRun run);

    /**
     * The pass for {@code resource} stopped early, typically because the index could not be read.
     */
    void scanFailed(Granularity granularity, String resource, CohortTtlException error);
}
