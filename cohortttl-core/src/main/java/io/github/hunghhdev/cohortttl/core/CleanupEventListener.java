package io.github.hunghhdev.cohortttl.core;

/**
 * Listener for cleanup events. Implementations receive callbacks when records expire, scans finish,
 * cleanup fails, or this instance gains or loses the coordinator role.
 *
 * <p>Callbacks run on the engine's scan and heartbeat threads; a listener that throws is logged and skipped.</p>
 *
 * @since 1.0.0
 */
public interface CleanupEventListener {

    default void onRecordExpired(RecordExpiredEvent event) {}

    default void onScanCompleted(ScanCompletedEvent event) {}

    default void onCleanupError(CleanupErrorEvent event) {}

    default void onCoordinatorElected(String workerId, long epoch) {}

    default void onCoordinatorLost(String workerId) {}
}
