package io.github.hunghhdev.cohortttl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class CleanupEventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CleanupEventDispatcher.class);

    private final List<CleanupEventListener> listeners = new CopyOnWriteArrayList<>();

    void add(CleanupEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    void remove(CleanupEventListener listener) {
        listeners.remove(listener);
    }

    void fireRecordExpired(RecordExpiredEvent event) {
        for (CleanupEventListener listener : listeners) {
            try {
                listener.onRecordExpired(event);
            } catch (Exception e) {
                logger.warn("CleanupEventListener.onRecordExpired failed for '{}:{}': {}",
                    event.getResource(), event.getRecordId(), e.getMessage());
            }
        }
    }

    void fireScanCompleted(ScanCompletedEvent event) {
        for (CleanupEventListener listener : listeners) {
            try {
                listener.onScanCompleted(event);
            } catch (Exception e) {
                logger.warn("CleanupEventListener.onScanCompleted failed: {}", e.getMessage());
            }
        }
    }

    void fireCleanupError(CleanupErrorEvent event) {
        for (CleanupEventListener listener : listeners) {
            try {
                listener.onCleanupError(event);
            } catch (Exception e) {
                logger.warn("CleanupEventListener.onCleanupError failed for '{}': {}", event.getResource(), e.getMessage());
            }
        }
    }

    void fireCoordinatorElected(String workerId, long epoch) {
        for (CleanupEventListener listener : listeners) {
            try {
                listener.onCoordinatorElected(workerId, epoch);
            } catch (Exception e) {
                logger.warn("CleanupEventListener.onCoordinatorElected failed: {}", e.getMessage());
            }
        }
    }

    void fireCoordinatorLost(String workerId) {
        for (CleanupEventListener listener : listeners) {
            try {
                listener.onCoordinatorLost(workerId);
            } catch (Exception e) {
                logger.warn("CleanupEventListener.onCoordinatorLost failed: {}", e.getMessage());
            }
        }
    }
}
