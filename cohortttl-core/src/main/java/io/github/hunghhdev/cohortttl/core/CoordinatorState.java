package io.github.hunghhdev.cohortttl.core;

/**
 * Election state of one instance.
 */
public enum CoordinatorState {

    /**
     * Cold start: reading the lease without claiming it.
     */
    OBSERVING,

    /**
     * Another instance holds the lease; polling for its heartbeat.
     */
    FOLLOWER,

    /**
     * This instance holds the lease and runs scans.
     */
    COORDINATOR,

    /**
     * Stopped; the lease, if held, has been released.
     */
    STOPPED
}
