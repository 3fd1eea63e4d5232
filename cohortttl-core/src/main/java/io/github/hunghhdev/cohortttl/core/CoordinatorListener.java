package io.github.hunghhdev.cohortttl.core;

/**
 * Notified when this instance gains or loses the coordinator role.
 */
interface CoordinatorListener {

    void elected(String workerId, long epoch);

    void lost(String workerId);
}
