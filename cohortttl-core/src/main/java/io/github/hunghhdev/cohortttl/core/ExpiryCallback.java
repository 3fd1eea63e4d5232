package io.github.hunghhdev.cohortttl.core;

/**
 * User handler for the {@link ExpireStrategy#CALLBACK} strategy, registered with the engine under a name
 * that rules refer to.
 */
@FunctionalInterface
public interface ExpiryCallback {

    /**
     * Called with the live record once it has expired.
     *
     * @param record the expired record
     * @return true to hard-delete the record, false to keep it and ask again later
     * @throws Exception any failure, counted as a cleanup error and retried on a later scan
     */
    boolean onExpire(Document record) throws Exception;
}
