package io.github.hunghhdev.cohortttl.core;

/**
 * Lifecycle hook of a {@link DocumentStore}. Invoked after a write has been applied.
 */
public interface DocumentHook {

    default void afterInsert(String resource, Document document) {}

    default void afterUpdate(String resource, Document document) {}

    default void afterDelete(String resource, String id) {}
}
