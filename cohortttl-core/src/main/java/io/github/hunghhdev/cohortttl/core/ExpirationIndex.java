package io.github.hunghhdev.cohortttl.core;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Secondary index from cohort to the records expiring in it, kept in the shared {@link DocumentStore}.
 *
 * <p>Entries live in one index resource partitioned by cohort label. Labels of different granularities never
 * collide, so one partition read returns exactly the entries of one cohort. Every write is a whole-entry
 * {@code put}; nothing here relies on transactions or compare-and-swap.</p>
 */
public class ExpirationIndex {
    private static final Logger logger = LoggerFactory.getLogger(ExpirationIndex.class);

    public static final String DEFAULT_RESOURCE_NAME = "cohortttl_expiration_index";

    /**
     * Result of {@link #upsert(TtlRule, Document)}.
     */
    public enum UpsertOutcome {
        /** A new entry was written. */
        INDEXED,
        /** An existing entry was rewritten for a changed expiry. */
        RELOCATED,
        /** The entry already matched the record. */
        UNCHANGED,
        /** The record has no expiry (or is already soft-deleted) and its entry was dropped. */
        REMOVED,
        /** Nothing to index and nothing to drop. */
        SKIPPED
    }

    private final DocumentStore store;
    private final String resourceName;
    private final Clock clock;

    public ExpirationIndex(DocumentStore store, String resourceName, Clock clock) {
        this.store = store;
        this.resourceName = resourceName;
        this.clock = clock;
    }

    /**
     * Declares the index resource with {@code cohort} as its partition attribute.
     */
    public void initialize() {
        store.declareResource(resourceName, ExpirationIndexEntry.COHORT);
    }

    /**
     * Cohort an entry is placed in: the cohort of its expiry, or the current cohort if that has already passed.
     */
    public static String placementCohort(Instant expiresAt, Granularity granularity, Instant now) {
        Instant effective = expiresAt.isBefore(now) ? now : expiresAt;
        return CohortCalculator.cohortFor(effective, granularity);
    }

    /**
     * Indexes {@code record} under {@code rule}. Re-upserting a record whose expiry did not change is a no-op,
     * which also keeps a deferred entry deferred.
     */
    public UpsertOutcome upsert(TtlRule rule, Document record) {
        if (!record.hasId()) {
            return UpsertOutcome.SKIPPED;
        }
        String recordId = record.getId();
        if (rule.getStrategy() == ExpireStrategy.SOFT_DELETE && record.isTrue(rule.getDeletedFlagField())) {
            return remove(rule.getResourceName(), recordId) ? UpsertOutcome.REMOVED : UpsertOutcome.SKIPPED;
        }

        Optional<Instant> expiresAt = rule.expiresAt(record);
        if (!expiresAt.isPresent()) {
            return remove(rule.getResourceName(), recordId) ? UpsertOutcome.REMOVED : UpsertOutcome.SKIPPED;
        }

        Optional<ExpirationIndexEntry> existing = find(rule.getResourceName(), recordId);
        if (existing.isPresent()
            && existing.get().getExpiresAt().equals(expiresAt.get())
            && existing.get().getGranularity() == rule.getGranularity()
            && existing.get().getStrategy() == rule.getStrategy()) {
            return UpsertOutcome.UNCHANGED;
        }

        Instant now = clock.instant();
        String cohort = placementCohort(expiresAt.get(), rule.getGranularity(), now);
        ExpirationIndexEntry entry = new ExpirationIndexEntry(rule.getResourceName(), recordId, cohort,
            expiresAt.get(), rule.getGranularity(), rule.getStrategy(), null, now);
        store.put(resourceName, entry.toDocument());

        if (existing.isPresent()) {
            logger.debug("Relocated {} from cohort {} to {}", entry.getId(), existing.get().getCohort(), cohort);
            return UpsertOutcome.RELOCATED;
        }
        logger.debug("Indexed {} in cohort {}", entry.getId(), cohort);
        return UpsertOutcome.INDEXED;
    }

    public Optional<ExpirationIndexEntry> find(String resource, String recordId) {
        return store.get(resourceName, ExpirationIndexEntry.idFor(resource, recordId))
            .map(ExpirationIndexEntry::fromDocument);
    }

    /**
     * Moves an entry to another cohort, optionally holding it back until {@code deferredUntil}.
     */
    public ExpirationIndexEntry relocate(ExpirationIndexEntry entry, String cohort, Instant deferredUntil) {
        ExpirationIndexEntry moved = entry.movedTo(cohort, deferredUntil, clock.instant());
        store.put(resourceName, moved.toDocument());
        return moved;
    }

    /**
     * Deletes one entry. An absent entry is not an error.
     *
     * @return true if an entry was deleted
     */
    public boolean remove(ExpirationIndexEntry entry) {
        return remove(entry.getResourceName(), entry.getRecordId());
    }

    public boolean remove(String resource, String recordId) {
        return store.delete(resourceName, ExpirationIndexEntry.idFor(resource, recordId));
    }

    /**
     * Lazily pages through the entries of {@code resource} in every cohort after {@code afterExclusive} up to
     * and including {@code uptoInclusive}, oldest cohort first. Each cohort yields at least one page, possibly
     * empty, and the last page of each cohort is flagged.
     */
    public Iterator<IndexPage> due(String resource, Granularity granularity, String afterExclusive,
                                   String uptoInclusive, int batchSize) {
        List<String> cohorts = CohortCalculator.cohortsBetween(afterExclusive, uptoInclusive, granularity);
        return new DueIterator(resource, cohorts, batchSize);
    }

    /**
     * Oldest cohort of {@code granularity} that currently holds entries of any resource.
     */
    public Optional<String> oldestCohort(Granularity granularity) {
        for (String partition : store.listPartitions(resourceName)) {
            if (CohortCalculator.isLabel(partition, granularity)) {
                return Optional.of(partition);
            }
        }
        return Optional.empty();
    }

    public String getResourceName() {
        return resourceName;
    }

    private final class DueIterator implements Iterator<IndexPage> {
        private final String resource;
        private final Iterator<String> cohorts;
        private final int batchSize;
        private String cohort;
        private String cursor;
        private boolean cohortExhausted = true;

        DueIterator(String resource, List<String> cohorts, int batchSize) {
            this.resource = resource;
            this.cohorts = cohorts.iterator();
            this.batchSize = batchSize;
        }

        @Override
        public boolean hasNext() {
            return !cohortExhausted || cohorts.hasNext();
        }

        @Override
        public IndexPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (cohortExhausted) {
                cohort = cohorts.next();
                cursor = null;
            }
            DocumentPage documents = store.listByPartition(resourceName, cohort, cursor, batchSize);
            List<ExpirationIndexEntry> entries = new ArrayList<>(documents.getDocuments().size());
            for (Document document : documents.getDocuments()) {
                ExpirationIndexEntry entry;
                try {
                    entry = ExpirationIndexEntry.fromDocument(document);
                } catch (StorageException e) {
                    logger.warn("Skipping unreadable index entry in cohort {}: {}", cohort, e.getMessage());
                    continue;
                }
                if (resource.equals(entry.getResourceName())) {
                    entries.add(entry);
                }
            }
            cursor = documents.getNextCursor();
            cohortExhausted = cursor == null;
            return new IndexPage(cohort, entries, cohortExhausted);
        }
    }
}
