package io.github.hunghhdev.cohortttl.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic document storage used by the engine for governed records, the expiration index and the
 * coordinator lease.
 *
 * <p>The engine assumes no transactions, no compare-and-swap and no read-after-write consistency:
 * every write it performs is an idempotent upsert or delete.</p>
 */
public interface DocumentStore {

    /**
     * Declares a resource and the attribute used as its partition key.
     * @param resource the resource name
     * @param partitionField attribute listed by {@link #listByPartition}, or null for none
     */
    void declareResource(String resource, String partitionField);

    /**
     * Reads a document by id.
     * @param resource the resource name
     * @param id the document id
     * @return the document, empty if it does not exist
     */
    Optional<Document> get(String resource, String id);

    /**
     * Creates a document. A random id is assigned when the document has none.
     * @param resource the resource name
     * @param document the document to create
     * @return the stored document
     * @throws StorageException if a document with the same id exists
     */
    Document insert(String resource, Document document);

    /**
     * Creates or replaces a document by id.
     * @param resource the resource name
     * @param document the document, which must carry an id
     * @return the stored document
     */
    Document put(String resource, Document document);

    /**
     * Merges {@code changes} into an existing document.
     * @param resource the resource name
     * @param id the document id
     * @param changes attributes to set
     * @return the updated document, empty if it does not exist
     */
    Optional<Document> update(String resource, String id, Map<String, ?> changes);

    /**
     * Deletes a document.
     * @param resource the resource name
     * @param id the document id
     * @return true if a document was deleted, false if none existed
     */
    boolean delete(String resource, String id);

    /**
     * Lists the documents whose partition attribute equals {@code partitionValue}, ordered by id.
     * @param resource the resource name
     * @param partitionValue the exact partition value
     * @param afterId exclusive cursor from the previous page, or null for the first page
     * @param limit maximum number of documents to return
     * @return one page of documents
     */
    DocumentPage listByPartition(String resource, String partitionValue, String afterId, int limit);

    /**
     * Lists the distinct partition values present in a resource, in ascending order.
     * @param resource the resource name
     * @return the partition values, empty if the resource holds no partitioned documents
     */
    List<String> listPartitions(String resource);

    void addHook(DocumentHook hook);

    void removeHook(DocumentHook hook);
}
