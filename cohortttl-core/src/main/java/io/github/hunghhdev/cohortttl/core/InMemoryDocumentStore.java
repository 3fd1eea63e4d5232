package io.github.hunghhdev.cohortttl.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed {@link DocumentStore} for embedded use and tests. Thread-safe.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, NavigableMap<String, Document>> resources = new ConcurrentHashMap<>();
    private final Map<String, String> partitionFields = new ConcurrentHashMap<>();
    private final DocumentHookDispatcher hooks = new DocumentHookDispatcher();

    @Override
    public void declareResource(String resource, String partitionField) {
        requireResource(resource);
        resources.computeIfAbsent(resource, r -> new ConcurrentSkipListMap<>());
        if (partitionField != null) {
            partitionFields.put(resource, partitionField);
        }
    }

    @Override
    public Optional<Document> get(String resource, String id) {
        requireResource(resource);
        NavigableMap<String, Document> documents = resources.get(resource);
        if (documents == null || id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public Document insert(String resource, Document document) {
        requireResource(resource);
        Document toStore = document.hasId() ? document : document.with(Document.ID, UUID.randomUUID().toString());
        Document previous = documents(resource).putIfAbsent(toStore.getId(), toStore);
        if (previous != null) {
            throw new StorageException("Document '" + toStore.getId() + "' already exists in '" + resource + "'");
        }
        hooks.fireAfterInsert(resource, toStore);
        return toStore;
    }

    @Override
    public Document put(String resource, Document document) {
        requireResource(resource);
        if (!document.hasId()) {
            throw new StorageException("Document id is required for put into '" + resource + "'");
        }
        Document previous = documents(resource).put(document.getId(), document);
        if (previous == null) {
            hooks.fireAfterInsert(resource, document);
        } else {
            hooks.fireAfterUpdate(resource, document);
        }
        return document;
    }

    @Override
    public Optional<Document> update(String resource, String id, Map<String, ?> changes) {
        requireResource(resource);
        NavigableMap<String, Document> documents = resources.get(resource);
        if (documents == null || id == null) {
            return Optional.empty();
        }
        Document updated = documents.computeIfPresent(id, (key, current) -> current.withAll(changes).with(Document.ID, key));
        if (updated == null) {
            return Optional.empty();
        }
        hooks.fireAfterUpdate(resource, updated);
        return Optional.of(updated);
    }

    @Override
    public boolean delete(String resource, String id) {
        requireResource(resource);
        NavigableMap<String, Document> documents = resources.get(resource);
        if (documents == null || id == null) {
            return false;
        }
        boolean deleted = documents.remove(id) != null;
        if (deleted) {
            hooks.fireAfterDelete(resource, id);
        }
        return deleted;
    }

    @Override
    public DocumentPage listByPartition(String resource, String partitionValue, String afterId, int limit) {
        requireResource(resource);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String partitionField = partitionFields.get(resource);
        if (partitionField == null) {
            throw new StorageException("Resource '" + resource + "' has no partition declared");
        }
        NavigableMap<String, Document> documents = resources.get(resource);
        if (documents == null) {
            return DocumentPage.empty();
        }
        NavigableMap<String, Document> tail = afterId == null ? documents : documents.tailMap(afterId, false);
        List<Document> page = new ArrayList<>();
        boolean more = false;
        for (Document document : tail.values()) {
            if (!Objects.equals(partitionValue, document.getString(partitionField))) {
                continue;
            }
            if (page.size() == limit) {
                more = true;
                break;
            }
            page.add(document);
        }
        String nextCursor = more ? page.get(page.size() - 1).getId() : null;
        return new DocumentPage(page, nextCursor);
    }

    @Override
    public List<String> listPartitions(String resource) {
        requireResource(resource);
        String partitionField = partitionFields.get(resource);
        if (partitionField == null) {
            throw new StorageException("Resource '" + resource + "' has no partition declared");
        }
        NavigableMap<String, Document> documents = resources.get(resource);
        if (documents == null) {
            return new ArrayList<>();
        }
        TreeSet<String> partitions = new TreeSet<>();
        for (Document document : documents.values()) {
            String value = document.getString(partitionField);
            if (value != null) {
                partitions.add(value);
            }
        }
        return new ArrayList<>(partitions);
    }

    @Override
    public void addHook(DocumentHook hook) {
        hooks.add(hook);
    }

    @Override
    public void removeHook(DocumentHook hook) {
        hooks.remove(hook);
    }

    /**
     * Returns the number of documents in a resource.
     */
    public int size(String resource) {
        NavigableMap<String, Document> documents = resources.get(resource);
        return documents != null ? documents.size() : 0;
    }

    private NavigableMap<String, Document> documents(String resource) {
        return resources.computeIfAbsent(resource, r -> new ConcurrentSkipListMap<>());
    }

    private static void requireResource(String resource) {
        if (resource == null || resource.isEmpty()) {
            throw new StorageException("Resource name cannot be null or empty");
        }
    }
}
