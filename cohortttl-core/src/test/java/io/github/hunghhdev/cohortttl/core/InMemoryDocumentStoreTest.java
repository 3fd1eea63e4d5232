package io.github.hunghhdev.cohortttl.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.declareResource("items", "bucket");
    }

    @Test
    void testInsertAssignsIdWhenMissing() {
        Document stored = store.insert("items", new Document(Collections.singletonMap("name", "a")));

        assertTrue(stored.hasId());
        assertEquals(Optional.of(stored), store.get("items", stored.getId()));
    }

    @Test
    void testInsertRejectsDuplicateId() {
        store.insert("items", Document.of("1"));

        assertThrows(StorageException.class, () -> store.insert("items", Document.of("1")));
    }

    @Test
    void testUpdateMergesAndKeepsId() {
        store.insert("items", Document.of("1", Collections.singletonMap("name", "a")));

        Optional<Document> updated = store.update("items", "1", Collections.singletonMap("color", "red"));

        assertTrue(updated.isPresent());
        assertEquals("a", updated.get().getString("name"));
        assertEquals("red", updated.get().getString("color"));
        assertEquals("1", updated.get().getId());
        assertFalse(store.update("items", "missing", Collections.singletonMap("x", 1)).isPresent());
    }

    @Test
    void testDeleteIsIdempotent() {
        store.insert("items", Document.of("1"));

        assertTrue(store.delete("items", "1"));
        assertFalse(store.delete("items", "1"));
        assertFalse(store.get("items", "1").isPresent());
    }

    @Test
    void testListByPartitionPagesInIdOrder() {
        for (int i = 0; i < 5; i++) {
            store.put("items", Document.of("id-" + i, Collections.singletonMap("bucket", "b1")));
        }
        store.put("items", Document.of("id-x", Collections.singletonMap("bucket", "b2")));

        DocumentPage first = store.listByPartition("items", "b1", null, 3);
        DocumentPage second = store.listByPartition("items", "b1", first.getNextCursor(), 3);

        assertEquals(3, first.getDocuments().size());
        assertTrue(first.hasMore());
        assertEquals("id-2", first.getNextCursor());
        assertEquals(2, second.getDocuments().size());
        assertFalse(second.hasMore());
        assertEquals("id-3", second.getDocuments().get(0).getId());
    }

    @Test
    void testListByPartitionRequiresDeclaredPartition() {
        store.declareResource("plain", null);

        assertThrows(StorageException.class, () -> store.listByPartition("plain", "x", null, 10));
        assertThrows(IllegalArgumentException.class, () -> store.listByPartition("items", "b1", null, 0));
    }

    @Test
    void testListPartitionsReturnsDistinctValuesInOrder() {
        store.put("items", Document.of("a", Collections.singletonMap("bucket", "b2")));
        store.put("items", Document.of("b", Collections.singletonMap("bucket", "b1")));
        store.put("items", Document.of("c", Collections.singletonMap("bucket", "b2")));
        store.put("items", Document.of("d", Collections.singletonMap("other", "x")));
        store.declareResource("plain", null);

        assertEquals(List.of("b1", "b2"), store.listPartitions("items"));
        assertThrows(StorageException.class, () -> store.listPartitions("plain"));
    }

    @Test
    void testHooksFireForEveryWrite() {
        List<String> events = new ArrayList<>();
        store.addHook(new DocumentHook() {
            @Override
            public void afterInsert(String resource, Document document) {
                events.add("insert:" + document.getId());
            }

            @Override
            public void afterUpdate(String resource, Document document) {
                events.add("update:" + document.getId());
            }

            @Override
            public void afterDelete(String resource, String id) {
                events.add("delete:" + id);
            }
        });

        store.insert("items", Document.of("1"));
        store.put("items", Document.of("1"));
        store.put("items", Document.of("2"));
        store.update("items", "1", Collections.singletonMap("a", 1));
        store.delete("items", "1");
        store.delete("items", "1");

        assertEquals(List.of("insert:1", "update:1", "insert:2", "update:1", "delete:1"), events);
    }

    @Test
    void testFailingHookDoesNotBreakWrite() {
        store.addHook(new DocumentHook() {
            @Override
            public void afterInsert(String resource, Document document) {
                throw new IllegalStateException("boom");
            }
        });

        Document stored = store.insert("items", Document.of("1"));

        assertEquals(Optional.of(stored), store.get("items", "1"));
    }
}
