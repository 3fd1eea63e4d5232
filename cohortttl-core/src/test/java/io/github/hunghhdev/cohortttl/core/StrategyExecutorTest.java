package io.github.hunghhdev.cohortttl.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StrategyExecutorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private InMemoryDocumentStore store;
    private MutableClock clock;
    private Map<String, ExpiryCallback> callbacks;
    private StrategyExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        clock = new MutableClock(NOW);
        callbacks = new HashMap<>();
        executor = newExecutor(Duration.ofSeconds(5), null);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private StrategyExecutor newExecutor(Duration timeout, Duration retryDelay) {
        return new StrategyExecutor(store, callbacks, timeout, retryDelay, clock);
    }

    private Document insert(String resource, String id) {
        return store.insert(resource, Document.of(id, Collections.singletonMap("createdAt", NOW.minusSeconds(3600).toString())));
    }

    @Test
    void testSoftDeleteMarksRecordOnce() {
        // Arrange
        TtlRule rule = TtlRule.builder("users").ttlSeconds(60).onExpire(ExpireStrategy.SOFT_DELETE).build();
        Document record = insert("users", "u1");

        // Act
        Disposition first = executor.execute(rule, record);
        Disposition second = executor.execute(rule, store.get("users", "u1").orElseThrow());

        // Assert
        assertEquals(Disposition.Kind.DISPOSED, first.getKind());
        assertTrue(first.isChanged());
        Document stored = store.get("users", "u1").orElseThrow();
        assertTrue(stored.isTrue("isDeleted"));
        assertEquals(NOW.toString(), stored.getString("deletedAt"));
        assertEquals(Disposition.Kind.DISPOSED, second.getKind());
        assertFalse(second.isChanged());
    }

    @Test
    void testSoftDeleteUsesConfiguredFields() {
        TtlRule rule = TtlRule.builder("users").ttlSeconds(60).onExpire(ExpireStrategy.SOFT_DELETE)
                .deleteField("removedOn").deletedFlagField("gone").build();
        Document record = insert("users", "u1");

        executor.execute(rule, record);

        Document stored = store.get("users", "u1").orElseThrow();
        assertTrue(stored.isTrue("gone"));
        assertTrue(stored.contains("removedOn"));
        assertFalse(stored.contains("isDeleted"));
    }

    @Test
    void testHardDeleteOfMissingRecordIsNotAChange() {
        TtlRule rule = TtlRule.builder("sessions").ttlSeconds(60).onExpire(ExpireStrategy.HARD_DELETE).build();
        Document record = insert("sessions", "s1");

        Disposition first = executor.execute(rule, record);
        Disposition second = executor.execute(rule, record);

        assertTrue(first.isChanged());
        assertFalse(store.get("sessions", "s1").isPresent());
        assertEquals(Disposition.Kind.DISPOSED, second.getKind());
        assertFalse(second.isChanged());
    }

    @Test
    void testArchiveCopiesThenDeletes() {
        // Arrange
        TtlRule rule = TtlRule.builder("orders").ttlSeconds(60).onExpire(ExpireStrategy.ARCHIVE)
                .archiveResource("orders_archive").build();
        Document record = insert("orders", "o1").with("total", 42);

        // Act
        Disposition disposition = executor.execute(rule, record);

        // Assert
        assertEquals(Disposition.Kind.DISPOSED, disposition.getKind());
        assertFalse(store.get("orders", "o1").isPresent());
        Document archived = store.get("orders_archive", "orders:o1").orElseThrow();
        assertEquals("o1", archived.getString(StrategyExecutor.ORIGINAL_ID));
        assertEquals("orders", archived.getString(StrategyExecutor.ARCHIVED_FROM));
        assertEquals(NOW.toString(), archived.getString(StrategyExecutor.ARCHIVED_AT));
        assertEquals(42, archived.get("total"));
    }

    @Test
    void testRepeatedArchiveDoesNotDuplicate() {
        TtlRule rule = TtlRule.builder("orders").ttlSeconds(60).onExpire(ExpireStrategy.ARCHIVE)
                .archiveResource("orders_archive").keepOriginalId(true).build();
        Document record = insert("orders", "o1");

        executor.execute(rule, record);
        Disposition again = executor.execute(rule, record);

        assertEquals(1, store.size("orders_archive"));
        assertTrue(store.get("orders_archive", "o1").isPresent());
        assertFalse(again.isChanged());
    }

    @Test
    void testCallbackAcceptDeletesRecord() {
        AtomicInteger calls = new AtomicInteger();
        callbacks.put("notify", record -> {
            calls.incrementAndGet();
            return true;
        });
        executor = newExecutor(Duration.ofSeconds(5), null);
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("notify").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));

        assertEquals(Disposition.Kind.DISPOSED, disposition.getKind());
        assertTrue(disposition.isChanged());
        assertEquals(1, calls.get());
        assertFalse(store.get("jobs", "j1").isPresent());
    }

    @Test
    void testCallbackDeclineRetriesInNextCohort() {
        callbacks.put("keep", record -> false);
        executor = newExecutor(Duration.ofSeconds(5), null);
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("keep").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));

        assertEquals(Disposition.Kind.RELOCATED, disposition.getKind());
        assertEquals(Instant.parse("2024-03-01T10:16:00Z"), disposition.getRetryAt());
        assertTrue(store.get("jobs", "j1").isPresent());
    }

    @Test
    void testCallbackDeclineHonoursRetryDelay() {
        callbacks.put("keep", record -> false);
        executor = newExecutor(Duration.ofSeconds(5), Duration.ofMinutes(15));
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("keep").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));

        assertEquals(NOW.plus(Duration.ofMinutes(15)), disposition.getRetryAt());
    }

    @Test
    void testCallbackExceptionIsReportedAsError() {
        callbacks.put("broken", record -> {
            throw new IllegalStateException("downstream unavailable");
        });
        executor = newExecutor(Duration.ofSeconds(5), null);
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("broken").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));

        assertEquals(Disposition.Kind.ERROR, disposition.getKind());
        assertEquals("jobs", disposition.getError().getResourceName());
        assertEquals("j1", disposition.getError().getRecordId());
        assertTrue(disposition.getError().getCause() instanceof IllegalStateException);
        assertTrue(store.get("jobs", "j1").isPresent());
    }

    @Test
    void testUnregisteredCallbackIsReportedAsError() {
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("missing").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));

        assertEquals(Disposition.Kind.ERROR, disposition.getKind());
        assertTrue(disposition.getError().getCause() instanceof ConfigurationException);
    }

    @Test
    void testSlowCallbackTimesOut() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        callbacks.put("slow", record -> release.await(10, TimeUnit.SECONDS));
        executor = newExecutor(Duration.ofMillis(100), null);
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("slow").build();

        Disposition disposition = executor.execute(rule, insert("jobs", "j1"));
        release.countDown();

        assertEquals(Disposition.Kind.ERROR, disposition.getKind());
        assertTrue(disposition.getError().getMessage().contains("timed out"));
        assertTrue(store.get("jobs", "j1").isPresent());
    }

    @Test
    void testInterruptDoesNotAbandonStartedDisposal() throws InterruptedException {
        // Arrange
        CountDownLatch entered = new CountDownLatch(1);
        callbacks.put("slow", record -> {
            entered.countDown();
            Thread.sleep(200);
            return true;
        });
        TtlRule rule = TtlRule.builder("jobs").ttlSeconds(60).onExpire(ExpireStrategy.CALLBACK).callback("slow").build();
        Document record = insert("jobs", "j1");
        Thread caller = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            try {
                entered.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            caller.interrupt();
        });
        interrupter.start();

        // Act
        Disposition disposition;
        boolean interruptRestored;
        try {
            disposition = executor.execute(rule, record);
        } finally {
            interruptRestored = Thread.interrupted();
            interrupter.join();
        }

        // Assert
        assertEquals(Disposition.Kind.DISPOSED, disposition.getKind());
        assertTrue(disposition.isChanged());
        assertFalse(store.get("jobs", "j1").isPresent());
        assertTrue(interruptRestored);
    }

    @Test
    void testStoreFailureIsReportedAsError() {
        DocumentStore failing = mock(DocumentStore.class);
        when(failing.delete(anyString(), anyString())).thenThrow(new StorageException("connection refused"));
        lenient().when(failing.put(anyString(), any())).thenThrow(new StorageException("connection refused"));
        StrategyExecutor failingExecutor = new StrategyExecutor(failing, callbacks, Duration.ofSeconds(5), null, clock);
        TtlRule rule = TtlRule.builder("sessions").ttlSeconds(60).onExpire(ExpireStrategy.HARD_DELETE).build();

        Disposition disposition = failingExecutor.execute(rule, Document.of("s1"));
        failingExecutor.close();

        assertEquals(Disposition.Kind.ERROR, disposition.getKind());
        assertEquals(ExpireStrategy.HARD_DELETE, disposition.getStrategy());
    }
}
