package com.p14n.pgtopics.db;

import com.p14n.pgtopics.DuplicateEventException;
import com.p14n.pgtopics.NotFoundException;
import com.p14n.pgtopics.TestUtil;
import com.p14n.pgtopics.data.DeadLetter;
import com.p14n.pgtopics.data.EventState;
import com.p14n.pgtopics.data.EventStats;
import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.data.StoredEvent;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

class PostgresEventStoreTest {

    private static final TopicConfig IMMEDIATE_RETRY = TopicConfig.defaults()
            .withBackoff(Duration.ofMillis(1), Duration.ofMillis(1), 1.0);

    private static EmbeddedPostgres pg;
    private static DataSource ds;
    private EventStore store;
    private TopicInfo topic;

    @BeforeAll
    static void startDatabase() throws Exception {
        pg = TestUtil.embeddedPostgres();
        ds = pg.getPostgresDatabase();
    }

    @AfterAll
    static void stopDatabase() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        TestUtil.truncate(ds);
        store = new PostgresEventStore(ds);
        topic = store.createOrUpdateTopic("orders", TopicConfig.defaults());
    }

    private long publish(String key) throws Exception {
        return publish(topic, key);
    }

    private long publish(TopicInfo t, String key) throws Exception {
        return store.publishEvent(t.id(), key, ("{\"key\":\"" + key + "\"}").getBytes(), new byte[0]);
    }

    private StoredEvent claim() throws Exception {
        return store.claimNextEvent(topic.id()).orElseThrow();
    }

    private TopicInfo reconfigure(TopicConfig config) throws Exception {
        topic = store.createOrUpdateTopic("orders", config);
        return topic;
    }

    @Test
    void createOrUpdateTopicKeepsIdAndReplacesConfig() throws Exception {
        TopicInfo updated = store.createOrUpdateTopic("orders",
                TopicConfig.defaults().withRetries(3).withDeadLetters(true, Duration.ofHours(1)));

        assertEquals(topic.id(), updated.id());
        assertEquals(3, updated.config().maxRetries());
        assertTrue(updated.config().deadLetterEnabled());
        assertEquals(Duration.ofHours(1), updated.config().deadLetterMaxAge());

        TopicInfo read = store.getTopicByName("orders").orElseThrow();
        assertEquals(updated.config(), read.config());
        assertTrue(store.getTopicByName("missing").isEmpty());
    }

    @Test
    void claimsOldestEventFirst() throws Exception {
        long first = publish("a");
        long second = publish("b");
        long third = publish("c");

        assertEquals(first, claim().id());
        assertEquals(second, claim().id());
        StoredEvent last = claim();
        assertEquals(third, last.id());
        assertEquals(EventState.ACTIVE, last.state());
        assertEquals("c", last.idempotencyKey());
        assertTrue(store.claimNextEvent(topic.id()).isEmpty());
    }

    @Test
    void claimsOnlyFromItsOwnTopic() throws Exception {
        TopicInfo other = store.createOrUpdateTopic("invoices", TopicConfig.defaults());
        publish(other, "a");

        assertTrue(store.claimNextEvent(topic.id()).isEmpty());
        assertTrue(store.claimNextEvent(other.id()).isPresent());
    }

    @Test
    void duplicateKeyIsRejectedWithinTopic() throws Exception {
        publish("dup");

        DuplicateEventException e = assertThrows(DuplicateEventException.class, () -> publish("dup"));
        assertEquals("dup", e.getIdempotencyKey());

        TopicInfo other = store.createOrUpdateTopic("invoices", TopicConfig.defaults());
        assertDoesNotThrow(() -> publish(other, "dup"));
        assertEquals(1, store.getPendingEventCount(topic.id()));
    }

    @Test
    void publishInCallerTransactionIsVisibleOnlyAfterCommit() throws Exception {
        try (Connection conn = ds.getConnection()) {
            conn.setAutoCommit(false);
            store.publishEvent(conn, topic.id(), "tx", new byte[] { 1 }, new byte[0]);
            assertEquals(0, store.getPendingEventCount(topic.id()));
            conn.commit();
        }
        assertEquals(1, store.getPendingEventCount(topic.id()));

        try (Connection conn = ds.getConnection()) {
            conn.setAutoCommit(false);
            store.publishEvent(conn, topic.id(), "rolled-back", new byte[] { 1 }, new byte[0]);
            conn.rollback();
        }
        assertEquals(1, store.getPendingEventCount(topic.id()));
    }

    @Test
    void concurrentClaimsNeverShareAnEvent() throws Exception {
        int events = 60;
        int workers = 8;
        for (int i = 0; i < events; i++) {
            publish("e" + i);
        }

        var claimed = new ConcurrentLinkedQueue<Long>();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    Optional<StoredEvent> next;
                    while ((next = store.claimNextEvent(topic.id())).isPresent()) {
                        claimed.add(next.get().id());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(events, claimed.size());
        assertEquals(events, new HashSet<>(claimed).size());
        assertEquals(events, store.getEventStats(topic.id(), Duration.ofMinutes(5)).active());
    }

    @Test
    void completeMovesActiveEventToSucceeded() throws Exception {
        publish("a");
        StoredEvent event = claim();

        assertTrue(store.completeEvent(event.id()));
        assertFalse(store.completeEvent(event.id()));

        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(1, stats.succeeded());
        assertEquals(0, stats.unresolved());
    }

    @Test
    void completeRequiresActiveEvent() throws Exception {
        long id = publish("a");
        assertFalse(store.completeEvent(id));
        assertEquals(1, store.getPendingEventCount(topic.id()));
    }

    @Test
    void failureRetriesThenDeadLetters() throws Exception {
        reconfigure(IMMEDIATE_RETRY.withRetries(2).withDeadLetters(true));
        long id = publish("a");

        assertEquals(FailAction.RETRYING, store.failEvent(claimAfterRetryDelay().id(), "boom 1"));
        assertEquals(FailAction.RETRYING, store.failEvent(claimAfterRetryDelay().id(), "boom 2"));

        EventStats retrying = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(1, retrying.pending());
        assertEquals(1, retrying.retrying());

        assertEquals(FailAction.DEAD_LETTERED, store.failEvent(claimAfterRetryDelay().id(), "boom 3"));

        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(1, stats.failed());
        assertEquals(1, stats.deadLetters());
        assertEquals(0, stats.retrying());

        List<DeadLetter> letters = store.listDeadLetters(topic.id(), 0, 10);
        assertEquals(1, letters.size());
        assertEquals(id, letters.get(0).eventId());
        assertEquals("a", letters.get(0).idempotencyKey());
        assertEquals("boom 3", letters.get(0).errorMessage());
    }

    private StoredEvent claimAfterRetryDelay() throws Exception {
        Thread.sleep(20);
        return claim();
    }

    @Test
    void retryDelayHidesEventUntilDue() throws Exception {
        reconfigure(TopicConfig.defaults().withRetries(1)
                .withBackoff(Duration.ofHours(1), Duration.ofHours(1), 1.0));
        publish("a");

        assertEquals(FailAction.RETRYING, store.failEvent(claim().id(), "later"));

        assertTrue(store.claimNextEvent(topic.id()).isEmpty());
        assertEquals(0, store.getPendingEventCount(topic.id()));
        assertTrue(store.getPendingEvents(topic.id(), 10).isEmpty());
        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(1, stats.pending());
        assertEquals(1, stats.retrying());
    }

    @Test
    void failureWithoutRetriesOrDeadLettersFails() throws Exception {
        publish("a");

        assertEquals(FailAction.FAILED, store.failEvent(claim().id(), "boom"));

        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(1, stats.failed());
        assertEquals(0, stats.deadLetters());
        assertEquals(0, store.deadLetterCount(topic.id()));
    }

    @Test
    void missingErrorMessageIsRecordedAsUnknown() throws Exception {
        reconfigure(TopicConfig.defaults().withDeadLetters(true));
        publish("a");

        assertEquals(FailAction.DEAD_LETTERED, store.failEvent(claim().id(), null));

        assertEquals("unknown error", store.listDeadLetters(topic.id(), 0, 1).get(0).errorMessage());
    }

    @Test
    void failingAnInactiveEventIsNotFound() throws Exception {
        long pending = publish("a");

        assertThrows(NotFoundException.class, () -> store.failEvent(pending, "boom"));
        assertThrows(NotFoundException.class, () -> store.failEvent(pending + 1000, "boom"));
        assertEquals(1, store.getPendingEventCount(topic.id()));
    }

    @Test
    void discardDeletesEventWithoutDeadLetter() throws Exception {
        reconfigure(TopicConfig.defaults().withRetries(3).withDeadLetters(true));
        publish("a");

        assertTrue(store.discardEvent(claim().id()));

        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(0, stats.total());
        assertEquals(0, stats.deadLetters());
    }

    @Test
    void releaseReturnsEventToPending() throws Exception {
        long id = publish("a");
        claim();

        assertTrue(store.releaseEvent(id));
        assertFalse(store.releaseEvent(id));
        assertEquals(id, claim().id());
    }

    @Test
    void pendingEventsAreListedOldestFirst() throws Exception {
        publish("a");
        publish("b");
        publish("c");

        List<StoredEvent> pending = store.getPendingEvents(topic.id(), 2);
        assertEquals(List.of("a", "b"), pending.stream().map(StoredEvent::idempotencyKey).toList());
        assertEquals(3, store.getPendingEventCount(topic.id()));
    }

    @Test
    void clearStuckEventsRecoversAtMostMaxCount() throws Exception {
        for (int i = 0; i < 5; i++) {
            publish("s" + i);
        }
        for (int i = 0; i < 5; i++) {
            TestUtil.age(ds, claim().id(), Duration.ofMinutes(10));
        }

        assertEquals(3, store.clearStuckEvents(topic.id(), 3, Duration.ofMinutes(5)));

        EventStats stats = store.getEventStats(topic.id(), Duration.ofMinutes(5));
        assertEquals(3, stats.pending());
        assertEquals(2, stats.active());
        assertEquals(2, stats.stuck());
    }

    @Test
    void clearStuckEventsRecoversOldestFirst() throws Exception {
        long older = publish("older");
        long newer = publish("newer");
        claim();
        claim();
        TestUtil.age(ds, newer, Duration.ofMinutes(10));
        TestUtil.age(ds, older, Duration.ofMinutes(20));

        assertEquals(1, store.clearStuckEvents(topic.id(), 1, Duration.ofMinutes(5)));
        assertEquals(older, claim().id());
    }

    @Test
    void clearStuckEventsNeverTouchesEventsUpdatedWithinAMinute() throws Exception {
        long id = publish("a");
        claim();
        TestUtil.age(ds, id, Duration.ofSeconds(30));

        assertEquals(0, store.clearStuckEvents(topic.id(), 10, Duration.ofSeconds(1)));
        assertEquals(1, store.getEventStats(topic.id(), Duration.ofMinutes(5)).active());
    }

    @Test
    void oldDeadLettersAreCleanedUp() throws Exception {
        reconfigure(TopicConfig.defaults().withDeadLetters(true, Duration.ofHours(1)));
        publish("a");
        store.failEvent(claim().id(), "boom");

        assertEquals(0, store.cleanupOldDeadLetters());
        TestUtil.ageDeadLetters(ds, Duration.ofHours(2));
        assertEquals(1, store.cleanupOldDeadLetters());
        assertEquals(0, store.deadLetterCount(topic.id()));
    }

    @Test
    void retryDeadLetterRequeuesEventWithRetriesReset() throws Exception {
        reconfigure(IMMEDIATE_RETRY.withRetries(1).withDeadLetters(true));
        long id = publish("a");
        store.failEvent(claimAfterRetryDelay().id(), "first");
        store.failEvent(claimAfterRetryDelay().id(), "second");
        assertEquals(1, store.deadLetterCount(topic.id()));

        store.retryDeadLetter(topic.id(), "a");

        assertEquals(0, store.deadLetterCount(topic.id()));
        StoredEvent again = claim();
        assertEquals(id, again.id());
        assertEquals(FailAction.RETRYING, store.failEvent(again.id(), "third"));
    }

    @Test
    void retryUnknownDeadLetterIsNotFound() throws Exception {
        publish("a");

        NotFoundException e = assertThrows(NotFoundException.class,
                () -> store.retryDeadLetter(topic.id(), "a"));
        assertEquals("Dead letter a not found or not in dead letter queue", e.getMessage());
        assertEquals(1, store.getPendingEventCount(topic.id()));
    }

    @Test
    void deadLettersArePagedAndDeletable() throws Exception {
        reconfigure(TopicConfig.defaults().withDeadLetters(true));
        for (int i = 0; i < 3; i++) {
            publish("d" + i);
            store.failEvent(claim().id(), "boom " + i);
        }

        assertEquals(3, store.deadLetterCount(topic.id()));
        assertEquals(2, store.listDeadLetters(topic.id(), 0, 2).size());
        assertEquals(1, store.listDeadLetters(topic.id(), 2, 2).size());

        assertTrue(store.deleteDeadLetter(topic.id(), "d1"));
        assertFalse(store.deleteDeadLetter(topic.id(), "d1"));
        assertEquals(2, store.deadLetterCount(topic.id()));
        assertEquals(3, store.getEventStats(topic.id(), Duration.ofMinutes(5)).failed());
    }
}
