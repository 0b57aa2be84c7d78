package com.p14n.pgtopics.listener;

import com.p14n.pgtopics.TestUtil;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;
import com.p14n.pgtopics.db.EventStore;
import com.p14n.pgtopics.db.PostgresEventStore;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
class ListenerIntegrationTest {

    private EmbeddedPostgres pg;
    private DataSource ds;
    private Listener listener;
    private EventStore store;

    @BeforeEach
    void setUp() throws Exception {
        pg = TestUtil.embeddedPostgres();
        ds = pg.getPostgresDatabase();
        store = new PostgresEventStore(ds);
        listener = new Listener(ds, TestUtil.config(pg));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (listener != null) {
            listener.close();
        }
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    void receivesInsertAndReturnToPendingNotifications() throws Exception {
        TopicInfo topic = store.createOrUpdateTopic("orders", TopicConfig.defaults());
        BlockingQueue<Notification> received = new LinkedBlockingQueue<>();
        listener.listen(topic.id(), received::add);
        listener.start();
        assertTrue(listener.isRunning());

        long id = store.publishEvent(topic.id(), "a", new byte[] { 1 }, new byte[0]);

        assertEquals(new Notification(id, topic.id()), received.poll(10, TimeUnit.SECONDS));

        store.claimNextEvent(topic.id()).orElseThrow();
        assertNull(received.poll(500, TimeUnit.MILLISECONDS));

        store.releaseEvent(id);
        assertEquals(new Notification(id, topic.id()), received.poll(10, TimeUnit.SECONDS));
    }

    @Test
    void stopsOnClose() throws Exception {
        listener.start();
        assertThrows(IllegalStateException.class, () -> listener.start());

        listener.close();

        assertTrue(TestUtil.waitFor(() -> !listener.isRunning(), java.time.Duration.ofSeconds(5)));
    }
}
