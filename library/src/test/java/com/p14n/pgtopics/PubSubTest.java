package com.p14n.pgtopics;

import com.p14n.pgtopics.TestUtil.Greeting;
import com.p14n.pgtopics.data.ConfigData;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.topic.PostgresTopic;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
class PubSubTest {

    private EmbeddedPostgres pg;
    private DataSource ds;
    private ConfigData config;
    private PubSub pubsub;

    @BeforeEach
    void setUp() throws Exception {
        pg = TestUtil.embeddedPostgres();
        ds = pg.getPostgresDatabase();
        config = TestUtil.config(pg);
        pubsub = new PubSub(ds, config, OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pubsub != null) {
            pubsub.close();
        }
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    void publishesAndReceivesThroughNamedTopic() throws Exception {
        pubsub.start();
        PostgresTopic<Greeting> topic = pubsub.topic(Greeting.class, TopicConfig.defaults());
        var received = new LinkedBlockingQueue<String>();
        topic.subscribe(e -> received.add(e.payload().text()));

        topic.publish(new Greeting("hello"));

        assertEquals("greeting", topic.name());
        assertEquals("hello", received.poll(15, TimeUnit.SECONDS));
        assertTrue(pubsub.store().getTopicByName("greeting").isPresent());
    }

    @Test
    void topicsShareEventsAcrossInstances() throws Exception {
        pubsub.start();
        try (var second = new PubSub(ds, config, OpenTelemetry.noop())) {
            second.start();
            PostgresTopic<Greeting> publisher = pubsub.topic("shared", Greeting.class, TopicConfig.defaults());
            PostgresTopic<Greeting> consumer = second.topic("shared", Greeting.class, TopicConfig.defaults());
            var received = new LinkedBlockingQueue<String>();
            consumer.subscribe(e -> received.add(e.payload().text()));

            publisher.publish(new Greeting("across"));

            assertEquals("across", received.poll(15, TimeUnit.SECONDS));
        }
    }

    @Test
    void topicRequiresStart() {
        assertThrows(IllegalStateException.class, () -> pubsub.topic(Greeting.class, TopicConfig.defaults()));
    }

    @Test
    void startsOnlyOnce() {
        pubsub.start();

        assertThrows(IllegalStateException.class, () -> pubsub.start());
    }

    @Test
    void sameTopicCannotBeOpenedTwice() {
        pubsub.start();
        pubsub.topic(Greeting.class, TopicConfig.defaults());

        assertThrows(DuplicateListenerException.class,
                () -> pubsub.topic(Greeting.class, TopicConfig.defaults().withRetries(1)));
    }

    @Test
    void closeClosesTopics() throws Exception {
        pubsub.start();
        PostgresTopic<Greeting> topic = pubsub.topic(Greeting.class, TopicConfig.defaults());

        pubsub.close();
        pubsub.close();

        assertTrue(topic.isClosed());
        assertThrows(IllegalStateException.class, () -> pubsub.start());
    }

    @Test
    void closedTopicIsReleasedAndCanBeReopened() {
        pubsub.start();
        PostgresTopic<Greeting> topic = pubsub.topic(Greeting.class, TopicConfig.defaults());
        long id = topic.info().id();
        assertTrue(pubsub.maintenance().isRegistered(id));

        topic.close();

        assertFalse(pubsub.maintenance().isRegistered(id));
        assertTrue(pubsub.topics().isEmpty());

        PostgresTopic<Greeting> reopened = pubsub.topic(Greeting.class, TopicConfig.defaults());
        assertEquals(id, reopened.info().id());
        assertEquals(List.of(reopened), pubsub.topics());
        assertTrue(pubsub.maintenance().isRegistered(id));
    }
}
