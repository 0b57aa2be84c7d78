package com.p14n.pgtopics;

import com.p14n.pgtopics.broker.AsyncExecutor;
import com.p14n.pgtopics.broker.DefaultExecutor;
import com.p14n.pgtopics.data.PubSubConfig;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicNames;
import com.p14n.pgtopics.db.EventStore;
import com.p14n.pgtopics.db.PostgresEventStore;
import com.p14n.pgtopics.listener.Listener;
import com.p14n.pgtopics.maintenance.MaintenanceService;
import com.p14n.pgtopics.topic.PostgresTopic;

import io.opentelemetry.api.OpenTelemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for durable topics in a process.
 *
 * <p>
 * Owns the shared pieces every topic needs: the executor, the notification
 * listener and the maintenance sweep. Topics opened here are closed with it.
 * </p>
 *
 * <pre>{@code
 * var pubsub = new PubSub(dataSource, config, openTelemetry);
 * pubsub.start();
 *
 * PostgresTopic<UserCreated> users = pubsub.topic(UserCreated.class, TopicConfig.defaults());
 * users.subscribe(event -> {
 *     // Process the event
 * });
 * users.publish(new UserCreated("alice"));
 *
 * // When done
 * pubsub.close();
 * }</pre>
 */
public class PubSub implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubSub.class);

    private final PubSubConfig cfg;
    private final AsyncExecutor asyncExecutor;
    private final OpenTelemetry ot;
    private final EventStore store;
    private final Listener listener;
    private final MaintenanceService maintenance;
    private final List<PostgresTopic<?>> topics = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PubSub(DataSource ds, PubSubConfig cfg, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        this.cfg = cfg;
        this.asyncExecutor = asyncExecutor;
        this.ot = ot;
        this.store = new PostgresEventStore(ds);
        this.listener = new Listener(ds, cfg);
        this.maintenance = new MaintenanceService(store, asyncExecutor, cfg);
    }

    public PubSub(DataSource ds, PubSubConfig cfg, OpenTelemetry ot) {
        this(ds, cfg, new DefaultExecutor(2), ot);
    }

    /**
     * Starts listening for notifications and schedules maintenance.
     *
     * @throws IllegalStateException if already started
     * @throws PubSubException       if the listener cannot connect
     */
    public void start() {
        logger.atInfo().log("Starting pubsub");
        if (closed.get()) {
            throw new IllegalStateException("PubSub is closed");
        }
        if (!started.compareAndSet(false, true)) {
            logger.atError().log("PubSub already started");
            throw new IllegalStateException("Already started");
        }
        try {
            listener.start();
            maintenance.start();
            logger.atInfo().log("PubSub started successfully");
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Failed to start pubsub");
            throw e;
        }
    }

    /**
     * Opens the topic named after the payload type, see {@link TopicNames#of}.
     */
    public <T> PostgresTopic<T> topic(Class<T> type, TopicConfig config) {
        return topic(TopicNames.of(type), type, config);
    }

    /**
     * Opens a topic, creating it in the store or updating its configuration.
     *
     * @throws IllegalStateException                 if not started
     * @throws DuplicateListenerException            if the topic is already open
     *                                               in this process
     */
    public <T> PostgresTopic<T> topic(String name, Class<T> type, TopicConfig config) {
        if (!started.get() || closed.get()) {
            throw new IllegalStateException("PubSub is not running");
        }
        PostgresTopic<T> topic = PostgresTopic.create(name, type, config, store, listener, asyncExecutor, ot, cfg,
                this::topicClosed);
        maintenance.register(topic.info().id(), name);
        topics.add(topic);
        return topic;
    }

    private void topicClosed(PostgresTopic<?> topic) {
        maintenance.unregister(topic.info().id());
        topics.remove(topic);
    }

    /**
     * The topics opened here and not yet closed.
     */
    public List<PostgresTopic<?>> topics() {
        return List.copyOf(topics);
    }

    MaintenanceService maintenance() {
        return maintenance;
    }

    /**
     * The store shared by the topics, for operator tasks across topics.
     */
    public EventStore store() {
        return store;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().log("Closing pubsub");

        List<AutoCloseable> closeables = new ArrayList<>(topics);
        closeables.add(maintenance);
        closeables.add(listener);
        closeables.add(asyncExecutor);
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
        topics.clear();

        logger.atInfo().log("PubSub closed");
    }
}
