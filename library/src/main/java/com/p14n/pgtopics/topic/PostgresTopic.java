package com.p14n.pgtopics.topic;

import com.p14n.pgtopics.DiscardException;
import com.p14n.pgtopics.EventSubscriber;
import com.p14n.pgtopics.PubSubException;
import com.p14n.pgtopics.Topic;
import com.p14n.pgtopics.broker.AsyncExecutor;
import com.p14n.pgtopics.data.DeadLetter;
import com.p14n.pgtopics.data.Event;
import com.p14n.pgtopics.data.EventStats;
import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.data.PubSubConfig;
import com.p14n.pgtopics.data.StoredEvent;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;
import com.p14n.pgtopics.db.EventStore;
import com.p14n.pgtopics.listener.Listener;
import com.p14n.pgtopics.listener.Notification;
import com.p14n.pgtopics.telemetry.TopicMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import static com.p14n.pgtopics.telemetry.OpenTelemetryFunctions.TRACEPARENT;
import static com.p14n.pgtopics.telemetry.OpenTelemetryFunctions.processWithTelemetry;
import static com.p14n.pgtopics.telemetry.OpenTelemetryFunctions.serializeTraceContext;

/**
 * A durable topic stored in Postgres.
 *
 * <p>
 * Each published event is delivered to one subscriber in one of the processes
 * that have the topic open, at least once. Delivery starts when the listener
 * reports the insert, and the backlog reconciler picks up anything the
 * notifications missed. A subscriber outcome is reported to the store:
 * </p>
 * <ul>
 * <li>normal return: the event succeeds</li>
 * <li>{@link DiscardException}: the event is deleted</li>
 * <li>any other exception: the topic's retry policy applies</li>
 * </ul>
 *
 * <p>
 * Notified events are claimed and dispatched on the executor's worker pool,
 * one task per notification, so the listener thread never waits on a
 * subscriber. {@link com.p14n.pgtopics.broker.DefaultExecutor} as created by
 * {@link com.p14n.pgtopics.PubSub} uses an unbounded cached pool; construct
 * {@code PubSub} with {@code new DefaultExecutor(scheduled, workers)} to cap
 * concurrent subscriber calls.
 * </p>
 *
 * <pre>{@code
 * Topic<UserCreated> users = PostgresTopic.create("user_created", UserCreated.class,
 *         TopicConfig.defaults().withRetries(3), store, listener, executor, ot, config);
 * users.subscribe(e -> sendWelcomeMail(e.payload()));
 * users.publish(new UserCreated("alice"));
 * }</pre>
 *
 * @param <T> payload type
 */
public class PostgresTopic<T> implements Topic<T> {

    private static final Logger logger = LoggerFactory.getLogger(PostgresTopic.class);

    private final TopicInfo info;
    private final EventStore store;
    private final Listener listener;
    private final AsyncExecutor executor;
    private final EventCodec<T> codec;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final TopicMetrics metrics;

    private final List<EventSubscriber<T>> subscribers = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private BacklogReconciler reconciler;
    private Consumer<? super PostgresTopic<T>> onClose = t -> {
    };

    PostgresTopic(TopicInfo info, Class<T> type, EventStore store, Listener listener, AsyncExecutor executor,
            OpenTelemetry ot) {
        this.info = info;
        this.store = store;
        this.listener = listener;
        this.executor = executor;
        this.codec = new EventCodec<>(type);
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("pgtopics");
        this.metrics = new TopicMetrics(ot.getMeter("pgtopics"));
    }

    /**
     * Registers the topic in the store, or updates its configuration, and
     * starts delivery to this process.
     *
     * @throws PubSubException                             if the store is
     *                                                     unreachable
     * @throws com.p14n.pgtopics.DuplicateListenerException if the topic is
     *                                                     already open on the
     *                                                     listener
     */
    public static <T> PostgresTopic<T> create(String name, Class<T> type, TopicConfig config, EventStore store,
            Listener listener, AsyncExecutor executor, OpenTelemetry ot, PubSubConfig pubSubConfig) {
        return create(name, type, config, store, listener, executor, ot, pubSubConfig, t -> {
        });
    }

    /**
     * As {@link #create(String, Class, TopicConfig, EventStore, Listener, AsyncExecutor, OpenTelemetry, PubSubConfig)},
     * running {@code onClose} once the topic has been closed.
     */
    public static <T> PostgresTopic<T> create(String name, Class<T> type, TopicConfig config, EventStore store,
            Listener listener, AsyncExecutor executor, OpenTelemetry ot, PubSubConfig pubSubConfig,
            Consumer<? super PostgresTopic<T>> onClose) {
        TopicInfo info;
        try {
            info = store.createOrUpdateTopic(name, config);
        } catch (SQLException e) {
            throw new PubSubException("Failed to create topic " + name, e);
        }
        PostgresTopic<T> topic = new PostgresTopic<>(info, type, store, listener, executor, ot);
        topic.onClose = onClose;
        listener.listen(info.id(), topic::notified);
        topic.reconciler = new BacklogReconciler(name, topic::processBacklogOnce, executor,
                pubSubConfig.backlogPeriod(), pubSubConfig.backlogMaxBackoff());
        topic.reconciler.start();
        logger.atInfo().log("Topic {} opened with id {}", name, info.id());
        return topic;
    }

    @Override
    public String name() {
        return info.name();
    }

    public TopicInfo info() {
        return info;
    }

    @Override
    public void publish(Event<T> event) {
        publishWith(event, (id, message, headers) -> store.publishEvent(info.id(), id, message, headers));
    }

    /**
     * Publishes within the caller's transaction. The event only becomes
     * visible, and subscribers are only notified, if the caller commits.
     */
    public void publish(Connection connection, T payload) {
        publish(connection, Event.of(payload));
    }

    public void publish(Connection connection, Event<T> event) {
        if (connection == null) {
            throw new IllegalArgumentException("Connection cannot be null");
        }
        publishWith(event,
                (id, message, headers) -> store.publishEvent(connection, info.id(), id, message, headers));
    }

    @FunctionalInterface
    private interface Insert {
        long insert(String id, byte[] message, byte[] headers) throws SQLException;
    }

    private void publishWith(Event<T> event, Insert insert) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (closed.get()) {
            throw new IllegalStateException("Topic " + name() + " is closed");
        }
        try {
            long eventId = processWithTelemetry(openTelemetry, tracer, "publish_event", name(), event.id(), null,
                    () -> insert.insert(event.id(), codec.encode(event), codec.encodeHeaders(traceHeaders())));
            metrics.recordPublished(name());
            logger.atDebug().log("Published event {} as {} on topic {}", event.id(), eventId, name());
        } catch (PubSubException e) {
            throw e;
        } catch (Exception e) {
            throw new PubSubException("Failed to publish event " + event.id() + " to topic " + name(), e);
        }
    }

    private Map<String, String> traceHeaders() {
        Map<String, String> headers = new HashMap<>();
        String traceparent = serializeTraceContext(openTelemetry);
        if (traceparent != null) {
            headers.put(TRACEPARENT, traceparent);
        }
        return headers;
    }

    @Override
    public void subscribe(EventSubscriber<T> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        lock.writeLock().lock();
        try {
            if (closed.get()) {
                throw new IllegalStateException("Topic " + name() + " is closed");
            }
            subscribers.add(subscriber);
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordSubscriberAdded(name());
    }

    /**
     * Listener callback. Claims and dispatches one event on a worker thread.
     */
    void notified(Notification notification) {
        if (notification.topic() != info.id() || closed.get() || !hasSubscribers()) {
            return;
        }
        executor.submit(() -> {
            try {
                claimAndDispatch();
            } catch (SQLException | RuntimeException e) {
                logger.atError().setCause(e).log("Failed to process notified event {} on topic {}",
                        notification.id(), name());
            }
            return null;
        });
    }

    /**
     * Claims and dispatches one backlogged event.
     *
     * @return true if an event was processed
     * @throws PubSubException if the event could not be processed, after it
     *                         has been reported to the store
     */
    boolean processBacklogOnce() throws SQLException {
        if (closed.get()) {
            return false;
        }
        Outcome outcome = claimAndDispatch();
        if (outcome == Outcome.FAILED) {
            throw new PubSubException("Backlogged event on topic " + name() + " failed processing");
        }
        return outcome == Outcome.PROCESSED;
    }

    private enum Outcome {
        NONE,
        PROCESSED,
        FAILED
    }

    private Outcome claimAndDispatch() throws SQLException {
        if (!hasSubscribers()) {
            return Outcome.NONE;
        }
        Optional<StoredEvent> claimed = store.claimNextEvent(info.id());
        if (claimed.isEmpty()) {
            return Outcome.NONE;
        }
        return dispatch(claimed.get());
    }

    private Outcome dispatch(StoredEvent stored) throws SQLException {
        EventSubscriber<T> subscriber = pickSubscriber();
        if (subscriber == null) {
            // every subscriber left after the claim
            store.releaseEvent(stored.id());
            return Outcome.NONE;
        }

        Event<T> event;
        Map<String, String> headers;
        try {
            event = codec.decode(stored.message());
            headers = codec.decodeHeaders(stored.headers());
        } catch (IOException e) {
            logger.atError().setCause(e).log("Cannot decode event {} on topic {}", stored.id(), name());
            FailAction action = store.failEvent(stored.id(), "undecodable event: " + e.getMessage());
            metrics.recordFailed(name(), action);
            return Outcome.FAILED;
        }

        try {
            processWithTelemetry(openTelemetry, tracer, "process_event", name(), event.id(),
                    headers.get(TRACEPARENT), () -> {
                        subscriber.onEvent(event);
                        return null;
                    });
        } catch (DiscardException e) {
            store.discardEvent(stored.id());
            metrics.recordDiscarded(name());
            logger.atDebug().log("Event {} on topic {} discarded: {}", event.id(), name(), e.getMessage());
            return Outcome.PROCESSED;
        } catch (Exception e) {
            FailAction action = store.failEvent(stored.id(), errorMessage(e));
            metrics.recordFailed(name(), action);
            logger.atWarn().setCause(e).log("Subscriber failed on event {} on topic {}, event is {}",
                    event.id(), name(), action.dbValue());
            return Outcome.FAILED;
        }

        store.completeEvent(stored.id());
        metrics.recordDelivered(name());
        return Outcome.PROCESSED;
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getMessage();
    }

    private boolean hasSubscribers() {
        lock.readLock().lock();
        try {
            return !subscribers.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private EventSubscriber<T> pickSubscriber() {
        lock.readLock().lock();
        try {
            if (subscribers.isEmpty()) {
                return null;
            }
            return subscribers.get(ThreadLocalRandom.current().nextInt(subscribers.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Moves a dead lettered event back to pending with its retries reset.
     *
     * @throws com.p14n.pgtopics.NotFoundException if the key is not dead
     *                                             lettered on this topic
     */
    public void retryDeadLetter(String idempotencyKey) {
        try {
            store.retryDeadLetter(info.id(), idempotencyKey);
        } catch (SQLException e) {
            throw new PubSubException("Failed to retry dead letter " + idempotencyKey, e);
        }
    }

    public EventStats stats(Duration stuckThreshold) {
        try {
            return store.getEventStats(info.id(), stuckThreshold);
        } catch (SQLException e) {
            throw new PubSubException("Failed to read stats for topic " + name(), e);
        }
    }

    public int clearStuckEvents(int maxCount, Duration olderThan) {
        try {
            return store.clearStuckEvents(info.id(), maxCount, olderThan);
        } catch (SQLException e) {
            throw new PubSubException("Failed to clear stuck events on topic " + name(), e);
        }
    }

    public List<DeadLetter> deadLetters(int offset, int limit) {
        try {
            return store.listDeadLetters(info.id(), offset, limit);
        } catch (SQLException e) {
            throw new PubSubException("Failed to list dead letters on topic " + name(), e);
        }
    }

    public long deadLetterCount() {
        try {
            return store.deadLetterCount(info.id());
        } catch (SQLException e) {
            throw new PubSubException("Failed to count dead letters on topic " + name(), e);
        }
    }

    public boolean deleteDeadLetter(String idempotencyKey) {
        try {
            return store.deleteDeadLetter(info.id(), idempotencyKey);
        } catch (SQLException e) {
            throw new PubSubException("Failed to delete dead letter " + idempotencyKey, e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (reconciler != null) {
            reconciler.stop();
        }
        try {
            listener.unlisten(info.id());
        } catch (PubSubException e) {
            logger.atWarn().setCause(e).log("Topic {} was not registered with the listener", name());
        }
        int removed;
        lock.writeLock().lock();
        try {
            removed = subscribers.size();
            subscribers.clear();
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            metrics.recordSubscriberRemoved(name(), removed);
        }
        logger.atInfo().log("Topic {} closed", name());
        onClose.accept(this);
    }
}
