package com.p14n.pgtopics.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.pgtopics.DuplicateListenerException;
import com.p14n.pgtopics.NotFoundException;
import com.p14n.pgtopics.PubSubException;
import com.p14n.pgtopics.broker.Backoff;
import com.p14n.pgtopics.data.PubSubConfig;
import com.p14n.pgtopics.db.SQL;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Receives event notifications on a dedicated connection and routes them to
 * the callback registered for the event's topic.
 *
 * <p>
 * One listener serves every topic of a process. It owns one connection that
 * has issued {@code LISTEN pubsub_listener} and one thread that polls it. When
 * the connection fails the listener reconnects with an exponential backoff.
 * Notifications sent while disconnected are lost; the topics' backlog scans
 * pick up those events.
 * </p>
 *
 * <pre>{@code
 * Listener listener = new Listener(dataSource, config);
 * listener.listen(topic.id(), n -> System.out.println("event " + n.id()));
 * listener.start();
 * }</pre>
 */
public class Listener implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Listener.class);

    private final DataSource dataSource;
    private final Duration pollTimeout;
    private final Backoff backoff;
    private final ObjectMapper mapper = new ObjectMapper();

    private final Map<Long, ListenerCallback> callbacks = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Connection connection;
    private Thread thread;

    public Listener(DataSource dataSource, PubSubConfig config) {
        this.dataSource = dataSource;
        this.pollTimeout = config.listenerPollTimeout();
        this.backoff = new Backoff(config.listenerMinBackoff(), config.listenerMaxBackoff());
    }

    /**
     * Registers the callback for a topic.
     *
     * @throws DuplicateListenerException if the topic already has a callback
     */
    public void listen(long topicId, ListenerCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Callback cannot be null");
        }
        lock.lock();
        try {
            if (callbacks.containsKey(topicId)) {
                throw new DuplicateListenerException(topicId);
            }
            callbacks.put(topicId, callback);
        } finally {
            lock.unlock();
        }
        logger.atDebug().log("Listening for topic {}", topicId);
    }

    /**
     * @throws NotFoundException if the topic has no callback
     */
    public void unlisten(long topicId) {
        lock.lock();
        try {
            if (callbacks.remove(topicId) == null) {
                throw new NotFoundException("No listener registered for topic " + topicId);
            }
        } finally {
            lock.unlock();
        }
        logger.atDebug().log("Stopped listening for topic {}", topicId);
    }

    /**
     * Connects, issues {@code LISTEN} and starts the polling thread.
     *
     * @throws PubSubException if the first connection cannot be made
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Listener is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Listener already started");
        }
        try {
            connect();
        } catch (SQLException e) {
            started.set(false);
            throw new PubSubException("Failed to start listener", e);
        }
        thread = new ThreadFactoryBuilder()
                .setNameFormat("pgtopics-listener-%d")
                .setDaemon(true)
                .build()
                .newThread(this::run);
        thread.start();
        logger.atInfo().log("Listener started on channel {}", SQL.NOTIFY_CHANNEL);
    }

    private void connect() throws SQLException {
        Connection conn = dataSource.getConnection();
        try (Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(true);
            stmt.execute("LISTEN " + SQL.NOTIFY_CHANNEL);
        } catch (SQLException e) {
            SQL.closeConnection(conn);
            throw e;
        }
        connection = conn;
        if (closed.get()) {
            SQL.closeConnection(conn);
            connection = null;
            throw new SQLException("Listener closed while connecting");
        }
    }

    private void run() {
        while (!closed.get()) {
            try {
                Connection conn = connection;
                if (conn == null) {
                    connect();
                    conn = connection;
                    logger.atInfo().log("Listener reconnected");
                }
                PGNotification[] notifications = conn.unwrap(PGConnection.class)
                        .getNotifications((int) pollTimeout.toMillis());
                backoff.reset();
                if (notifications != null) {
                    for (PGNotification n : notifications) {
                        if (SQL.NOTIFY_CHANNEL.equals(n.getName())) {
                            handlePayload(n.getParameter());
                        }
                    }
                }
            } catch (SQLException e) {
                if (closed.get()) {
                    break;
                }
                SQL.closeConnection(connection);
                connection = null;
                Duration wait = backoff.duration();
                logger.atWarn().setCause(e).log("Listener connection failed, reconnecting in {}", wait);
                try {
                    TimeUnit.MILLISECONDS.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.atDebug().log("Listener thread exiting");
    }

    /**
     * Parses a notification payload and invokes the topic's callback.
     * Malformed payloads and unknown topics are logged and skipped.
     */
    void handlePayload(String payload) {
        Notification notification;
        try {
            notification = parse(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.atWarn().setCause(e).log("Ignoring malformed notification {}", payload);
            return;
        }

        ListenerCallback callback;
        lock.lock();
        try {
            callback = callbacks.get(notification.topic());
        } finally {
            lock.unlock();
        }
        if (callback == null) {
            logger.atDebug().log("No listener for topic {}, ignoring event {}", notification.topic(),
                    notification.id());
            return;
        }

        try {
            callback.onNotification(notification);
        } catch (Exception e) {
            logger.atError().setCause(e).log("Listener callback failed for topic {}", notification.topic());
        }
    }

    private Notification parse(String payload) throws JsonProcessingException {
        if (payload == null) {
            throw new IllegalArgumentException("Empty payload");
        }
        JsonNode node = mapper.readTree(payload);
        JsonNode id = node.get("id");
        JsonNode topic = node.get("topic");
        if (id == null || topic == null || !id.canConvertToLong() || !topic.canConvertToLong()) {
            throw new IllegalArgumentException("Notification requires numeric id and topic");
        }
        return new Notification(id.asLong(), topic.asLong());
    }

    public boolean isRunning() {
        return started.get() && !closed.get() && thread != null && thread.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (thread != null) {
            thread.interrupt();
        }
        SQL.closeConnection(connection);
        connection = null;
        logger.atInfo().log("Listener closed");
    }
}
