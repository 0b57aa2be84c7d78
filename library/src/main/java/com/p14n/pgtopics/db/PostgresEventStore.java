package com.p14n.pgtopics.db;

import com.p14n.pgtopics.DuplicateEventException;
import com.p14n.pgtopics.NotFoundException;
import com.p14n.pgtopics.data.DeadLetter;
import com.p14n.pgtopics.data.EventState;
import com.p14n.pgtopics.data.EventStats;
import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.data.StoredEvent;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;
import com.p14n.pgtopics.policy.FailDecision;
import com.p14n.pgtopics.policy.RetryPolicy;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link EventStore} backed by the {@code pubsub} schema created by
 * {@link DatabaseSetup}.
 *
 * <p>
 * Claims use {@code FOR UPDATE SKIP LOCKED}, so any number of processes may
 * claim from the same topic concurrently without blocking each other or
 * double delivering.
 * </p>
 *
 * <pre>{@code
 * EventStore store = new PostgresEventStore(dataSource);
 * TopicInfo topic = store.createOrUpdateTopic("orders", TopicConfig.defaults());
 * store.publishEvent(topic.id(), "order-1", message, headers);
 * store.claimNextEvent(topic.id()).ifPresent(e -> ...);
 * }</pre>
 */
public class PostgresEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(PostgresEventStore.class);

    private static final String UNKNOWN_ERROR = "unknown error";

    /** Pending events with no retry delay outstanding. */
    private static final String ELIGIBLE = """
            e.topic_id = ? AND e.state = 'pending'
            AND NOT EXISTS (SELECT 1 FROM pubsub.retries r
                            WHERE r.event_id = e.id AND r.next_attempt > CURRENT_TIMESTAMP)""";

    private final DataSource dataSource;

    public PostgresEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @FunctionalInterface
    private interface TxWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(TxWork<T> work) throws SQLException {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            T result = work.apply(conn);
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            SQL.rollback(e, conn);
            throw e;
        } finally {
            SQL.closeConnection(conn);
        }
    }

    @Override
    public TopicInfo createOrUpdateTopic(String name, TopicConfig config) throws SQLException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Topic name cannot be null or empty");
        }
        String sql = """
                INSERT INTO pubsub.topics (name, max_retries, initial_backoff_ms, backoff_max_ms,
                    backoff_multiplier, dlq_enabled, dlq_max_age_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (name) DO UPDATE SET
                    max_retries = EXCLUDED.max_retries,
                    initial_backoff_ms = EXCLUDED.initial_backoff_ms,
                    backoff_max_ms = EXCLUDED.backoff_max_ms,
                    backoff_multiplier = EXCLUDED.backoff_multiplier,
                    dlq_enabled = EXCLUDED.dlq_enabled,
                    dlq_max_age_ms = EXCLUDED.dlq_max_age_ms""" + " RETURNING " + SQL.TOPIC_COLS;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            SQL.setTopicConfigOnStatement(stmt, 2, config);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                TopicInfo topic = SQL.topicFromResultSet(rs);
                logger.atDebug().log("Topic {} registered with id {}", name, topic.id());
                return topic;
            }
        }
    }

    @Override
    public Optional<TopicInfo> getTopicByName(String name) throws SQLException {
        String sql = "SELECT " + SQL.TOPIC_COLS + " FROM pubsub.topics WHERE name = ?";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(SQL.topicFromResultSet(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public long publishEvent(long topicId, String idempotencyKey, byte[] message, byte[] headers)
            throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return publishEvent(conn, topicId, idempotencyKey, message, headers);
        }
    }

    @Override
    public long publishEvent(Connection connection, long topicId, String idempotencyKey, byte[] message,
            byte[] headers) throws SQLException {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or empty");
        }
        String sql = """
                INSERT INTO pubsub.events (topic_id, idempotency_key, message, headers)
                VALUES (?, ?, ?, ?)
                RETURNING id""";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            stmt.setString(2, idempotencyKey);
            stmt.setBytes(3, message);
            stmt.setBytes(4, headers == null ? new byte[0] : headers);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            if (SQL.isUniqueViolation(e)) {
                throw new DuplicateEventException(idempotencyKey, e);
            }
            throw e;
        }
    }

    @Override
    public Optional<StoredEvent> claimNextEvent(long topicId) throws SQLException {
        String sql = "UPDATE pubsub.events SET state = 'active' WHERE id = ("
                + "SELECT e.id FROM pubsub.events e WHERE " + ELIGIBLE
                + " ORDER BY e.created_at, e.id LIMIT 1 FOR UPDATE SKIP LOCKED"
                + ") AND state = 'pending' RETURNING " + SQL.EVENT_COLS;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    StoredEvent event = SQL.eventFromResultSet(rs);
                    logger.atDebug().log("Claimed event {} on topic {}", event.id(), topicId);
                    return Optional.of(event);
                }
                return Optional.empty();
            }
        }
    }

    @Override
    public boolean completeEvent(long eventId) throws SQLException {
        return inTransaction(conn -> {
            deleteRetry(conn, eventId);
            return transition(conn, eventId, EventState.ACTIVE, EventState.SUCCEEDED);
        });
    }

    @Override
    public FailAction failEvent(long eventId, String errorMessage) throws SQLException {
        String error = errorMessage == null || errorMessage.isBlank() ? UNKNOWN_ERROR : errorMessage;
        String lookup = """
                SELECT e.topic_id, e.idempotency_key, e.state, t.max_retries, t.initial_backoff_ms,
                       t.backoff_max_ms, t.backoff_multiplier, t.dlq_enabled, t.dlq_max_age_ms,
                       COALESCE(r.retry_count, 0) AS retry_count
                FROM pubsub.events e
                JOIN pubsub.topics t ON t.id = e.topic_id
                LEFT JOIN pubsub.retries r ON r.event_id = e.id
                WHERE e.id = ?
                FOR UPDATE OF e""";

        return inTransaction(conn -> {
            long topicId;
            String key;
            TopicConfig config;
            long attempts;
            try (PreparedStatement stmt = conn.prepareStatement(lookup)) {
                stmt.setLong(1, eventId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next() || EventState.fromDb(rs.getString("state")) != EventState.ACTIVE) {
                        throw new NotFoundException("Active event " + eventId + " not found");
                    }
                    topicId = rs.getLong("topic_id");
                    key = rs.getString("idempotency_key");
                    config = new TopicConfig(
                            rs.getInt("max_retries"),
                            Duration.ofMillis(rs.getLong("initial_backoff_ms")),
                            Duration.ofMillis(rs.getLong("backoff_max_ms")),
                            rs.getDouble("backoff_multiplier"),
                            rs.getBoolean("dlq_enabled"),
                            Duration.ofMillis(rs.getLong("dlq_max_age_ms")));
                    attempts = rs.getLong("retry_count");
                }
            }

            FailDecision decision = RetryPolicy.decide(config, attempts);
            switch (decision.action()) {
                case RETRYING -> {
                    scheduleRetry(conn, eventId, decision.retryDelay());
                    transition(conn, eventId, EventState.ACTIVE, EventState.PENDING);
                }
                case DEAD_LETTERED -> {
                    insertDeadLetter(conn, eventId, topicId, key, error);
                    deleteRetry(conn, eventId);
                    transition(conn, eventId, EventState.ACTIVE, EventState.FAILED);
                }
                case FAILED -> {
                    deleteRetry(conn, eventId);
                    transition(conn, eventId, EventState.ACTIVE, EventState.FAILED);
                }
            }
            logger.atDebug().log("Event {} on topic {} failed after {} retries: {}, {}",
                    eventId, topicId, attempts, decision.action().dbValue(), error);
            return decision.action();
        });
    }

    private void scheduleRetry(Connection conn, long eventId, Duration delay) throws SQLException {
        String sql = """
                INSERT INTO pubsub.retries (event_id, retry_count, next_attempt)
                VALUES (?, 1, CURRENT_TIMESTAMP + make_interval(secs => ?))
                ON CONFLICT (event_id) DO UPDATE SET
                    retry_count = pubsub.retries.retry_count + 1,
                    next_attempt = EXCLUDED.next_attempt""";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, eventId);
            stmt.setDouble(2, SQL.seconds(delay));
            stmt.executeUpdate();
        }
    }

    private void insertDeadLetter(Connection conn, long eventId, long topicId, String key, String error)
            throws SQLException {
        String sql = """
                INSERT INTO pubsub.dead_letters (event_id, topic_id, idempotency_key, error_message)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (event_id) DO UPDATE SET
                    error_message = EXCLUDED.error_message,
                    created_at = CURRENT_TIMESTAMP""";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, eventId);
            stmt.setLong(2, topicId);
            stmt.setString(3, key);
            stmt.setString(4, error);
            stmt.executeUpdate();
        }
    }

    private void deleteRetry(Connection conn, long eventId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM pubsub.retries WHERE event_id = ?")) {
            stmt.setLong(1, eventId);
            stmt.executeUpdate();
        }
    }

    private boolean transition(Connection conn, long eventId, EventState from, EventState to)
            throws SQLException {
        String sql = "UPDATE pubsub.events SET state = ? WHERE id = ? AND state = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, to.dbValue());
            stmt.setLong(2, eventId);
            stmt.setString(3, from.dbValue());
            return stmt.executeUpdate() == 1;
        }
    }

    @Override
    public boolean discardEvent(long eventId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "DELETE FROM pubsub.events WHERE id = ? AND state = 'active'")) {
            stmt.setLong(1, eventId);
            return stmt.executeUpdate() == 1;
        }
    }

    @Override
    public boolean releaseEvent(long eventId) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return transition(conn, eventId, EventState.ACTIVE, EventState.PENDING);
        }
    }

    @Override
    public EventStats getEventStats(long topicId, Duration stuckThreshold) throws SQLException {
        String sql = """
                SELECT
                    COUNT(*) FILTER (WHERE e.state = 'pending') AS pending,
                    COUNT(*) FILTER (WHERE e.state = 'pending' AND r.event_id IS NOT NULL) AS retrying,
                    COUNT(*) FILTER (WHERE e.state = 'active') AS active,
                    COUNT(*) FILTER (WHERE e.state = 'succeeded') AS succeeded,
                    COUNT(*) FILTER (WHERE e.state = 'failed') AS failed,
                    COUNT(*) FILTER (WHERE e.state = 'active'
                        AND e.last_updated < CURRENT_TIMESTAMP - make_interval(secs => ?)) AS stuck,
                    COUNT(d.id) AS dead_letters
                FROM pubsub.events e
                LEFT JOIN pubsub.retries r ON r.event_id = e.id
                LEFT JOIN pubsub.dead_letters d ON d.event_id = e.id
                WHERE e.topic_id = ?""";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setDouble(1, SQL.seconds(stuckThreshold));
            stmt.setLong(2, topicId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return new EventStats(
                        rs.getLong("pending"),
                        rs.getLong("retrying"),
                        rs.getLong("active"),
                        rs.getLong("succeeded"),
                        rs.getLong("failed"),
                        rs.getLong("stuck"),
                        rs.getLong("dead_letters"));
            }
        }
    }

    @Override
    public long getPendingEventCount(long topicId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM pubsub.events e WHERE " + ELIGIBLE;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public List<StoredEvent> getPendingEvents(long topicId, int limit) throws SQLException {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be greater than zero");
        }
        String sql = "SELECT " + prefixed("e", SQL.EVENT_COLS) + " FROM pubsub.events e WHERE " + ELIGIBLE
                + " ORDER BY e.created_at, e.id LIMIT ?";
        List<StoredEvent> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(SQL.eventFromResultSet(rs));
                }
            }
        }
        return events;
    }

    @Override
    public int clearStuckEvents(long topicId, int maxCount, Duration olderThan) throws SQLException {
        if (maxCount <= 0) {
            return 0;
        }
        String sql = """
                UPDATE pubsub.events SET state = 'pending'
                WHERE id IN (
                    SELECT id FROM pubsub.events
                    WHERE topic_id = ? AND state = 'active'
                    AND last_updated < CURRENT_TIMESTAMP
                        - GREATEST(make_interval(secs => ?), INTERVAL '1 minute')
                    ORDER BY last_updated, id
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED)
                AND state = 'active'""";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            stmt.setDouble(2, SQL.seconds(olderThan));
            stmt.setInt(3, maxCount);
            int cleared = stmt.executeUpdate();
            if (cleared > 0) {
                logger.atInfo().log("Returned {} stuck events to pending on topic {}", cleared, topicId);
            }
            return cleared;
        }
    }

    @Override
    public int cleanupOldDeadLetters() throws SQLException {
        String sql = """
                DELETE FROM pubsub.dead_letters d
                USING pubsub.topics t
                WHERE d.topic_id = t.id
                AND d.created_at < CURRENT_TIMESTAMP - make_interval(secs => t.dlq_max_age_ms / 1000.0)""";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                logger.atInfo().log("Deleted {} expired dead letters", deleted);
            }
            return deleted;
        }
    }

    @Override
    public void retryDeadLetter(long topicId, String idempotencyKey) throws SQLException {
        inTransaction(conn -> {
            long eventId;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM pubsub.dead_letters WHERE topic_id = ? AND idempotency_key = ? RETURNING event_id")) {
                stmt.setLong(1, topicId);
                stmt.setString(2, idempotencyKey);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new NotFoundException(String.format(
                                "Dead letter %s not found or not in dead letter queue", idempotencyKey));
                    }
                    eventId = rs.getLong(1);
                }
            }
            deleteRetry(conn, eventId);
            transition(conn, eventId, EventState.FAILED, EventState.PENDING);
            logger.atInfo().log("Dead letter {} on topic {} requeued as event {}", idempotencyKey, topicId,
                    eventId);
            return null;
        });
    }

    @Override
    public List<DeadLetter> listDeadLetters(long topicId, int offset, int limit) throws SQLException {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("Offset must be non negative and limit greater than zero");
        }
        String sql = "SELECT " + SQL.DEAD_LETTER_COLS + " FROM pubsub.dead_letters WHERE topic_id = ?"
                + " ORDER BY created_at DESC, id DESC OFFSET ? LIMIT ?";
        List<DeadLetter> letters = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, topicId);
            stmt.setInt(2, offset);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    letters.add(SQL.deadLetterFromResultSet(rs));
                }
            }
        }
        return letters;
    }

    @Override
    public long deadLetterCount(long topicId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "SELECT COUNT(*) FROM pubsub.dead_letters WHERE topic_id = ?")) {
            stmt.setLong(1, topicId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public boolean deleteDeadLetter(long topicId, String idempotencyKey) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "DELETE FROM pubsub.dead_letters WHERE topic_id = ? AND idempotency_key = ?")) {
            stmt.setLong(1, topicId);
            stmt.setString(2, idempotencyKey);
            return stmt.executeUpdate() == 1;
        }
    }

    private static String prefixed(String alias, String cols) {
        StringBuilder sb = new StringBuilder();
        for (String col : cols.split(",")) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(alias).append('.').append(col.trim());
        }
        return sb.toString();
    }
}
