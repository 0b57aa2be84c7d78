package com.p14n.pgtopics.db;

import com.p14n.pgtopics.data.DeadLetter;
import com.p14n.pgtopics.data.EventState;
import com.p14n.pgtopics.data.StoredEvent;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SQL {

    private static final Logger logger = LoggerFactory.getLogger(SQL.class);

    /** Channel the event triggers notify and the listener listens on. */
    public static final String NOTIFY_CHANNEL = "pubsub_listener";

    public static final String EVENT_COLS = "id, topic_id, idempotency_key, state, message, headers, created_at, last_updated";
    public static final String TOPIC_COLS = "id, name, created_at, max_retries, initial_backoff_ms, backoff_max_ms, "
            + "backoff_multiplier, dlq_enabled, dlq_max_age_ms";
    public static final String DEAD_LETTER_COLS = "id, event_id, topic_id, idempotency_key, error_message, created_at";

    /** SQLSTATE of unique_violation. */
    static final String UNIQUE_VIOLATION = "23505";

    private SQL() {
    }

    public static StoredEvent eventFromResultSet(ResultSet rs) throws SQLException {
        return new StoredEvent(
                rs.getLong("id"),
                rs.getLong("topic_id"),
                rs.getString("idempotency_key"),
                EventState.fromDb(rs.getString("state")),
                rs.getBytes("message"),
                rs.getBytes("headers"),
                instant(rs, "created_at"),
                instant(rs, "last_updated"));
    }

    public static TopicInfo topicFromResultSet(ResultSet rs) throws SQLException {
        return new TopicInfo(
                rs.getLong("id"),
                rs.getString("name"),
                new TopicConfig(
                        rs.getInt("max_retries"),
                        Duration.ofMillis(rs.getLong("initial_backoff_ms")),
                        Duration.ofMillis(rs.getLong("backoff_max_ms")),
                        rs.getDouble("backoff_multiplier"),
                        rs.getBoolean("dlq_enabled"),
                        Duration.ofMillis(rs.getLong("dlq_max_age_ms"))),
                instant(rs, "created_at"));
    }

    public static DeadLetter deadLetterFromResultSet(ResultSet rs) throws SQLException {
        return new DeadLetter(
                rs.getLong("id"),
                rs.getLong("event_id"),
                rs.getLong("topic_id"),
                rs.getString("idempotency_key"),
                rs.getString("error_message"),
                instant(rs, "created_at"));
    }

    public static void setTopicConfigOnStatement(PreparedStatement stmt, int offset, TopicConfig config)
            throws SQLException {
        stmt.setLong(offset, config.maxRetries());
        stmt.setLong(offset + 1, config.initialBackoff().toMillis());
        stmt.setLong(offset + 2, config.maxBackoff().toMillis());
        stmt.setDouble(offset + 3, config.backoffMultiplier());
        stmt.setBoolean(offset + 4, config.deadLetterEnabled());
        stmt.setLong(offset + 5, config.deadLetterMaxAge().toMillis());
    }

    /**
     * Durations are bound as fractional seconds for {@code make_interval(secs => ?)}.
     */
    public static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }

    public static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    public static void closeConnection(Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.close();
                }
            } catch (SQLException closeEx) {
                logger.atDebug().setCause(closeEx).log("Error closing connection");
            }
        }
    }

    public static void rollback(Exception e, Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.rollback();
                }
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
        }
    }

}
