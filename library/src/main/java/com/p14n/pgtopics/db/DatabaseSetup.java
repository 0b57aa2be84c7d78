package com.p14n.pgtopics.db;

import com.p14n.pgtopics.data.PubSubConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the {@code pubsub} schema: tables, notification and timestamp
 * triggers, and indexes. Every step is idempotent.
 */
public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    /** Trigger refreshing {@code events.last_updated}. Tests disable it to age events. */
    public static final String LAST_UPDATED_TRIGGER = "pubsub_events_last_updated";
    public static final String NOTIFY_TRIGGER = "pubsub_events_notify";

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseSetup(PubSubConfig cfg) {
        this(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }

    public DatabaseSetup(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createTopicsTableIfNotExists();
        createEventsTableIfNotExists();
        createRetriesTableIfNotExists();
        createDeadLettersTableIfNotExists();
        createTriggers();
        createIndexes();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        execute("Schema creation", "CREATE SCHEMA IF NOT EXISTS pubsub");
        return this;
    }

    public DatabaseSetup createTopicsTableIfNotExists() {
        execute("Topics table creation", """
                CREATE TABLE IF NOT EXISTS pubsub.topics (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    name VARCHAR(255) NOT NULL UNIQUE,
                    max_retries BIGINT NOT NULL DEFAULT 0 CHECK (max_retries >= 0),
                    initial_backoff_ms BIGINT NOT NULL DEFAULT 60000 CHECK (initial_backoff_ms > 0),
                    backoff_max_ms BIGINT NOT NULL DEFAULT 300000 CHECK (backoff_max_ms > 0),
                    backoff_multiplier DOUBLE PRECISION NOT NULL DEFAULT 2.0 CHECK (backoff_multiplier >= 1.0),
                    dlq_enabled BOOLEAN NOT NULL DEFAULT false,
                    dlq_max_age_ms BIGINT NOT NULL DEFAULT 604800000 CHECK (dlq_max_age_ms > 0)
                )""");
        return this;
    }

    public DatabaseSetup createEventsTableIfNotExists() {
        execute("Events table creation", """
                CREATE TABLE IF NOT EXISTS pubsub.events (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    last_updated TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    topic_id BIGINT NOT NULL REFERENCES pubsub.topics(id) ON DELETE CASCADE,
                    state VARCHAR(16) NOT NULL DEFAULT 'pending'
                        CHECK (state IN ('pending', 'active', 'succeeded', 'failed')),
                    idempotency_key VARCHAR(255) NOT NULL,
                    message BYTEA NOT NULL CHECK (octet_length(message) < 1048576),
                    headers BYTEA NOT NULL CHECK (octet_length(headers) < 65536),
                    UNIQUE (topic_id, idempotency_key)
                )""");
        return this;
    }

    public DatabaseSetup createRetriesTableIfNotExists() {
        execute("Retries table creation", """
                CREATE TABLE IF NOT EXISTS pubsub.retries (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    event_id BIGINT NOT NULL UNIQUE REFERENCES pubsub.events(id) ON DELETE CASCADE,
                    retry_count BIGINT NOT NULL DEFAULT 0,
                    next_attempt TIMESTAMP WITH TIME ZONE NOT NULL
                )""");
        return this;
    }

    public DatabaseSetup createDeadLettersTableIfNotExists() {
        execute("Dead letters table creation", """
                CREATE TABLE IF NOT EXISTS pubsub.dead_letters (
                    id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    event_id BIGINT NOT NULL UNIQUE REFERENCES pubsub.events(id) ON DELETE CASCADE,
                    topic_id BIGINT NOT NULL REFERENCES pubsub.topics(id) ON DELETE CASCADE,
                    idempotency_key VARCHAR(255) NOT NULL,
                    error_message TEXT NOT NULL
                )""");
        return this;
    }

    /**
     * Inserts, and updates that move an event back to pending, notify
     * {@value SQL#NOTIFY_CHANNEL} with {@code {"id": <event>, "topic": <topic>}}.
     */
    public DatabaseSetup createTriggers() {
        execute("Notify function creation", String.format("""
                CREATE OR REPLACE FUNCTION pubsub.notify_listener() RETURNS TRIGGER AS $$
                BEGIN
                  IF TG_OP = 'INSERT' OR (TG_OP = 'UPDATE' AND NEW.state = 'pending' AND OLD.state <> 'pending') THEN
                    PERFORM pg_notify('%s', json_build_object('id', NEW.id, 'topic', NEW.topic_id)::text);
                  END IF;
                  RETURN NEW;
                END;
                $$ LANGUAGE plpgsql""", SQL.NOTIFY_CHANNEL));
        execute("Notify trigger removal", "DROP TRIGGER IF EXISTS " + NOTIFY_TRIGGER + " ON pubsub.events");
        execute("Notify trigger creation", String.format("""
                CREATE TRIGGER %s
                AFTER INSERT OR UPDATE ON pubsub.events
                FOR EACH ROW EXECUTE PROCEDURE pubsub.notify_listener()""", NOTIFY_TRIGGER));

        execute("Last updated function creation", """
                CREATE OR REPLACE FUNCTION pubsub.update_last_updated() RETURNS TRIGGER AS $$
                BEGIN
                  NEW.last_updated = CURRENT_TIMESTAMP;
                  RETURN NEW;
                END;
                $$ LANGUAGE plpgsql""");
        execute("Last updated trigger removal",
                "DROP TRIGGER IF EXISTS " + LAST_UPDATED_TRIGGER + " ON pubsub.events");
        execute("Last updated trigger creation", String.format("""
                CREATE TRIGGER %s
                BEFORE UPDATE ON pubsub.events
                FOR EACH ROW EXECUTE PROCEDURE pubsub.update_last_updated()""", LAST_UPDATED_TRIGGER));
        return this;
    }

    public DatabaseSetup createIndexes() {
        execute("Event state index creation", """
                CREATE INDEX IF NOT EXISTS idx_pubsub_events_topic_state_created
                    ON pubsub.events(topic_id, state, created_at)""");
        execute("Event last updated index creation", """
                CREATE INDEX IF NOT EXISTS idx_pubsub_events_topic_last_updated
                    ON pubsub.events(topic_id, last_updated)""");
        execute("Retry index creation", """
                CREATE INDEX IF NOT EXISTS idx_pubsub_retries_next_attempt
                    ON pubsub.retries(next_attempt)""");
        execute("Dead letter index creation", """
                CREATE UNIQUE INDEX IF NOT EXISTS idx_pubsub_dead_letters_topic_key
                    ON pubsub.dead_letters(topic_id, idempotency_key)""");
        return this;
    }

    private void execute(String step, String sql) {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute(sql);
            logger.atDebug().log("{} completed successfully", step);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error during {}", step);
            throw new RuntimeException(step + " failed", e);
        }
    }

    private Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

    public static DataSource createPool(PubSubConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        return ds;
    }
}
