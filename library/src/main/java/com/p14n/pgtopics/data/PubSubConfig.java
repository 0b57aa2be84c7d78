package com.p14n.pgtopics.data;

import java.time.Duration;

/**
 * Configuration of a pubsub process: where the store lives and how the
 * background loops are paced.
 */
public interface PubSubConfig {

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }

    /**
     * Baseline period of each topic's backlog scan. Jittered by ±5%.
     */
    default Duration backlogPeriod() {
        return Duration.ofSeconds(5);
    }

    /**
     * Upper bound of the backlog scan delay after repeated failures.
     */
    default Duration backlogMaxBackoff() {
        return Duration.ofSeconds(30);
    }

    /**
     * First delay before the listener reconnects after a connection failure.
     */
    default Duration listenerMinBackoff() {
        return Duration.ofSeconds(5);
    }

    default Duration listenerMaxBackoff() {
        return Duration.ofSeconds(30);
    }

    /**
     * How long a single wait for notifications may block before the listener
     * checks whether it has been closed.
     */
    default Duration listenerPollTimeout() {
        return Duration.ofMillis(500);
    }

    /**
     * Period of the stuck event and dead letter cleanup sweep.
     */
    default Duration maintenancePeriod() {
        return Duration.ofMinutes(1);
    }

    /**
     * Active events not updated for this long are considered stuck.
     */
    default Duration stuckThreshold() {
        return Duration.ofMinutes(5);
    }

    /**
     * Maximum number of stuck events recovered per topic per sweep.
     */
    default int stuckBatchSize() {
        return 100;
    }
}
