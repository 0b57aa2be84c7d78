package com.p14n.pgtopics.db;

import com.p14n.pgtopics.data.DeadLetter;
import com.p14n.pgtopics.data.EventStats;
import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.data.StoredEvent;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.data.TopicInfo;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of topics, events and dead letters.
 *
 * <p>
 * Every operation is atomic. The store is the only arbiter of claim
 * ownership: at most one caller holds a given event in the active state.
 * </p>
 */
public interface EventStore {

    /**
     * Creates the topic, or refreshes the configuration of an existing topic
     * with the same name.
     */
    TopicInfo createOrUpdateTopic(String name, TopicConfig config) throws SQLException;

    Optional<TopicInfo> getTopicByName(String name) throws SQLException;

    /**
     * Inserts a pending event and notifies listeners once committed.
     *
     * @return the store assigned event id
     * @throws com.p14n.pgtopics.DuplicateEventException if the key already
     *                                                   exists in the topic
     */
    long publishEvent(long topicId, String idempotencyKey, byte[] message, byte[] headers) throws SQLException;

    /**
     * As {@link #publishEvent(long, String, byte[], byte[])} but inside the
     * caller's transaction. Nothing is committed here, and the notification is
     * only sent if the caller commits.
     */
    long publishEvent(Connection connection, long topicId, String idempotencyKey, byte[] message, byte[] headers)
            throws SQLException;

    /**
     * Claims the oldest pending event whose retry delay has elapsed, skipping
     * events locked by concurrent claimants.
     *
     * @return the claimed event, now active, or empty if nothing is eligible
     */
    Optional<StoredEvent> claimNextEvent(long topicId) throws SQLException;

    /**
     * @return false if the event was not active
     */
    boolean completeEvent(long eventId) throws SQLException;

    /**
     * Reports a subscriber failure and applies the topic's retry policy.
     *
     * @throws com.p14n.pgtopics.NotFoundException if there is no active event
     *                                             with the id
     */
    FailAction failEvent(long eventId, String errorMessage) throws SQLException;

    /**
     * Deletes an active event without retrying or dead lettering it.
     *
     * @return false if the event was not active
     */
    boolean discardEvent(long eventId) throws SQLException;

    /**
     * Returns an active event to pending without counting an attempt.
     *
     * @return false if the event was not active
     */
    boolean releaseEvent(long eventId) throws SQLException;

    EventStats getEventStats(long topicId, Duration stuckThreshold) throws SQLException;

    /**
     * @return the number of pending events eligible for claim now
     */
    long getPendingEventCount(long topicId) throws SQLException;

    /**
     * @return pending events eligible for claim now, oldest first
     */
    List<StoredEvent> getPendingEvents(long topicId, int limit) throws SQLException;

    /**
     * Returns active events not updated for {@code olderThan} (at least one
     * minute) to pending, oldest first.
     *
     * @return the number of events recovered, at most {@code maxCount}
     */
    int clearStuckEvents(long topicId, int maxCount, Duration olderThan) throws SQLException;

    /**
     * Deletes dead letters older than their topic's maximum age.
     *
     * @return the number of dead letters deleted
     */
    int cleanupOldDeadLetters() throws SQLException;

    /**
     * Removes the dead letter for the key and makes the event pending again
     * with its retry count reset.
     *
     * @throws com.p14n.pgtopics.NotFoundException if the key is not dead lettered
     */
    void retryDeadLetter(long topicId, String idempotencyKey) throws SQLException;

    /**
     * @return newest first
     */
    List<DeadLetter> listDeadLetters(long topicId, int offset, int limit) throws SQLException;

    long deadLetterCount(long topicId) throws SQLException;

    /**
     * Deletes the dead letter for the key. The event stays failed.
     *
     * @return false if the key was not dead lettered
     */
    boolean deleteDeadLetter(long topicId, String idempotencyKey) throws SQLException;
}
