package com.p14n.pgtopics.data;

import java.time.Instant;

/**
 * An event row in {@code pubsub.events}.
 *
 * @param id             store assigned, monotonic
 * @param topicId        owning topic
 * @param idempotencyKey the event id supplied at publish time
 * @param state          lifecycle state
 * @param message        serialized envelope
 * @param headers        serialized headers
 * @param created        insert time
 * @param lastUpdated    time of the last state change
 */
public record StoredEvent(long id,
                          long topicId,
                          String idempotencyKey,
                          EventState state,
                          byte[] message,
                          byte[] headers,
                          Instant created,
                          Instant lastUpdated) {
}
