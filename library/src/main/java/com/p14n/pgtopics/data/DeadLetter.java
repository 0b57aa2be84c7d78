package com.p14n.pgtopics.data;

import java.time.Instant;

/**
 * An event that exhausted its retries on a topic with dead letters enabled.
 *
 * @param id             dead letter row id
 * @param eventId        the failed event
 * @param topicId        topic of the failed event
 * @param idempotencyKey key of the failed event, used for operator retries
 * @param errorMessage   the last subscriber error
 * @param created        when the event was dead lettered
 */
public record DeadLetter(long id,
                         long eventId,
                         long topicId,
                         String idempotencyKey,
                         String errorMessage,
                         Instant created) {
}
