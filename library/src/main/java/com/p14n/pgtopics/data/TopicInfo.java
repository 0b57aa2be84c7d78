package com.p14n.pgtopics.data;

import java.time.Instant;

/**
 * A topic as stored in {@code pubsub.topics}.
 *
 * @param id      store assigned identifier, carried in notifications
 * @param name    unique topic name
 * @param config  retry and dead letter configuration
 * @param created creation time
 */
public record TopicInfo(long id, String name, TopicConfig config, Instant created) {
}
