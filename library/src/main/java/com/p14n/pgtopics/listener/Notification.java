package com.p14n.pgtopics.listener;

/**
 * Payload of a {@code pubsub_listener} notification: an event became
 * claimable.
 *
 * @param id    event id
 * @param topic topic id
 */
public record Notification(long id, long topic) {
}
