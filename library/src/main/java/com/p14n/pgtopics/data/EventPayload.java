package com.p14n.pgtopics.data;

/**
 * May be implemented by a payload to supply its own idempotency key.
 *
 * <p>
 * Retried publishes of the same payload then collide on the key instead of
 * creating a second event.
 * </p>
 */
public interface EventPayload {

    /**
     * @return the unique identifier of the event within its topic
     */
    String eventId();
}
