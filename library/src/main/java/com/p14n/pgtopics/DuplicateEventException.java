package com.p14n.pgtopics;

/**
 * An event with the same idempotency key already exists in the topic.
 */
public class DuplicateEventException extends PubSubException {

    private final String idempotencyKey;

    public DuplicateEventException(String idempotencyKey, Throwable cause) {
        super("Event " + idempotencyKey + " already published", cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
