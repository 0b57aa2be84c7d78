package com.p14n.pgtopics.data;

/**
 * Lifecycle of a stored event.
 *
 * <p>
 * {@code pending -> active -> (pending | succeeded | failed)}. Only one
 * claimant holds an event in {@code active} at a time.
 * </p>
 */
public enum EventState {

    /** Eligible for claim once any retry delay has elapsed. */
    PENDING,

    /** Claimed and being dispatched. */
    ACTIVE,

    SUCCEEDED,

    /** Retries exhausted. May also have a dead letter. */
    FAILED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static EventState fromDb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event state cannot be null");
        }
        return valueOf(value.toUpperCase());
    }
}
