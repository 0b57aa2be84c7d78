package com.p14n.pgtopics.data;

import com.p14n.pgtopics.Topic;

import java.time.Instant;
import java.util.UUID;

/**
 * A typed event published to a topic.
 *
 * <p>
 * The envelope follows the CloudEvents attribute names. {@code id} is the
 * idempotency key of the event: it must be unique within a topic, and a second
 * publish with the same id is rejected by the store.
 * </p>
 *
 * @param id      idempotency key
 * @param source  where the event was created, usually {@code Class.method}
 * @param type    fully qualified payload type name
 * @param time    creation time
 * @param payload the application payload
 * @param <T>     payload type
 */
public record Event<T>(String id,
                       String source,
                       String type,
                       Instant time,
                       T payload) {

    public Event {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalArgumentException("source cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("type cannot be null or empty");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * Wraps a payload in a new event.
     * If the payload implements {@link EventPayload} its id is used as the
     * idempotency key, otherwise a unique id prefixed with the payload type is
     * generated.
     *
     * @param payload the payload
     * @param <T>     payload type
     * @return a new event stamped with the current time
     */
    public static <T> Event<T> of(T payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        String id = payload instanceof EventPayload ep
                ? ep.eventId()
                : newId(payload.getClass());
        return new Event<>(id, callerSource(), payload.getClass().getName(), Instant.now(), payload);
    }

    /**
     * Generates a unique id for the given payload type, eg.
     * {@code user_created_1b4e28ba-2fa1-11d2-883f-0016d3cca427}.
     */
    public static String newId(Class<?> type) {
        return TopicNames.of(type) + "_" + UUID.randomUUID();
    }

    private static String callerSource() {
        return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
                .walk(frames -> frames
                        .filter(f -> f.getDeclaringClass() != Event.class
                                && !Topic.class.isAssignableFrom(f.getDeclaringClass()))
                        .findFirst()
                        .map(f -> f.getClassName() + "." + f.getMethodName())
                        .orElse("unknown"));
    }
}
