package com.p14n.pgtopics;

import com.p14n.pgtopics.data.Event;

/**
 * A named, typed channel of events.
 *
 * <p>
 * Each event is delivered to exactly one of the topic's subscribers, chosen
 * at random. It is not a broadcast.
 * </p>
 *
 * @param <T> payload type
 */
public interface Topic<T> extends AutoCloseable {

    /**
     * Publishes a payload wrapped in a new {@link Event}.
     *
     * @param payload the payload
     * @throws DuplicateEventException if the payload's id was already published
     */
    default void publish(T payload) {
        publish(Event.of(payload));
    }

    /**
     * Publishes an event.
     *
     * @param event the event
     * @throws DuplicateEventException if the event id was already published
     */
    void publish(Event<T> event);

    /**
     * Adds a subscriber.
     *
     * @param subscriber the subscriber
     * @throws IllegalStateException if the topic is closed
     */
    void subscribe(EventSubscriber<T> subscriber);

    /**
     * @return the topic name
     */
    String name();

    /**
     * Stops delivery to this process. Events already being dispatched are not
     * waited for.
     */
    @Override
    void close();
}
