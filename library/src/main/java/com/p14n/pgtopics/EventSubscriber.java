package com.p14n.pgtopics;

import com.p14n.pgtopics.data.Event;

/**
 * Receives events from a topic.
 *
 * <p>
 * Returning normally completes the event. Throwing {@link DiscardException}
 * drops it. Any other exception fails the event and hands it to the topic's
 * retry and dead letter policy. Delivery is at least once, so subscribers
 * must be idempotent.
 * </p>
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface EventSubscriber<T> {

    void onEvent(Event<T> event) throws Exception;
}
