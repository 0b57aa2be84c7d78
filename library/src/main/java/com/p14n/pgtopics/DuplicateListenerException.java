package com.p14n.pgtopics;

/**
 * A callback is already registered with the listener for the topic.
 */
public class DuplicateListenerException extends PubSubException {

    public DuplicateListenerException(long topicId) {
        super("Listener already registered for topic " + topicId);
    }
}
