package com.p14n.pgtopics;

/**
 * Base class of the errors raised by topics, the listener and the event store.
 */
public class PubSubException extends RuntimeException {

    public PubSubException(String message) {
        super(message);
    }

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
