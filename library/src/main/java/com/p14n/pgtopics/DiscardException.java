package com.p14n.pgtopics;

/**
 * Thrown by a subscriber to drop an event.
 *
 * <p>
 * The event is deleted without being retried or dead lettered, so it leaves
 * no trace in the topic's counters. Use it for poison pills and events the
 * application deliberately ignores.
 * </p>
 */
public class DiscardException extends RuntimeException {

    public DiscardException() {
        super("Event discarded", null, false, false);
    }

    public DiscardException(String reason) {
        super(reason, null, false, false);
    }
}
