package com.p14n.pgtopics.policy;

import com.p14n.pgtopics.data.FailAction;

import java.time.Duration;

/**
 * Outcome of {@link RetryPolicy#decide}.
 *
 * @param action     what happens to the event
 * @param retryDelay delay before the next attempt, zero unless retrying
 */
public record FailDecision(FailAction action, Duration retryDelay) {

    static FailDecision retryAfter(Duration delay) {
        return new FailDecision(FailAction.RETRYING, delay);
    }

    static FailDecision deadLetter() {
        return new FailDecision(FailAction.DEAD_LETTERED, Duration.ZERO);
    }

    static FailDecision fail() {
        return new FailDecision(FailAction.FAILED, Duration.ZERO);
    }
}
