package com.p14n.pgtopics.data;

import java.time.Duration;

/**
 * Retry and dead letter configuration of a topic.
 *
 * <p>
 * The configuration is written to the store every time a topic is created,
 * so the latest process to start a topic wins.
 * </p>
 *
 * @param maxRetries        maximum number of retries for failed events, 0
 *                          disables retries
 * @param initialBackoff    delay before the first retry
 * @param maxBackoff        upper bound of the retry delay
 * @param backoffMultiplier factor applied to the delay for every retry
 * @param deadLetterEnabled whether exhausted events are dead lettered
 * @param deadLetterMaxAge  how long dead letters are kept before cleanup
 */
public record TopicConfig(int maxRetries,
                          Duration initialBackoff,
                          Duration maxBackoff,
                          double backoffMultiplier,
                          boolean deadLetterEnabled,
                          Duration deadLetterMaxAge) {

    public TopicConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        requirePositive(initialBackoff, "initialBackoff");
        requirePositive(maxBackoff, "maxBackoff");
        requirePositive(deadLetterMaxAge, "deadLetterMaxAge");
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
    }

    /**
     * No retries, 5s to 15s backoff with a 1.2 multiplier, dead letters
     * disabled and kept for 120 hours once enabled.
     */
    public static TopicConfig defaults() {
        return new TopicConfig(0, Duration.ofSeconds(5), Duration.ofSeconds(15), 1.2, false, Duration.ofHours(120));
    }

    public TopicConfig withRetries(int retries) {
        return new TopicConfig(retries, initialBackoff, maxBackoff, backoffMultiplier, deadLetterEnabled,
                deadLetterMaxAge);
    }

    public TopicConfig withBackoff(Duration initial, Duration max, double multiplier) {
        return new TopicConfig(maxRetries, initial, max, multiplier, deadLetterEnabled, deadLetterMaxAge);
    }

    public TopicConfig withDeadLetters(boolean enabled) {
        return new TopicConfig(maxRetries, initialBackoff, maxBackoff, backoffMultiplier, enabled, deadLetterMaxAge);
    }

    public TopicConfig withDeadLetters(boolean enabled, Duration maxAge) {
        return new TopicConfig(maxRetries, initialBackoff, maxBackoff, backoffMultiplier, enabled, maxAge);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
