package com.p14n.pgtopics.policy;

import com.p14n.pgtopics.data.TopicConfig;

import java.time.Duration;

/**
 * Classifies a failed delivery as a retry, a dead letter or a terminal
 * failure.
 *
 * <table>
 * <caption>Decision table</caption>
 * <tr><th>Condition</th><th>Decision</th></tr>
 * <tr><td>{@code attempts < maxRetries}</td><td>retry after
 * {@code min(initialBackoff * multiplier^attempts, maxBackoff)}</td></tr>
 * <tr><td>exhausted, dead letters enabled</td><td>dead letter</td></tr>
 * <tr><td>exhausted, dead letters disabled</td><td>fail</td></tr>
 * </table>
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    /**
     * @param config   the topic configuration
     * @param attempts retries already scheduled for the event, 0 on the first
     *                 failure
     * @return the decision
     */
    public static FailDecision decide(TopicConfig config, long attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative");
        }
        if (config.maxRetries() > 0 && attempts < config.maxRetries()) {
            return FailDecision.retryAfter(backoff(config, attempts));
        }
        if (config.deadLetterEnabled()) {
            return FailDecision.deadLetter();
        }
        return FailDecision.fail();
    }

    /**
     * Delay before retry number {@code attempts + 1}.
     */
    public static Duration backoff(TopicConfig config, long attempts) {
        double initial = config.initialBackoff().toMillis();
        double max = config.maxBackoff().toMillis();
        double delay = initial * Math.pow(config.backoffMultiplier(), attempts);
        // pow overflows to infinity for large attempt counts
        if (Double.isInfinite(delay) || Double.isNaN(delay) || delay > max) {
            delay = max;
        }
        return Duration.ofMillis((long) delay);
    }
}
