package com.p14n.pgtopics.broker;

import java.time.Duration;

/**
 * Exponential backoff doubling from {@code min} up to {@code max}. Not thread
 * safe; each loop owns its own instance.
 */
public class Backoff {

    private final Duration min;
    private final Duration max;
    private int attempt;

    public Backoff(Duration min, Duration max) {
        if (min.isNegative() || min.isZero() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 < min <= max");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Returns the next delay and advances the attempt counter.
     */
    public Duration duration() {
        int shift = attempt;
        if (attempt < Integer.MAX_VALUE) {
            attempt++;
        }
        long minMillis = Math.max(1, min.toMillis());
        // largest shift keeping min << shift within max
        int maxShift = 63 - Long.numberOfLeadingZeros(max.toMillis() / minMillis);
        if (shift > maxShift) {
            return max;
        }
        return Duration.ofMillis(minMillis << shift);
    }

    public void reset() {
        attempt = 0;
    }

    public int attempt() {
        return attempt;
    }
}
