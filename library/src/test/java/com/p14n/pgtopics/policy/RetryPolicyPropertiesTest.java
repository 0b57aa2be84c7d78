package com.p14n.pgtopics.policy;

import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.data.TopicConfig;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyPropertiesTest {

    @Property
    void backoffNeverDecreasesAndStaysWithinBounds(
            @ForAll @LongRange(min = 1, max = 60_000) long initialMs,
            @ForAll @LongRange(min = 1, max = 600_000) long maxMs,
            @ForAll @DoubleRange(min = 1.0, max = 10.0) double multiplier,
            @ForAll @IntRange(min = 0, max = 200) int attempts) {

        TopicConfig config = TopicConfig.defaults()
                .withBackoff(Duration.ofMillis(initialMs), Duration.ofMillis(maxMs), multiplier);

        Duration current = RetryPolicy.backoff(config, attempts);
        Duration next = RetryPolicy.backoff(config, attempts + 1);

        assertTrue(next.compareTo(current) >= 0, "backoff decreased");
        assertTrue(current.toMillis() <= maxMs, "backoff above maximum");
        assertTrue(current.toMillis() >= Math.min(initialMs, maxMs), "backoff below initial");
    }

    @Property
    void retriesExactlyMaxRetriesTimes(
            @ForAll @IntRange(min = 0, max = 50) int maxRetries,
            @ForAll boolean deadLetters) {

        TopicConfig config = TopicConfig.defaults().withRetries(maxRetries).withDeadLetters(deadLetters);

        int retries = 0;
        FailDecision decision;
        long attempts = 0;
        while ((decision = RetryPolicy.decide(config, attempts)).action() == FailAction.RETRYING) {
            retries++;
            attempts++;
        }

        assertEquals(maxRetries, retries);
        assertEquals(deadLetters ? FailAction.DEAD_LETTERED : FailAction.FAILED, decision.action());
    }
}
