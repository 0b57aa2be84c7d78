package com.p14n.pgtopics.data;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TopicConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        TopicConfig config = TopicConfig.defaults();

        assertEquals(0, config.maxRetries());
        assertEquals(Duration.ofSeconds(5), config.initialBackoff());
        assertEquals(Duration.ofSeconds(15), config.maxBackoff());
        assertEquals(1.2, config.backoffMultiplier());
        assertFalse(config.deadLetterEnabled());
        assertEquals(Duration.ofHours(120), config.deadLetterMaxAge());
    }

    @Test
    void withersReplaceOnlyTheirFields() {
        TopicConfig config = TopicConfig.defaults()
                .withRetries(4)
                .withDeadLetters(true);

        assertEquals(4, config.maxRetries());
        assertTrue(config.deadLetterEnabled());
        assertEquals(Duration.ofSeconds(5), config.initialBackoff());
        assertEquals(Duration.ofHours(120), config.deadLetterMaxAge());
    }

    @Test
    void rejectsInvalidValues() {
        TopicConfig defaults = TopicConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withRetries(-1));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withBackoff(Duration.ZERO, Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withDeadLetters(true, Duration.ofSeconds(-1)));
    }
}
