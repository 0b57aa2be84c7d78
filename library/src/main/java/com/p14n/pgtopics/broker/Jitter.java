package com.p14n.pgtopics.broker;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Spreads periodic work of many processes so they do not hit the database in
 * lockstep.
 */
public class Jitter {

    private Jitter() {
    }

    /**
     * @return {@code d} moved randomly by up to 5% either way
     */
    public static Duration of(Duration d) {
        long millis = d.toMillis();
        long spread = millis / 10;
        if (spread <= 0) {
            return d;
        }
        return Duration.ofMillis(millis - millis / 20 + ThreadLocalRandom.current().nextLong(spread));
    }
}
