package com.p14n.pgtopics.data;

/**
 * Event counts for one topic.
 *
 * @param pending     pending events, including those waiting on a retry delay
 * @param retrying    pending events that have failed at least once
 * @param active      claimed events
 * @param succeeded   completed events
 * @param failed      events whose retries are exhausted
 * @param stuck       active events not updated within the stuck threshold
 * @param deadLetters dead lettered events
 */
public record EventStats(long pending,
                         long retrying,
                         long active,
                         long succeeded,
                         long failed,
                         long stuck,
                         long deadLetters) {

    /**
     * @return events that have not yet reached a terminal state
     */
    public long unresolved() {
        return pending + active;
    }

    public long total() {
        return pending + active + succeeded + failed;
    }
}
