package com.p14n.pgtopics.topic;

import com.p14n.pgtopics.broker.AsyncExecutor;
import com.p14n.pgtopics.broker.Backoff;
import com.p14n.pgtopics.broker.Jitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically drains events of a topic that were never claimed, because no
 * subscriber was online at publish time, a notification was lost, or a retry
 * delay has since elapsed.
 *
 * <p>
 * Every tick claims one event at a time until none is left, then waits a
 * jittered period. A tick stops at the first event it cannot claim or process
 * and backs off exponentially up to the maximum; the next clean tick resets it.
 * </p>
 */
public class BacklogReconciler {

    private static final Logger logger = LoggerFactory.getLogger(BacklogReconciler.class);

    /**
     * Processes at most one event.
     */
    @FunctionalInterface
    public interface Drain {
        /**
         * @return true if an event was processed and more may be waiting
         * @throws Exception if claiming or processing failed
         */
        boolean processOne() throws Exception;
    }

    private final String topic;
    private final Drain drain;
    private final AsyncExecutor executor;
    private final Duration period;
    private final Backoff backoff;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> next;

    public BacklogReconciler(String topic, Drain drain, AsyncExecutor executor, Duration period,
            Duration maxBackoff) {
        this.topic = topic;
        this.drain = drain;
        this.executor = executor;
        this.period = period;
        this.backoff = new Backoff(period, maxBackoff.compareTo(period) < 0 ? period : maxBackoff);
    }

    public void start() {
        scheduleIn(Jitter.of(period));
    }

    private void scheduleIn(Duration delay) {
        if (stopped.get()) {
            return;
        }
        try {
            next = executor.schedule(() -> executor.submit(this::tick), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.atDebug().log("Backlog scan for topic {} not rescheduled, executor shut down", topic);
        }
    }

    /**
     * Runs one tick and schedules the next.
     *
     * @return the number of events processed
     */
    int tick() {
        int processed = 0;
        Duration delay;
        try {
            while (!stopped.get() && drain.processOne()) {
                processed++;
            }
            backoff.reset();
            delay = Jitter.of(period);
            if (processed > 0) {
                logger.atDebug().log("Backlog scan processed {} events on topic {}", processed, topic);
            }
        } catch (Exception e) {
            delay = backoff.duration();
            logger.atError().setCause(e).log("Backlog processing failed for topic {}, retrying in {}", topic, delay);
        }
        scheduleIn(delay);
        return processed;
    }

    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            ScheduledFuture<?> f = next;
            if (f != null) {
                f.cancel(false);
            }
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
