package com.p14n.pgtopics.topic;

import com.p14n.pgtopics.DiscardException;
import com.p14n.pgtopics.EventSubscriber;
import com.p14n.pgtopics.Topic;
import com.p14n.pgtopics.broker.AsyncExecutor;
import com.p14n.pgtopics.data.Event;
import com.p14n.pgtopics.data.FailAction;
import com.p14n.pgtopics.telemetry.TopicMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.p14n.pgtopics.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Process-local topic for tests and single-process use. Events are not
 * stored: one published while there is no subscriber is dropped, and a failed
 * delivery is logged, not retried.
 *
 * @param <T> payload type
 */
public class InMemoryTopic<T> implements Topic<T> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTopic.class);

    private final String name;
    private final AsyncExecutor executor;
    private final CopyOnWriteArrayList<EventSubscriber<T>> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final TopicMetrics metrics;

    public InMemoryTopic(String name, AsyncExecutor executor, OpenTelemetry ot) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Topic name cannot be null or empty");
        }
        this.name = name;
        this.executor = executor;
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("pgtopics");
        this.metrics = new TopicMetrics(ot.getMeter("pgtopics"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void publish(Event<T> event) {
        if (closed.get()) {
            throw new IllegalStateException("Topic " + name + " is closed");
        }
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        metrics.recordPublished(name);

        Object[] current = subscribers.toArray();
        if (current.length == 0) {
            logger.atDebug().log("No subscribers on topic {}, dropping event {}", name, event.id());
            return;
        }
        @SuppressWarnings("unchecked")
        EventSubscriber<T> subscriber = (EventSubscriber<T>) current[ThreadLocalRandom.current()
                .nextInt(current.length)];

        executor.submit(() -> {
            try {
                processWithTelemetry(openTelemetry, tracer, "process_event", name, event.id(), null, () -> {
                    subscriber.onEvent(event);
                    return null;
                });
                metrics.recordDelivered(name);
            } catch (DiscardException e) {
                metrics.recordDiscarded(name);
                logger.atDebug().log("Event {} on topic {} discarded", event.id(), name);
            } catch (Exception e) {
                metrics.recordFailed(name, FailAction.FAILED);
                logger.atError().setCause(e).log("Subscriber failed on event {} on topic {}", event.id(), name);
            }
            return null;
        });
    }

    @Override
    public void subscribe(EventSubscriber<T> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Topic " + name + " is closed");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        subscribers.add(subscriber);
        metrics.recordSubscriberAdded(name);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int removed = subscribers.size();
            subscribers.clear();
            if (removed > 0) {
                metrics.recordSubscriberRemoved(name, removed);
            }
        }
    }
}
