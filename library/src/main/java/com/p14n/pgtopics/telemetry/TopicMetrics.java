package com.p14n.pgtopics.telemetry;

import com.p14n.pgtopics.data.FailAction;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry metrics for topic operations, all attributed by topic name.
 *
 * <ul>
 * <li>events_published: events written to the store</li>
 * <li>events_delivered: events a subscriber handled successfully</li>
 * <li>events_failed: subscriber failures, with the resulting action</li>
 * <li>events_discarded: events a subscriber discarded</li>
 * <li>active_subscribers: current subscribers</li>
 * </ul>
 */
public class TopicMetrics {

        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> ACTION = AttributeKey.stringKey("action");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter failedEvents;
        private final LongCounter discardedEvents;
        private final LongUpDownCounter activeSubscribers;

        public TopicMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events published")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events handled successfully by subscribers")
                                .build();

                failedEvents = meter.counterBuilder("events_failed")
                                .setDescription("Number of subscriber failures")
                                .build();

                discardedEvents = meter.counterBuilder("events_discarded")
                                .setDescription("Number of events discarded by subscribers")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedEvents.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredEvents.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordFailed(String topic, FailAction action) {
                failedEvents.add(1, Attributes.of(TOPIC, topic, ACTION, action.dbValue()));
        }

        public void recordDiscarded(String topic) {
                discardedEvents.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberAdded(String topic) {
                activeSubscribers.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberRemoved(String topic, int count) {
                activeSubscribers.add(-count, Attributes.of(TOPIC, topic));
        }
}
