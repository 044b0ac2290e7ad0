package com.p14n.entitystream.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for the streaming subsystem.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>messages_published: messages accepted by the broker, per topic</li>
 * <li>publish_failures: publish attempts the broker rejected, per topic</li>
 * <li>messages_delivered: envelopes handed to client connections, per topic</li>
 * <li>delivery_failures: envelopes a connection failed to accept, per topic</li>
 * <li>active_subscribers: broker subscriptions currently held, per topic</li>
 * <li>active_connections: open client connections</li>
 * <li>outbound_dropped: queued frames dropped by the overflow policy</li>
 * <li>envelopes_rejected: error replies sent, per error code</li>
 * </ul>
 */
public class StreamingMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> ERROR_CODE = AttributeKey.stringKey("error_code");

        private final LongCounter publishedMessages;
        private final LongCounter publishFailures;
        private final LongCounter deliveredMessages;
        private final LongCounter deliveryFailures;
        private final LongUpDownCounter activeSubscribers;
        private final LongUpDownCounter activeConnections;
        private final LongCounter outboundDropped;
        private final LongCounter rejectedEnvelopes;

        /**
         * Creates a new StreamingMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public StreamingMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages accepted by the broker")
                                .build();

                publishFailures = meter.counterBuilder("publish_failures")
                                .setDescription("Number of publish attempts rejected by the broker")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of envelopes delivered to client connections")
                                .build();

                deliveryFailures = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of envelopes a client connection failed to accept")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active broker subscriptions")
                                .build();

                activeConnections = meter.upDownCounterBuilder("active_connections")
                                .setDescription("Number of open client connections")
                                .build();

                outboundDropped = meter.counterBuilder("outbound_dropped")
                                .setDescription("Number of outbound frames dropped on queue overflow")
                                .build();

                rejectedEnvelopes = meter.counterBuilder("envelopes_rejected")
                                .setDescription("Number of error envelopes sent to clients")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordPublishFailed(String topic) {
                publishFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic, long count) {
                if (count > 0) {
                        deliveredMessages.add(count, Attributes.of(TOPIC, topic));
                }
        }

        public void recordDeliveryFailed(String topic) {
                deliveryFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberAdded(String topic) {
                activeSubscribers.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberRemoved(String topic) {
                activeSubscribers.add(-1, Attributes.of(TOPIC, topic));
        }

        public void recordConnectionOpened() {
                activeConnections.add(1);
        }

        public void recordConnectionClosed() {
                activeConnections.add(-1);
        }

        public void recordOutboundDropped() {
                outboundDropped.add(1);
        }

        public void recordRejected(String errorCode) {
                rejectedEnvelopes.add(1, Attributes.of(ERROR_CODE, errorCode));
        }
}
