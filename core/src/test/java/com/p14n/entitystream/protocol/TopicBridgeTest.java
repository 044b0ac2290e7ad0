package com.p14n.entitystream.protocol;

import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.broker.RecordingMessageBroker;
import com.p14n.entitystream.registry.ConnectionHandle;
import com.p14n.entitystream.registry.ConnectionRegistry;
import com.p14n.entitystream.registry.RecordingConnection;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicBridgeTest {

    private static final String TOPIC = "entity.product.42";

    private RecordingMessageBroker broker;
    private ConnectionRegistry registry;
    private TopicBridge bridge;

    @BeforeEach
    void setUp() {
        StreamingMetrics metrics = new StreamingMetrics(OpenTelemetry.noop().getMeter("test"));
        broker = new RecordingMessageBroker();
        registry = new ConnectionRegistry(metrics);
        bridge = new TopicBridge(broker, registry, new EnvelopeCodec(), metrics);
    }

    private RecordingConnection subscribed(String id, String topic) {
        RecordingConnection connection = new RecordingConnection(id, Principal.user(id));
        ConnectionHandle handle = registry.register(connection);
        registry.addSubscription(handle, topic);
        return connection;
    }

    @Test
    void shouldSubscribeBrokerOncePerTopic() {
        subscribed("c1", TOPIC);
        subscribed("c2", TOPIC);

        bridge.ensureSubscribed(TOPIC).join();
        bridge.ensureSubscribed(TOPIC).join();

        assertEquals(1, broker.subscribeCalls());
        assertEquals(Set.of(TOPIC), bridge.topics());
    }

    @Test
    void shouldRouteBrokerMessagesToSubscribedConnections() {
        RecordingConnection c1 = subscribed("c1", TOPIC);
        RecordingConnection other = subscribed("c2", "public.news");
        bridge.ensureSubscribed(TOPIC).join();

        broker.deliver(TOPIC, "{\"price\":9.99}");

        assertEquals(1, c1.sent(Operation.MESSAGE).size());
        OutboundEnvelope envelope = c1.last();
        assertEquals(TOPIC, envelope.topic());
        assertEquals(9.99, envelope.data().get("price").asDouble());
        assertTrue(other.sent().isEmpty());
    }

    @Test
    void shouldSkipMessagesThatCannotBeRelayed() {
        EnvelopeCodec failingOnce = new EnvelopeCodec() {
            private boolean failed;

            @Override
            public JsonNode decodePayload(byte[] payload) {
                if (!failed) {
                    failed = true;
                    throw new NoSuchMethodError("getNumberTypeFP");
                }
                return super.decodePayload(payload);
            }
        };
        bridge = new TopicBridge(broker, registry, failingOnce,
                new StreamingMetrics(OpenTelemetry.noop().getMeter("test")));
        RecordingConnection c1 = subscribed("c1", TOPIC);
        bridge.ensureSubscribed(TOPIC).join();

        assertDoesNotThrow(() -> broker.deliver(TOPIC, "{\"price\":9.99}"));
        broker.deliver(TOPIC, "{\"price\":10.5}");

        assertEquals(1, c1.sent(Operation.MESSAGE).size());
        assertEquals(10.5, c1.last().data().get("price").asDouble());
        assertTrue(bridge.isSubscribed(TOPIC));
        assertEquals(1, broker.subscriberCount(TOPIC));
    }

    @Test
    void shouldKeepBrokerSubscriptionWhileConnectionsRemain() {
        subscribed("c1", TOPIC);
        bridge.ensureSubscribed(TOPIC).join();

        bridge.releaseIfUnused(TOPIC).join();

        assertTrue(bridge.isSubscribed(TOPIC));
        assertEquals(0, broker.unsubscribeCalls());
    }

    @Test
    void shouldReleaseBrokerSubscriptionWhenUnused() {
        bridge.ensureSubscribed(TOPIC).join();

        bridge.releaseIfUnused(TOPIC).join();
        bridge.releaseIfUnused(TOPIC).join();

        assertFalse(bridge.isSubscribed(TOPIC));
        assertEquals(1, broker.unsubscribeCalls());
        assertEquals(0, broker.subscriberCount(TOPIC));
    }

    @Test
    void shouldForgetFailedSubscriptionSoTheNextCallRetries() {
        broker.failSubscribes(new RuntimeException("broker down"));
        assertTrue(bridge.ensureSubscribed(TOPIC).isCompletedExceptionally());
        assertFalse(bridge.isSubscribed(TOPIC));

        broker.failSubscribes(null);
        bridge.ensureSubscribed(TOPIC).join();

        assertTrue(bridge.isSubscribed(TOPIC));
        assertEquals(2, broker.subscribeCalls());
    }

    @Test
    void shouldNotifySubscribersWhenBrokerSubscriptionFails() {
        RecordingConnection c1 = subscribed("c1", TOPIC);
        bridge.ensureSubscribed(TOPIC).join();

        broker.failSubscription(TOPIC, new RuntimeException("connection lost"));

        OutboundEnvelope error = c1.last();
        assertEquals(ErrorCode.SUBSCRIPTION_ERROR, error.errorCode());
        assertEquals(TOPIC, error.topic());
        assertFalse(bridge.isSubscribed(TOPIC));
        assertEquals(1, broker.unsubscribeCalls());
    }

    @Test
    void shouldCancelEverythingOnClose() {
        bridge.ensureSubscribed(TOPIC).join();
        bridge.ensureSubscribed("public.news").join();

        bridge.close();

        assertEquals(Set.of(), bridge.topics());
        assertEquals(2, broker.unsubscribeCalls());
    }
}
