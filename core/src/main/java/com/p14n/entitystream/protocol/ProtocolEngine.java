package com.p14n.entitystream.protocol;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.p14n.entitystream.auth.TopicAuthorizer;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.registry.ClientConnection;
import com.p14n.entitystream.registry.ConnectionRegistry;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the client protocol. Owns the connection registry and the
 * topic bridge and opens one {@link ProtocolSession} per client connection.
 *
 * <p>
 * The broker is passed in rather than looked up, so tests and single-node
 * deployments can supply an in-process broker.
 * </p>
 */
public class ProtocolEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProtocolEngine.class);

    private final MessageBroker broker;
    private final TopicAuthorizer authorizer;
    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final StreamingMetrics metrics;
    private final TopicBridge bridge;
    private final Set<ProtocolSession> sessions = ConcurrentHashMap.newKeySet();

    public ProtocolEngine(MessageBroker broker, OpenTelemetry ot) {
        this(broker, new TopicAuthorizer(), new EnvelopeCodec(),
                new StreamingMetrics(ot.getMeter("protocol_engine")));
    }

    public ProtocolEngine(MessageBroker broker, TopicAuthorizer authorizer, EnvelopeCodec codec,
            StreamingMetrics metrics) {
        this(broker, authorizer, new ConnectionRegistry(metrics), codec, metrics);
    }

    public ProtocolEngine(MessageBroker broker, TopicAuthorizer authorizer, ConnectionRegistry registry,
            EnvelopeCodec codec, StreamingMetrics metrics) {
        this.broker = broker;
        this.authorizer = authorizer;
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
        this.bridge = new TopicBridge(broker, registry, codec, metrics);
    }

    /**
     * Registers an authenticated connection and sends it the connect greeting.
     */
    public ProtocolSession openSession(ClientConnection connection) {
        ProtocolSession session = new ProtocolSession(this, connection);
        sessions.add(session);
        try {
            session.open();
        } catch (RuntimeException e) {
            sessions.remove(session);
            throw e;
        }
        return session;
    }

    void sessionClosed(ProtocolSession session) {
        sessions.remove(session);
    }

    public int sessionCount() {
        return sessions.size();
    }

    MessageBroker broker() {
        return broker;
    }

    TopicAuthorizer authorizer() {
        return authorizer;
    }

    StreamingMetrics metrics() {
        return metrics;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public TopicBridge bridge() {
        return bridge;
    }

    /**
     * Closes every open session and cancels the remaining broker
     * subscriptions. The broker itself is left open; its owner closes it.
     */
    @Override
    public void close() {
        List<ProtocolSession> open = List.copyOf(sessions);
        logger.atInfo().log("Closing protocol engine with {} open session(s)", open.size());
        for (ProtocolSession session : open) {
            session.close();
        }
        bridge.close();
    }
}
