package com.p14n.entitystream.protocol;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.entitystream.auth.AccessMode;
import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.registry.ClientConnection;
import com.p14n.entitystream.registry.ConnectionHandle;
import com.p14n.entitystream.registry.DeliveryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol state of one client connection.
 *
 * <p>
 * A session moves from {@link State#CONNECTING} to {@link State#OPEN} when
 * {@link #open()} registers it and greets the client, and to
 * {@link State#CLOSED} when the transport goes away. Frames are processed one
 * at a time in the order they were received: each frame starts only after the
 * previous one, including any broker call it made, has completed. Sessions of
 * different connections run independently.
 * </p>
 */
public class ProtocolSession {
    private static final Logger logger = LoggerFactory.getLogger(ProtocolSession.class);

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    public enum State {
        CONNECTING,
        OPEN,
        CLOSED
    }

    private final ProtocolEngine engine;
    private final ClientConnection connection;
    private final Principal principal;

    private final Object lock = new Object();
    private volatile State state = State.CONNECTING;
    private ConnectionHandle handle;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    ProtocolSession(ProtocolEngine engine, ClientConnection connection) {
        this.engine = engine;
        this.connection = connection;
        this.principal = connection.principal();
    }

    /**
     * Registers the connection and sends the connect greeting.
     *
     * @throws IllegalStateException if the session was already opened
     */
    public void open() {
        synchronized (lock) {
            if (state != State.CONNECTING) {
                throw new IllegalStateException("Session " + connection.id() + " is " + state);
            }
            handle = engine.registry().register(connection);
            state = State.OPEN;
        }
        engine.metrics().recordConnectionOpened();
        logger.atInfo()
                .addArgument(connection.id())
                .addArgument(principal.displayName())
                .log("Connection {} opened for {}");
        reply(OutboundEnvelope.success(Operation.CONNECT, null,
                "Connected to streaming service as " + principal.displayName()));
    }

    /**
     * Queues a frame for processing after every frame received before it.
     * Frames received while the session is not open are dropped.
     *
     * @return a future completing once this frame has been handled
     */
    public CompletableFuture<Void> onFrame(String frame) {
        CompletableFuture<Void> previous;
        CompletableFuture<Void> next = new CompletableFuture<>();
        synchronized (lock) {
            if (state != State.OPEN) {
                logger.atDebug().log("Dropping frame on {} session {}", state, connection.id());
                return CompletableFuture.completedFuture(null);
            }
            previous = tail;
            tail = next;
        }
        previous.thenCompose(v -> process(frame))
                .whenComplete((v, e) -> {
                    try {
                        if (e != null) {
                            reply(internalError(null, unwrap(e)));
                        }
                    } finally {
                        next.complete(null);
                    }
                });
        return next;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private CompletableFuture<Void> process(String frame) {
        if (state != State.OPEN) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<OutboundEnvelope> response;
        String topic = null;
        try {
            InboundEnvelope envelope = engine.codec().decode(frame);
            topic = envelope.topic();
            switch (envelope.operation()) {
                case SUBSCRIBE:
                    response = subscribe(envelope.topic());
                    break;
                case UNSUBSCRIBE:
                    response = unsubscribe(envelope.topic());
                    break;
                case PUBLISH:
                    response = publish(envelope.topic(), envelope.data());
                    break;
                default:
                    throw new StreamingException(ErrorCode.INVALID_OPERATION,
                            "Unknown operation: " + envelope.operation().wireName());
            }
        } catch (StreamingException e) {
            logger.atDebug()
                    .addArgument(connection.id())
                    .addArgument(e.code())
                    .addArgument(e.getMessage())
                    .log("Rejected frame on connection {}: {} {}");
            response = CompletableFuture.completedFuture(OutboundEnvelope.error(e.code(), topic, e.getMessage()));
        } catch (RuntimeException e) {
            response = CompletableFuture.completedFuture(internalError(topic, e));
        }
        String failedTopic = topic;
        return response
                .exceptionally(e -> internalError(failedTopic, e))
                .thenAccept(this::reply);
    }

    private CompletableFuture<OutboundEnvelope> subscribe(String topic) {
        if (!engine.authorizer().authorize(principal, topic, AccessMode.SUBSCRIBE)) {
            return CompletableFuture.completedFuture(OutboundEnvelope.error(ErrorCode.PERMISSION_DENIED, topic,
                    "No permission to subscribe to topic: " + topic));
        }
        boolean added = engine.registry().addSubscription(handle, topic);
        return engine.bridge().ensureSubscribed(topic).handle((subscription, error) -> {
            if (error != null) {
                if (added) {
                    engine.registry().removeSubscription(handle, topic);
                }
                engine.bridge().releaseIfUnused(topic);
                logger.atWarn()
                        .addArgument(topic)
                        .addArgument(connection.id())
                        .setCause(error)
                        .log("Broker subscription to topic {} failed for connection {}");
                return OutboundEnvelope.error(ErrorCode.SUBSCRIPTION_ERROR, topic,
                        "Failed to subscribe to topic: " + topic);
            }
            if (state != State.OPEN) {
                // closed while the broker was subscribing
                engine.bridge().releaseIfUnused(topic);
            }
            return OutboundEnvelope.success(Operation.SUBSCRIBE, topic, "Subscribed to topic: " + topic);
        });
    }

    private CompletableFuture<OutboundEnvelope> unsubscribe(String topic) {
        engine.registry().removeSubscription(handle, topic);
        engine.bridge().releaseIfUnused(topic);
        return CompletableFuture.completedFuture(
                OutboundEnvelope.success(Operation.UNSUBSCRIBE, topic, "Unsubscribed from topic: " + topic));
    }

    private CompletableFuture<OutboundEnvelope> publish(String topic, ObjectNode data) {
        if (!engine.authorizer().authorize(principal, topic, AccessMode.PUBLISH)) {
            return CompletableFuture.completedFuture(OutboundEnvelope.error(ErrorCode.PERMISSION_DENIED, topic,
                    "No permission to publish to topic: " + topic));
        }
        ObjectNode stamped = data == null ? engine.codec().mapper().createObjectNode() : data.deepCopy();
        stamped.put("user_id", principal.userId());
        stamped.put("username", principal.username());
        byte[] payload = engine.codec().encodePayload(stamped);

        CompletableFuture<Void> published;
        try {
            published = engine.broker().publish(topic, payload);
        } catch (RuntimeException e) {
            published = CompletableFuture.failedFuture(e);
        }
        return published.handle((v, error) -> {
            if (error != null) {
                engine.metrics().recordPublishFailed(topic);
                logger.atWarn()
                        .addArgument(topic)
                        .addArgument(connection.id())
                        .setCause(error)
                        .log("Publish to topic {} from connection {} failed");
                return OutboundEnvelope.error(ErrorCode.PUBLISH_FAILED, topic, "Failed to publish to topic: " + topic);
            }
            return OutboundEnvelope.success(Operation.PUBLISH, topic, "Published to topic: " + topic);
        });
    }

    private OutboundEnvelope internalError(String topic, Throwable error) {
        logger.atError()
                .addArgument(connection.id())
                .setCause(error)
                .log("Unexpected error processing frame on connection {}");
        if (state == State.OPEN && !engine.registry().isRegistered(handle)) {
            logger.atWarn().log("Connection {} lost its registration, closing", connection.id());
            close();
        }
        return OutboundEnvelope.error(ErrorCode.INTERNAL_ERROR, topic, INTERNAL_ERROR_MESSAGE);
    }

    private void reply(OutboundEnvelope envelope) {
        if (envelope.isError()) {
            engine.metrics().recordRejected(envelope.errorCode().name());
        }
        try {
            connection.send(envelope);
        } catch (DeliveryException e) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .setCause(e)
                    .log("Failed to reply on connection {}, closing session");
            close();
        }
    }

    /**
     * Deregisters the connection and releases the broker subscriptions it was
     * the last local holder of. Calling it again has no effect.
     */
    public void close() {
        ConnectionHandle registered;
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            registered = handle;
        }
        if (registered != null) {
            Set<String> emptied = engine.registry().deregister(registered);
            for (String topic : emptied) {
                engine.bridge().releaseIfUnused(topic);
            }
            engine.metrics().recordConnectionClosed();
            logger.atInfo()
                    .addArgument(connection.id())
                    .addArgument(emptied.size())
                    .log("Connection {} closed, {} topic(s) left without local subscribers");
        }
        engine.sessionClosed(this);
        connection.close("session closed");
    }

    public State state() {
        return state;
    }

    public ClientConnection connection() {
        return connection;
    }
}
