package com.p14n.entitystream.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.p14n.entitystream.protocol.OutboundEnvelope;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks live connections and which topics each of them is subscribed to.
 *
 * <p>
 * The registry owns two maps, topic to connections and connection to topics,
 * and keeps them consistent under one read/write lock. Mutations take the write
 * lock. {@link #fanOut} copies the subscriber list under the read lock and
 * writes to the connections after releasing it, so a slow connection never
 * blocks subscribe, unsubscribe or deregister.
 * </p>
 *
 * <p>
 * A connection deregistered while a fan-out is in progress is either written
 * to before it closes or reported as skipped; it is never delivered to twice.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ClientConnection> connections = new HashMap<>();
    private final Map<String, Set<String>> topicsByConnection = new HashMap<>();
    private final Map<String, Set<String>> connectionsByTopic = new HashMap<>();
    private final StreamingMetrics metrics;

    public ConnectionRegistry(OpenTelemetry ot) {
        this(new StreamingMetrics(ot.getMeter("connection_registry")));
    }

    public ConnectionRegistry(StreamingMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Adds a connection with no subscriptions.
     *
     * @throws IllegalStateException if a connection with the same id is already
     *                               registered
     */
    public ConnectionHandle register(ClientConnection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("Connection cannot be null");
        }
        lock.writeLock().lock();
        try {
            if (connections.containsKey(connection.id())) {
                throw new IllegalStateException("Connection already registered: " + connection.id());
            }
            connections.put(connection.id(), connection);
            topicsByConnection.put(connection.id(), new LinkedHashSet<>());
        } finally {
            lock.writeLock().unlock();
        }
        return new ConnectionHandle(connection.id());
    }

    /**
     * Removes a connection together with all of its subscriptions.
     *
     * @return the topics that no longer have any subscriber
     */
    public Set<String> deregister(ConnectionHandle handle) {
        Set<String> emptied = new HashSet<>();
        lock.writeLock().lock();
        try {
            connections.remove(handle.connectionId());
            Set<String> topics = topicsByConnection.remove(handle.connectionId());
            if (topics == null) {
                return emptied;
            }
            for (String topic : topics) {
                if (detach(handle.connectionId(), topic)) {
                    emptied.add(topic);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return emptied;
    }

    /**
     * Subscribes a registered connection to a topic.
     *
     * @return true if the connection was not yet subscribed to the topic
     * @throws IllegalStateException if the connection is not registered
     */
    public boolean addSubscription(ConnectionHandle handle, String topic) {
        lock.writeLock().lock();
        try {
            Set<String> topics = topicsByConnection.get(handle.connectionId());
            if (topics == null) {
                throw new IllegalStateException("Connection not registered: " + handle.connectionId());
            }
            if (!topics.add(topic)) {
                return false;
            }
            connectionsByTopic.computeIfAbsent(topic, t -> new LinkedHashSet<>()).add(handle.connectionId());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a subscription. Unknown connections and topics are ignored.
     *
     * @return true if a subscription was removed
     */
    public boolean removeSubscription(ConnectionHandle handle, String topic) {
        lock.writeLock().lock();
        try {
            Set<String> topics = topicsByConnection.get(handle.connectionId());
            if (topics == null || !topics.remove(topic)) {
                return false;
            }
            detach(handle.connectionId(), topic);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock; returns true if the topic lost its last subscriber
    private boolean detach(String connectionId, String topic) {
        Set<String> subscribers = connectionsByTopic.get(topic);
        if (subscribers == null) {
            return false;
        }
        subscribers.remove(connectionId);
        if (subscribers.isEmpty()) {
            connectionsByTopic.remove(topic);
            return true;
        }
        return false;
    }

    /**
     * Delivers an envelope to every connection subscribed to the topic. A
     * failing connection is logged and reported in the result; delivery to the
     * remaining connections continues.
     */
    public FanOutResult fanOut(String topic, OutboundEnvelope envelope) {
        List<ClientConnection> targets = snapshot(topic);

        int delivered = 0;
        int skipped = 0;
        List<FanOutResult.Failure> failures = new ArrayList<>();
        for (ClientConnection connection : targets) {
            if (!connection.isOpen()) {
                skipped++;
                continue;
            }
            try {
                if (connection.send(envelope)) {
                    delivered++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                failures.add(new FanOutResult.Failure(connection.id(), e));
                metrics.recordDeliveryFailed(topic);
                logger.atWarn()
                        .addArgument(topic)
                        .addArgument(connection.id())
                        .setCause(e)
                        .log("Failed to deliver message on topic {} to connection {}");
            }
        }
        metrics.recordDelivered(topic, delivered);

        logger.atDebug()
                .addArgument(topic)
                .addArgument(delivered)
                .addArgument(skipped)
                .addArgument(failures.size())
                .log("Fan-out on topic {}: delivered={} skipped={} failed={}");
        return new FanOutResult(topic, delivered, skipped, failures);
    }

    private List<ClientConnection> snapshot(String topic) {
        lock.readLock().lock();
        try {
            Set<String> ids = connectionsByTopic.get(topic);
            if (ids == null) {
                return List.of();
            }
            List<ClientConnection> targets = new ArrayList<>(ids.size());
            for (String id : ids) {
                ClientConnection connection = connections.get(id);
                if (connection != null) {
                    targets.add(connection);
                }
            }
            return targets;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> subscribers(String topic) {
        lock.readLock().lock();
        try {
            Set<String> ids = connectionsByTopic.get(topic);
            return ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> topics(ConnectionHandle handle) {
        lock.readLock().lock();
        try {
            Set<String> topics = topicsByConnection.get(handle.connectionId());
            return topics == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(topics));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasSubscribers(String topic) {
        lock.readLock().lock();
        try {
            return connectionsByTopic.containsKey(topic);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(ConnectionHandle handle) {
        lock.readLock().lock();
        try {
            return connections.containsKey(handle.connectionId());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ClientConnection> connection(ConnectionHandle handle) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(handle.connectionId()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> activeTopics() {
        lock.readLock().lock();
        try {
            return Set.copyOf(connectionsByTopic.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
