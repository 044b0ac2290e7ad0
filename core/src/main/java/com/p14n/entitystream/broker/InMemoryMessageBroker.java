package com.p14n.entitystream.broker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.util.concurrent.MoreExecutors;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link MessageBroker} for single-node deployments and tests.
 *
 * <p>
 * Each topic with subscribers gets a sequential executor layered over the
 * shared {@link AsyncExecutor}, so deliveries for one topic run one after
 * another in publish order while different topics are delivered concurrently.
 * A topic's state is dropped with its last subscriber. A publish to a topic
 * without subscribers is accepted and dropped.
 * </p>
 */
public class InMemoryMessageBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageBroker.class);

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final StreamingMetrics metrics;

    private static final class Channel {
        final Map<String, MessageSubscriber<byte[]>> subscribers = new ConcurrentHashMap<>();
        final Executor executor;

        Channel(Executor executor) {
            this.executor = executor;
        }
    }

    public InMemoryMessageBroker(OpenTelemetry ot, String scopeName) {
        this(new DefaultExecutor(), true, ot, scopeName);
    }

    public InMemoryMessageBroker(AsyncExecutor asyncExecutor, OpenTelemetry ot, String scopeName) {
        this(asyncExecutor, false, ot, scopeName);
    }

    /**
     * @param ownsExecutor whether {@link #close()} shuts the executor down
     */
    InMemoryMessageBroker(AsyncExecutor asyncExecutor, boolean ownsExecutor, OpenTelemetry ot, String scopeName) {
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.metrics = new StreamingMetrics(ot.getMeter(scopeName));
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    @Override
    public CompletableFuture<Void> publish(String topic, byte[] payload) {
        checkOpen();

        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        metrics.recordPublished(topic);

        Channel channel = channels.get(topic);
        if (channel == null || channel.subscribers.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        channel.executor.execute(() -> deliver(topic, channel, payload));
        return CompletableFuture.completedFuture(null);
    }

    private void deliver(String topic, Channel channel, byte[] payload) {
        for (MessageSubscriber<byte[]> subscriber : channel.subscribers.values()) {
            // nothing may escape a task on the sequential executor
            try {
                subscriber.onMessage(payload);
            } catch (Throwable e) {
                logger.atWarn()
                        .addArgument(topic)
                        .setCause(e)
                        .log("Subscriber failed to process message on topic {}");
                try {
                    subscriber.onError(e);
                } catch (Throwable nested) {
                    logger.atWarn()
                            .addArgument(topic)
                            .setCause(nested)
                            .log("Subscriber error handler failed on topic {}");
                }
            }
        }
    }

    @Override
    public CompletableFuture<BrokerSubscription> subscribe(String topic, MessageSubscriber<byte[]> subscriber) {
        checkOpen();

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        BrokerSubscription subscription = BrokerSubscription.create(topic);
        channels.compute(topic, (k, channel) -> {
            Channel current = channel == null ? new Channel(MoreExecutors.newSequentialExecutor(asyncExecutor))
                    : channel;
            current.subscribers.put(subscription.id(), subscriber);
            return current;
        });
        metrics.recordSubscriberAdded(topic);

        logger.atDebug().log("Subscribed to topic: {}", topic);
        return CompletableFuture.completedFuture(subscription);
    }

    @Override
    public CompletableFuture<Void> unsubscribe(BrokerSubscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }

        channels.computeIfPresent(subscription.topic(), (topic, channel) -> {
            if (channel.subscribers.remove(subscription.id()) != null) {
                metrics.recordSubscriberRemoved(topic);
            }
            return channel.subscribers.isEmpty() ? null : channel;
        });
        return CompletableFuture.completedFuture(null);
    }

    public int subscriberCount(String topic) {
        Channel channel = channels.get(topic);
        return channel == null ? 0 : channel.subscribers.size();
    }

    /**
     * Number of topics currently holding subscribers.
     */
    public int topicCount() {
        return channels.size();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            for (Channel channel : channels.values()) {
                channel.subscribers.clear();
            }
            channels.clear();
            if (ownsExecutor) {
                asyncExecutor.shutdownNow();
            }
        }
    }

}
