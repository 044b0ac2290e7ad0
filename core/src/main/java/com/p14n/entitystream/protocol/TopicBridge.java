package com.p14n.entitystream.protocol;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.p14n.entitystream.broker.BrokerSubscription;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.broker.MessageSubscriber;
import com.p14n.entitystream.registry.ConnectionRegistry;
import com.p14n.entitystream.registry.FanOutResult;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds at most one broker subscription per topic for this process and routes
 * what the broker delivers into {@link ConnectionRegistry#fanOut}.
 *
 * <p>
 * The broker is subscribed when the first local connection subscribes to a
 * topic and unsubscribed once the registry reports no local subscriber. Both
 * decisions are taken inside a per-key compute of the subscription map, so a
 * topic is never subscribed twice and never released while a connection still
 * holds it.
 * </p>
 */
public class TopicBridge implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TopicBridge.class);

    private final ConcurrentHashMap<String, CompletableFuture<BrokerSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final MessageBroker broker;
    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final StreamingMetrics metrics;

    public TopicBridge(MessageBroker broker, ConnectionRegistry registry, EnvelopeCodec codec,
            StreamingMetrics metrics) {
        this.broker = broker;
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Returns the broker subscription for a topic, creating it if this process
     * holds none. A failed subscription is forgotten so the next call retries.
     */
    public CompletableFuture<BrokerSubscription> ensureSubscribed(String topic) {
        CompletableFuture<BrokerSubscription> future = subscriptions.computeIfAbsent(topic, this::subscribe);
        future.whenComplete((subscription, error) -> {
            if (error != null) {
                subscriptions.remove(topic, future);
            }
        });
        return future;
    }

    private CompletableFuture<BrokerSubscription> subscribe(String topic) {
        TopicSubscriber subscriber = new TopicSubscriber(topic);
        CompletableFuture<BrokerSubscription> future;
        try {
            future = broker.subscribe(topic, subscriber);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        subscriber.future = future;
        logger.atDebug().log("Broker subscription requested for topic {}", topic);
        return future;
    }

    /**
     * Drops the broker subscription of a topic when no local connection is
     * subscribed to it any more.
     *
     * @return a future completing once the broker subscription, if any, is
     *         cancelled; it never completes exceptionally
     */
    public CompletableFuture<Void> releaseIfUnused(String topic) {
        AtomicReference<CompletableFuture<BrokerSubscription>> removed = new AtomicReference<>();
        subscriptions.computeIfPresent(topic, (t, future) -> {
            if (registry.hasSubscribers(t)) {
                return future;
            }
            removed.set(future);
            return null;
        });
        CompletableFuture<BrokerSubscription> future = removed.get();
        if (future == null) {
            return CompletableFuture.completedFuture(null);
        }
        logger.atDebug().log("Releasing broker subscription for topic {}", topic);
        return cancel(future);
    }

    private CompletableFuture<Void> cancel(CompletableFuture<BrokerSubscription> future) {
        // a subscription that never came up has nothing to cancel
        return future.handle((subscription, error) -> subscription)
                .thenCompose(subscription -> {
                    if (subscription == null) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return unsubscribe(subscription);
                });
    }

    private CompletableFuture<Void> unsubscribe(BrokerSubscription subscription) {
        CompletableFuture<Void> result;
        try {
            result = broker.unsubscribe(subscription);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(e -> {
            logger.atWarn()
                    .addArgument(subscription.topic())
                    .setCause(e)
                    .log("Failed to cancel broker subscription for topic {}");
            return null;
        });
    }

    public boolean isSubscribed(String topic) {
        return subscriptions.containsKey(topic);
    }

    public Set<String> topics() {
        return Set.copyOf(subscriptions.keySet());
    }

    @Override
    public void close() {
        for (String topic : Set.copyOf(subscriptions.keySet())) {
            CompletableFuture<BrokerSubscription> future = subscriptions.remove(topic);
            if (future != null) {
                cancel(future);
            }
        }
    }

    private class TopicSubscriber implements MessageSubscriber<byte[]> {
        private final String topic;
        private volatile CompletableFuture<BrokerSubscription> future;

        TopicSubscriber(String topic) {
            this.topic = topic;
        }

        @Override
        public void onMessage(byte[] payload) {
            FanOutResult result;
            try {
                result = registry.fanOut(topic, OutboundEnvelope.message(topic, codec.decodePayload(payload)));
            } catch (Throwable e) {
                // one bad message must not end the topic's broker subscription
                logger.atError()
                        .addArgument(topic)
                        .setCause(e)
                        .log("Failed to relay broker message on topic {}");
                return;
            }
            if (result.failed() > 0) {
                logger.atDebug()
                        .addArgument(result.failed())
                        .addArgument(topic)
                        .log("{} connection(s) failed to receive message on topic {}");
            }
        }

        @Override
        public void onError(Throwable error) {
            logger.atWarn()
                    .addArgument(topic)
                    .setCause(error)
                    .log("Broker subscription for topic {} failed");
            CompletableFuture<BrokerSubscription> own = future;
            if (own != null && subscriptions.remove(topic, own)) {
                cancel(own);
            }
            FanOutResult result = registry.fanOut(topic, OutboundEnvelope.error(ErrorCode.SUBSCRIPTION_ERROR, topic,
                    "Error in subscription to topic " + topic));
            metrics.recordRejected(ErrorCode.SUBSCRIPTION_ERROR.name());
            logger.atDebug().log("Notified {} connection(s) of subscription failure", result.delivered());
        }
    }
}
