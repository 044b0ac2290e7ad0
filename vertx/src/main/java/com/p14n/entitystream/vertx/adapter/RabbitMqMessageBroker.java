package com.p14n.entitystream.vertx.adapter;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.entitystream.broker.BrokerException;
import com.p14n.entitystream.broker.BrokerSubscription;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.broker.MessageSubscriber;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.rabbitmq.QueueOptions;
import io.vertx.rabbitmq.RabbitMQClient;
import io.vertx.rabbitmq.RabbitMQConsumer;
import io.vertx.rabbitmq.RabbitMQOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue-broker {@link MessageBroker} backed by RabbitMQ through the Vert.x
 * RabbitMQ client.
 *
 * <p>
 * Each topic is a durable fanout exchange, declared on first use. Publishes
 * wait for the broker's confirm. Each subscription declares an exclusive,
 * auto-deleted queue bound to the topic's exchange, so every subscribing
 * process gets its own copy of each message.
 * </p>
 */
public class RabbitMqMessageBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(RabbitMqMessageBroker.class);

    static final String EXCHANGE_TYPE = "fanout";
    static final String QUEUE_PREFIX = "entity-stream.";

    private final RabbitMQClient client;
    private final String nodeId;
    private final long confirmTimeoutMillis;
    private final Map<String, CompletableFuture<Void>> exchanges = new ConcurrentHashMap<>();
    private final Map<String, RabbitMQConsumer> consumers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final StreamingMetrics metrics;

    public RabbitMqMessageBroker(Vertx vertx, RabbitMQOptions options, long confirmTimeoutMillis, OpenTelemetry ot) {
        this(RabbitMQClient.create(vertx, options), confirmTimeoutMillis, ot);
    }

    public RabbitMqMessageBroker(RabbitMQClient client, long confirmTimeoutMillis, OpenTelemetry ot) {
        this.client = client;
        this.confirmTimeoutMillis = confirmTimeoutMillis;
        this.nodeId = UUID.randomUUID().toString().substring(0, 8);
        this.metrics = new StreamingMetrics(ot.getMeter("rabbitmq_broker"));
    }

    public static RabbitMQOptions options(String host, int port, String user, String password) {
        return new RabbitMQOptions()
                .setHost(host)
                .setPort(port)
                .setUser(user)
                .setPassword(password)
                .setAutomaticRecoveryEnabled(true);
    }

    /**
     * Connects and switches the channel to publisher-confirm mode.
     */
    public CompletableFuture<Void> start() {
        return client.start()
                .compose(v -> client.confirmSelect())
                .onSuccess(v -> logger.atInfo().log("RabbitMQ broker adapter connected on node {}", nodeId))
                .toCompletionStage()
                .toCompletableFuture();
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    private CompletableFuture<Void> declareExchange(String topic) {
        CompletableFuture<Void> declared = exchanges.computeIfAbsent(topic,
                t -> client.exchangeDeclare(t, EXCHANGE_TYPE, true, false)
                        .toCompletionStage()
                        .toCompletableFuture());
        declared.whenComplete((v, error) -> {
            if (error != null) {
                exchanges.remove(topic, declared);
            }
        });
        return declared;
    }

    @Override
    public CompletableFuture<Void> publish(String topic, byte[] payload) {
        checkOpen();
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }

        return declareExchange(topic)
                .thenCompose(v -> client.basicPublish(topic, "", Buffer.buffer(payload))
                        .compose(sent -> client.waitForConfirms(confirmTimeoutMillis))
                        .toCompletionStage())
                .handle((v, error) -> {
                    if (error != null) {
                        metrics.recordPublishFailed(topic);
                        logger.atWarn()
                                .addArgument(topic)
                                .setCause(error)
                                .log("RabbitMQ rejected message for topic {}");
                        throw new BrokerException(topic, "Failed to publish to " + topic, error);
                    }
                    metrics.recordPublished(topic);
                    return null;
                });
    }

    @Override
    public CompletableFuture<BrokerSubscription> subscribe(String topic, MessageSubscriber<byte[]> subscriber) {
        checkOpen();
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        BrokerSubscription subscription = BrokerSubscription.create(topic);
        String queue = QUEUE_PREFIX + nodeId + "." + subscription.id();

        return declareExchange(topic)
                .thenCompose(v -> client.queueDeclare(queue, false, true, true)
                        .compose(ok -> client.queueBind(queue, topic, ""))
                        .compose(bound -> client.basicConsumer(queue, new QueueOptions()))
                        .toCompletionStage())
                .handle((consumer, error) -> {
                    if (error != null) {
                        logger.atWarn()
                                .addArgument(topic)
                                .setCause(error)
                                .log("Failed to subscribe to RabbitMQ topic {}");
                        throw new BrokerException(topic, "Failed to subscribe to " + topic, error);
                    }
                    consumer.handler(message -> deliver(topic, message.body().getBytes(), subscriber));
                    consumer.exceptionHandler(e -> {
                        logger.atWarn()
                                .addArgument(topic)
                                .setCause(e)
                                .log("RabbitMQ consumer for topic {} failed");
                        subscriber.onError(e);
                    });
                    consumers.put(subscription.id(), consumer);
                    metrics.recordSubscriberAdded(topic);
                    return subscription;
                });
    }

    private void deliver(String topic, byte[] payload, MessageSubscriber<byte[]> subscriber) {
        try {
            subscriber.onMessage(payload);
        } catch (Exception e) {
            logger.atWarn()
                    .addArgument(topic)
                    .setCause(e)
                    .log("Subscriber failed to process message on topic {}");
        }
    }

    @Override
    public CompletableFuture<Void> unsubscribe(BrokerSubscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        RabbitMQConsumer consumer = consumers.remove(subscription.id());
        if (consumer == null) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordSubscriberRemoved(subscription.topic());
        return consumer.cancel()
                .toCompletionStage()
                .toCompletableFuture();
    }

    int consumerCount() {
        return consumers.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().log("Closing RabbitMQ broker adapter");
        CompletableFuture<?>[] cancelled = consumers.values().stream()
                .map(consumer -> consumer.cancel().toCompletionStage().toCompletableFuture())
                .toArray(CompletableFuture[]::new);
        consumers.clear();
        CompletableFuture.allOf(cancelled)
                .handle((v, error) -> error)
                .thenCompose(error -> client.stop().toCompletionStage())
                .whenComplete((v, error) -> {
                    if (error != null) {
                        logger.atWarn()
                                .setCause(error)
                                .log("Error closing RabbitMQ client");
                    }
                });
    }
}
