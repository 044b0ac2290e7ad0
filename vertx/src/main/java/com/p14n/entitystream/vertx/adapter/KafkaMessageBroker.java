package com.p14n.entitystream.vertx.adapter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.p14n.entitystream.broker.BrokerException;
import com.p14n.entitystream.broker.BrokerSubscription;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.broker.MessageSubscriber;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import io.vertx.kafka.client.producer.KafkaProducer;
import io.vertx.kafka.client.producer.KafkaProducerRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log-broker {@link MessageBroker} backed by Kafka through the Vert.x Kafka
 * client.
 *
 * <p>
 * One producer is shared by all publishes; messages are keyed by topic so a
 * topic's messages stay in one partition and keep their order. Every
 * subscription gets its own consumer in a consumer group unique to this
 * process and subscription, starting at the latest offset, so each process
 * sees every message published after it subscribed. A subscription completes
 * only once the topic's partitions are assigned and their positions resolved;
 * messages published after that are never skipped. Topics are created by the
 * broker on first use.
 * </p>
 */
public class KafkaMessageBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(KafkaMessageBroker.class);

    static final String GROUP_PREFIX = "entity-stream-";
    static final long ASSIGNMENT_TIMEOUT_MILLIS = 10_000;

    private final String nodeId;
    private final KafkaProducer<String, byte[]> producer;
    private final Function<String, KafkaConsumer<String, byte[]>> consumerFactory;
    private final long assignmentTimeoutMillis;
    private final Map<String, KafkaConsumer<String, byte[]>> consumers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final StreamingMetrics metrics;

    public KafkaMessageBroker(Vertx vertx, String bootstrapServers, OpenTelemetry ot) {
        this(KafkaProducer.create(vertx, producerConfig(bootstrapServers)),
                groupId -> KafkaConsumer.create(vertx, consumerConfig(bootstrapServers, groupId)),
                ASSIGNMENT_TIMEOUT_MILLIS, ot);
        logger.atInfo()
                .addArgument(bootstrapServers)
                .addArgument(nodeId)
                .log("Kafka broker adapter created for {} on node {}");
    }

    /**
     * @param consumerFactory creates an unsubscribed consumer for a consumer
     *                        group id
     */
    public KafkaMessageBroker(KafkaProducer<String, byte[]> producer,
            Function<String, KafkaConsumer<String, byte[]>> consumerFactory, long assignmentTimeoutMillis,
            OpenTelemetry ot) {
        this.nodeId = UUID.randomUUID().toString().substring(0, 8);
        this.producer = producer;
        this.consumerFactory = consumerFactory;
        this.assignmentTimeoutMillis = assignmentTimeoutMillis;
        this.metrics = new StreamingMetrics(ot.getMeter("kafka_broker"));
    }

    static Map<String, String> producerConfig(String bootstrapServers) {
        Map<String, String> config = new HashMap<>();
        config.put("bootstrap.servers", bootstrapServers);
        config.put("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        config.put("value.serializer", "org.apache.kafka.common.serialization.ByteArraySerializer");
        config.put("acks", "all");
        config.put("max.block.ms", "5000");
        return config;
    }

    static Map<String, String> consumerConfig(String bootstrapServers, String groupId) {
        Map<String, String> config = new HashMap<>();
        config.put("bootstrap.servers", bootstrapServers);
        config.put("key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        config.put("value.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        config.put("group.id", groupId);
        config.put("auto.offset.reset", "latest");
        config.put("enable.auto.commit", "true");
        return config;
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
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

        return producer.send(KafkaProducerRecord.create(topic, topic, payload))
                .toCompletionStage()
                .toCompletableFuture()
                .handle((metadata, error) -> {
                    if (error != null) {
                        metrics.recordPublishFailed(topic);
                        logger.atWarn()
                                .addArgument(topic)
                                .setCause(error)
                                .log("Kafka rejected message for topic {}");
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
        KafkaConsumer<String, byte[]> consumer = consumerFactory.apply(
                GROUP_PREFIX + nodeId + "-" + subscription.id());
        CompletableFuture<Void> positioned = new CompletableFuture<>();

        consumer.handler(record -> deliver(topic, record.value(), subscriber));
        consumer.partitionsAssignedHandler(partitions -> pinPositions(topic, consumer, partitions, positioned));
        consumer.exceptionHandler(error -> {
            logger.atWarn()
                    .addArgument(topic)
                    .setCause(error)
                    .log("Kafka consumer for topic {} failed");
            if (!positioned.completeExceptionally(error)) {
                subscriber.onError(error);
            }
        });
        consumers.put(subscription.id(), consumer);
        consumer.subscribe(topic).onFailure(positioned::completeExceptionally);

        return positioned
                .orTimeout(assignmentTimeoutMillis, TimeUnit.MILLISECONDS)
                .handle((v, error) -> {
                    if (error != null) {
                        consumers.remove(subscription.id());
                        consumer.close();
                        logger.atWarn()
                                .addArgument(topic)
                                .setCause(error)
                                .log("Failed to subscribe to Kafka topic {}");
                        throw new BrokerException(topic, "Failed to subscribe to " + topic, error);
                    }
                    metrics.recordSubscriberAdded(topic);
                    logger.atDebug().log("Subscribed to Kafka topic: {}", topic);
                    return subscription;
                });
    }

    /**
     * Resolves the position of every assigned partition of the topic, fixing
     * the latest offset as the starting point before the subscription is
     * reported.
     */
    private void pinPositions(String topic, KafkaConsumer<String, byte[]> consumer,
            Set<TopicPartition> partitions, CompletableFuture<Void> positioned) {
        if (positioned.isDone()) {
            return;
        }
        List<TopicPartition> own = partitions.stream()
                .filter(partition -> topic.equals(partition.getTopic()))
                .collect(Collectors.toList());
        if (own.isEmpty()) {
            // topic not created yet, wait for the next assignment
            return;
        }
        CompletableFuture<?>[] positions = own.stream()
                .map(partition -> consumer.position(partition).toCompletionStage().toCompletableFuture())
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(positions).whenComplete((v, error) -> {
            if (error != null) {
                positioned.completeExceptionally(error);
            } else {
                logger.atDebug()
                        .addArgument(own.size())
                        .addArgument(topic)
                        .log("Assigned {} partition(s) of Kafka topic {}");
                positioned.complete(null);
            }
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
        KafkaConsumer<String, byte[]> consumer = consumers.remove(subscription.id());
        if (consumer == null) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordSubscriberRemoved(subscription.topic());
        return consumer.close()
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
        logger.atInfo().log("Closing Kafka broker adapter");
        for (KafkaConsumer<String, byte[]> consumer : List.copyOf(consumers.values())) {
            consumer.close().onFailure(e -> logger.atWarn()
                    .setCause(e)
                    .log("Error closing Kafka consumer"));
        }
        consumers.clear();
        producer.close().onFailure(e -> logger.atWarn()
                .setCause(e)
                .log("Error closing Kafka producer"));
    }
}
