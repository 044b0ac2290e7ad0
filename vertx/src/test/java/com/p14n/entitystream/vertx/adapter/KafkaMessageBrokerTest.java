package com.p14n.entitystream.vertx.adapter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.p14n.entitystream.broker.BrokerException;
import com.p14n.entitystream.broker.BrokerSubscription;
import com.p14n.entitystream.broker.MessageSubscriber;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import io.vertx.kafka.client.consumer.KafkaConsumerRecord;
import io.vertx.kafka.client.producer.KafkaProducer;
import io.vertx.kafka.client.producer.KafkaProducerRecord;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class KafkaMessageBrokerTest {

    private static final String TOPIC = "entity.product.42";
    private static final long ASSIGNMENT_TIMEOUT_MILLIS = 200;

    private KafkaProducer<String, byte[]> producer;
    private final Deque<KafkaConsumer<String, byte[]>> prepared = new ArrayDeque<>();
    private final List<KafkaConsumer<String, byte[]>> created = new CopyOnWriteArrayList<>();
    private final List<String> groupIds = new CopyOnWriteArrayList<>();
    private KafkaMessageBroker broker;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        producer = Mockito.mock(KafkaProducer.class);
        when(producer.close()).thenReturn(Future.succeededFuture());
        broker = new KafkaMessageBroker(producer, groupId -> {
            groupIds.add(groupId);
            KafkaConsumer<String, byte[]> consumer = prepared.isEmpty() ? consumer() : prepared.poll();
            created.add(consumer);
            return consumer;
        }, ASSIGNMENT_TIMEOUT_MILLIS, OpenTelemetry.noop());
    }

    @SuppressWarnings("unchecked")
    private static KafkaConsumer<String, byte[]> consumer() {
        KafkaConsumer<String, byte[]> consumer = Mockito.mock(KafkaConsumer.class);
        when(consumer.subscribe(anyString())).thenReturn(Future.succeededFuture());
        when(consumer.close()).thenReturn(Future.succeededFuture());
        when(consumer.position(any(TopicPartition.class))).thenReturn(Future.succeededFuture(0L));
        return consumer;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Handler<Set<TopicPartition>> assignedHandler(KafkaConsumer<String, byte[]> consumer) {
        ArgumentCaptor<Handler> captor = ArgumentCaptor.forClass(Handler.class);
        verify(consumer).partitionsAssignedHandler(captor.capture());
        return captor.getValue();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Handler<KafkaConsumerRecord<String, byte[]>> recordHandler(KafkaConsumer<String, byte[]> consumer) {
        ArgumentCaptor<Handler> captor = ArgumentCaptor.forClass(Handler.class);
        verify(consumer).handler(captor.capture());
        return captor.getValue();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Handler<Throwable> exceptionHandler(KafkaConsumer<String, byte[]> consumer) {
        ArgumentCaptor<Handler> captor = ArgumentCaptor.forClass(Handler.class);
        verify(consumer).exceptionHandler(captor.capture());
        return captor.getValue();
    }

    private BrokerSubscription subscribed(MessageSubscriber<byte[]> subscriber) throws Exception {
        CompletableFuture<BrokerSubscription> future = broker.subscribe(TOPIC, subscriber);
        assignedHandler(created.get(created.size() - 1)).handle(Set.of(new TopicPartition(TOPIC, 0)));
        return future.get(1, TimeUnit.SECONDS);
    }

    @Test
    void shouldCompleteSubscriptionOnlyOncePartitionsArePositioned() throws Exception {
        CompletableFuture<BrokerSubscription> future = broker.subscribe(TOPIC, new Collecting());
        KafkaConsumer<String, byte[]> consumer = created.get(0);
        verify(consumer).subscribe(TOPIC);
        assertFalse(future.isDone());

        assignedHandler(consumer).handle(Set.of());
        assignedHandler(consumer).handle(Set.of(new TopicPartition("entity.product.43", 0)));
        assertFalse(future.isDone());

        assignedHandler(consumer).handle(Set.of(new TopicPartition(TOPIC, 0), new TopicPartition(TOPIC, 1)));

        BrokerSubscription subscription = future.get(1, TimeUnit.SECONDS);
        assertEquals(TOPIC, subscription.topic());
        verify(consumer, times(2)).position(any(TopicPartition.class));
    }

    @Test
    void shouldFailSubscriptionWhenPartitionsAreNeverAssigned() {
        CompletableFuture<BrokerSubscription> future = broker.subscribe(TOPIC, new Collecting());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));

        assertInstanceOf(BrokerException.class, e.getCause());
        verify(created.get(0)).close();
        assertEquals(0, broker.consumerCount());
    }

    @Test
    void shouldFailSubscriptionWhenConsumerCannotSubscribe() {
        KafkaConsumer<String, byte[]> refusing = consumer();
        when(refusing.subscribe(anyString())).thenReturn(Future.failedFuture(new IllegalStateException("no broker")));
        prepared.add(refusing);

        CompletableFuture<BrokerSubscription> future = broker.subscribe(TOPIC, new Collecting());

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(BrokerException.class, e.getCause());
        verify(refusing).close();
        assertEquals(0, broker.consumerCount());
    }

    @Test
    void shouldFailSubscriptionOnConsumerErrorBeforeAssignment() {
        Collecting subscriber = new Collecting();
        CompletableFuture<BrokerSubscription> future = broker.subscribe(TOPIC, subscriber);

        exceptionHandler(created.get(0)).handle(new IllegalStateException("auth failed"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(BrokerException.class, e.getCause());
        assertTrue(subscriber.errors.isEmpty());
    }

    @Test
    void shouldReportConsumerErrorsToSubscriberAfterSubscribing() throws Exception {
        Collecting subscriber = new Collecting();
        subscribed(subscriber);
        IllegalStateException failure = new IllegalStateException("rebalance failed");

        exceptionHandler(created.get(0)).handle(failure);

        assertEquals(List.of(failure), subscriber.errors);
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldDeliverRecordsToSubscriber() throws Exception {
        Collecting subscriber = new Collecting();
        subscribed(subscriber);
        KafkaConsumerRecord<String, byte[]> record = Mockito.mock(KafkaConsumerRecord.class);
        when(record.value()).thenReturn("{\"price\":9.99}".getBytes(StandardCharsets.UTF_8));

        recordHandler(created.get(0)).handle(record);

        assertEquals(List.of("{\"price\":9.99}"), subscriber.messages);
    }

    @Test
    void shouldUseOwnConsumerGroupPerSubscription() throws Exception {
        subscribed(new Collecting());
        subscribed(new Collecting());

        assertEquals(2, groupIds.size());
        assertNotEquals(groupIds.get(0), groupIds.get(1));
        assertTrue(groupIds.get(0).startsWith(KafkaMessageBroker.GROUP_PREFIX));
    }

    @Test
    void shouldCloseConsumerOnceOnRepeatedUnsubscribe() throws Exception {
        BrokerSubscription subscription = subscribed(new Collecting());

        broker.unsubscribe(subscription).get(1, TimeUnit.SECONDS);
        broker.unsubscribe(subscription).get(1, TimeUnit.SECONDS);

        verify(created.get(0), times(1)).close();
        assertEquals(0, broker.consumerCount());
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    @Test
    void shouldPublishKeyedByTopic() throws Exception {
        when(producer.send(any())).thenReturn(Future.succeededFuture());

        broker.publish(TOPIC, "{}".getBytes(StandardCharsets.UTF_8)).get(1, TimeUnit.SECONDS);

        ArgumentCaptor<KafkaProducerRecord> captor = ArgumentCaptor.forClass(KafkaProducerRecord.class);
        verify(producer).send(captor.capture());
        assertEquals(TOPIC, captor.getValue().topic());
        assertEquals(TOPIC, captor.getValue().key());
    }

    @Test
    void shouldWrapRejectedPublishInBrokerException() {
        when(producer.send(any())).thenReturn(Future.failedFuture(new IllegalStateException("not leader")));

        CompletableFuture<Void> future = broker.publish(TOPIC, "{}".getBytes(StandardCharsets.UTF_8));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        BrokerException cause = assertInstanceOf(BrokerException.class, e.getCause());
        assertEquals(TOPIC, cause.topic());
    }

    @Test
    void shouldCloseClientsAndRejectUseAfterClose() throws Exception {
        subscribed(new Collecting());

        broker.close();
        broker.close();

        verify(created.get(0)).close();
        verify(producer).close();
        assertThrows(IllegalStateException.class, () -> broker.publish(TOPIC, new byte[0]));
        assertThrows(IllegalStateException.class, () -> broker.subscribe(TOPIC, new Collecting()));
        verify(producer, never()).send(any());
    }

    private static class Collecting implements MessageSubscriber<byte[]> {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onMessage(byte[] message) {
            messages.add(new String(message, StandardCharsets.UTF_8));
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }
    }
}
