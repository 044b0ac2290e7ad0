package com.p14n.entitystream.broker;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.opentelemetry.api.OpenTelemetry;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class InMemoryMessageBrokerTest {

    private static final String TOPIC = "entity.product.42";

    private volatile InMemoryMessageBroker broker;

    @BeforeEach
    void setUp() {
        broker = new InMemoryMessageBroker(OpenTelemetry.noop(), "test");
    }

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.close();
            broker = null;
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldDeliverMessageToMultipleSubscribers() throws InterruptedException {
        CountDownLatch counter1 = new CountDownLatch(1);
        CountDownLatch counter2 = new CountDownLatch(1);

        MessageSubscriber<byte[]> subscriber1 = new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                counter1.countDown();
            }

            @Override
            public void onError(Throwable error) {
            }
        };

        MessageSubscriber<byte[]> subscriber2 = new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                counter2.countDown();
            }

            @Override
            public void onError(Throwable error) {
            }
        };

        broker.subscribe(TOPIC, subscriber1);
        broker.subscribe(TOPIC, subscriber2);

        broker.publish(TOPIC, bytes("{}")).join();

        assertTrue(counter1.await(1, TimeUnit.SECONDS));
        assertTrue(counter2.await(1, TimeUnit.SECONDS));
    }

    @Test
    void shouldAcceptPublishWithNoSubscribers() {
        assertTrue(broker.publish(TOPIC, bytes("{}")).isDone());
        assertEquals(0, broker.subscriberCount(TOPIC));
    }

    @Test
    void shouldNotifySubscriberOfErrors() throws InterruptedException {
        AtomicReference<Throwable> caughtError = new AtomicReference<>();
        CountDownLatch counter = new CountDownLatch(1);
        RuntimeException testException = new RuntimeException("test error");

        MessageSubscriber<byte[]> erroringSubscriber = new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                throw testException;
            }

            @Override
            public void onError(Throwable error) {
                caughtError.set(error);
                counter.countDown();
            }
        };

        broker.subscribe(TOPIC, erroringSubscriber);
        broker.publish(TOPIC, bytes("{}"));

        assertTrue(counter.await(1, TimeUnit.SECONDS));
        assertSame(testException, caughtError.get());
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        broker = new InMemoryMessageBroker(executor, OpenTelemetry.noop(), "test");
        List<String> received = new CopyOnWriteArrayList<>();

        BrokerSubscription subscription = broker.subscribe(TOPIC, collecting(received)).join();
        broker.publish(TOPIC, bytes("first"));
        executor.runAll();

        broker.unsubscribe(subscription).join();
        broker.publish(TOPIC, bytes("second"));
        executor.runAll();

        assertEquals(List.of("first"), received);
        assertEquals(0, broker.subscriberCount(TOPIC));
    }

    @Test
    void shouldIgnoreRepeatedUnsubscribe() {
        BrokerSubscription subscription = broker.subscribe(TOPIC, collecting(new ArrayList<>())).join();

        broker.unsubscribe(subscription).join();
        assertDoesNotThrow(() -> broker.unsubscribe(subscription).join());
    }

    @Test
    void shouldKeepTopicsApart() {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        broker = new InMemoryMessageBroker(executor, OpenTelemetry.noop(), "test");
        List<String> products = new CopyOnWriteArrayList<>();
        List<String> orders = new CopyOnWriteArrayList<>();

        broker.subscribe("entity.product.1", collecting(products));
        broker.subscribe("entity.order.1", collecting(orders));
        broker.publish("entity.product.1", bytes("p"));
        broker.publish("entity.order.1", bytes("o"));
        executor.runAll();

        assertEquals(List.of("p"), products);
        assertEquals(List.of("o"), orders);
    }

    @Test
    void shouldHandleConcurrentPublishes() throws InterruptedException {
        int threadCount = 3;
        int perThread = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch received = new CountDownLatch(threadCount * perThread);
        AtomicInteger count = new AtomicInteger();

        broker.subscribe(TOPIC, new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                count.incrementAndGet();
                received.countDown();
            }

            @Override
            public void onError(Throwable error) {
            }
        });

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < perThread; j++) {
                        broker.publish(TOPIC, bytes("m" + j));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }).start();
        }

        startLatch.countDown();
        assertTrue(received.await(1, TimeUnit.SECONDS));
        assertEquals(threadCount * perThread, count.get());
    }

    @Test
    void shouldForgetTopicsWithoutSubscribers() {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        broker = new InMemoryMessageBroker(executor, OpenTelemetry.noop(), "test");

        for (int i = 0; i < 1000; i++) {
            String topic = "entity.product." + i;
            BrokerSubscription subscription = broker.subscribe(topic, collecting(new ArrayList<>())).join();
            broker.publish(topic, bytes("{}"));
            broker.unsubscribe(subscription).join();
        }
        executor.runAll();

        assertEquals(0, broker.topicCount());
        assertEquals(0, broker.subscriberCount("entity.product.0"));
    }

    @Test
    void shouldKeepTopicWhileAnySubscriberRemains() {
        BrokerSubscription first = broker.subscribe(TOPIC, collecting(new ArrayList<>())).join();
        broker.subscribe(TOPIC, collecting(new ArrayList<>())).join();

        broker.unsubscribe(first).join();

        assertEquals(1, broker.topicCount());
        assertEquals(1, broker.subscriberCount(TOPIC));
    }

    @Test
    void shouldKeepDeliveringAfterSubscriberThrowsError() {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        broker = new InMemoryMessageBroker(executor, OpenTelemetry.noop(), "test");
        List<String> received = new CopyOnWriteArrayList<>();
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        AtomicInteger calls = new AtomicInteger();

        broker.subscribe(TOPIC, new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                if (calls.incrementAndGet() == 1) {
                    throw new NoSuchMethodError("decode");
                }
                received.add(new String(message, StandardCharsets.UTF_8));
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        broker.publish(TOPIC, bytes("first"));
        broker.publish(TOPIC, bytes("second"));
        executor.runAll();

        assertEquals(List.of("second"), received);
        assertEquals(1, errors.size());
        assertInstanceOf(NoSuchMethodError.class, errors.get(0));
    }

    @Test
    void shouldShutDownOnlyAnExecutorItCreated() {
        TestAsyncExecutor owned = new TestAsyncExecutor();
        TestAsyncExecutor shared = new TestAsyncExecutor();

        new InMemoryMessageBroker(owned, true, OpenTelemetry.noop(), "test").close();
        new InMemoryMessageBroker(shared, OpenTelemetry.noop(), "test").close();

        assertTrue(owned.isShutdown());
        assertFalse(shared.isShutdown());
    }

    @Test
    void shouldRejectUseAfterClose() {
        broker.close();

        assertThrows(IllegalStateException.class, () -> broker.publish(TOPIC, bytes("{}")));
        assertThrows(IllegalStateException.class, () -> broker.subscribe(TOPIC, collecting(new ArrayList<>())));
    }

    @Test
    void shouldRejectNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> broker.publish(null, bytes("{}")));
        assertThrows(IllegalArgumentException.class, () -> broker.publish(TOPIC, null));
        assertThrows(IllegalArgumentException.class, () -> broker.subscribe(TOPIC, null));
    }

    @Property(tries = 20)
    void keepsPublishOrderPerTopic(@ForAll("randomSeeds") long seed) {
        Random random = new Random(seed);
        TestAsyncExecutor executor = new TestAsyncExecutor();
        InMemoryMessageBroker seeded = new InMemoryMessageBroker(executor, OpenTelemetry.noop(), "test");
        List<String> topics = List.of("entity.product.1", "entity.product.2", "public.news");
        Map<String, List<String>> received = new ConcurrentHashMap<>();
        Map<String, List<String>> expected = new ConcurrentHashMap<>();

        for (String topic : topics) {
            received.put(topic, new CopyOnWriteArrayList<>());
            expected.put(topic, new ArrayList<>());
            seeded.subscribe(topic, collecting(received.get(topic)));
        }

        for (int i = 0; i < 60; i++) {
            String topic = topics.get(random.nextInt(topics.size()));
            String message = topic + "#" + i;
            expected.get(topic).add(message);
            seeded.publish(topic, bytes(message));
            if (random.nextBoolean()) {
                executor.tick(random);
            }
        }
        while (executor.tick(random)) {
            // drain in random order
        }

        assertEquals(expected, received);
        seeded.close();
    }

    @Provide
    Arbitrary<Long> randomSeeds() {
        return Arbitraries.longs().between(0, Long.MAX_VALUE);
    }

    private static MessageSubscriber<byte[]> collecting(List<String> into) {
        return new MessageSubscriber<>() {
            @Override
            public void onMessage(byte[] message) {
                into.add(new String(message, StandardCharsets.UTF_8));
            }

            @Override
            public void onError(Throwable error) {
            }
        };
    }
}
