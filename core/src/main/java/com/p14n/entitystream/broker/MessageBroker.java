package com.p14n.entitystream.broker;

import java.util.concurrent.CompletableFuture;

/**
 * Thread-safe publish/subscribe abstraction over a backing message broker.
 * Implementations hide the transport (log based or queue based) behind the
 * same caller-visible semantics.
 *
 * <p>
 * Guarantees:
 * </p>
 * <ul>
 * <li>a successfully completed {@link #publish} means the broker accepted the
 * message for delivery; it does not mean any subscriber received it</li>
 * <li>subscribers are called asynchronously, once per delivered message
 * (at-least-once)</li>
 * <li>within one topic the backend's order is preserved; across topics no
 * order is guaranteed</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * broker.subscribe("entity.product.42", new MessageSubscriber<>() {
 *     public void onMessage(byte[] payload) { ... }
 *     public void onError(Throwable error) { ... }
 * }).thenAccept(handle -> ...);
 *
 * broker.publish("entity.product.42", json.getBytes(StandardCharsets.UTF_8));
 * }</pre>
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Publishes a payload to a topic. A single attempt is made; failures are
     * not retried.
     *
     * @param topic   The topic to publish to
     * @param payload The raw payload
     * @return a future completing when the broker accepted the message, or
     *         exceptionally with a {@link BrokerException}
     */
    CompletableFuture<Void> publish(String topic, byte[] payload);

    /**
     * Registers a subscriber for a topic. Topics need no prior creation.
     *
     * @param topic      The topic to subscribe to
     * @param subscriber Callback for delivered payloads
     * @return a future with the subscription handle, or completing
     *         exceptionally with a {@link BrokerException}
     */
    CompletableFuture<BrokerSubscription> subscribe(String topic, MessageSubscriber<byte[]> subscriber);

    /**
     * Cancels a subscription. Unknown or already cancelled handles are ignored.
     *
     * @param subscription The handle returned by {@link #subscribe}
     * @return a future completing once the subscription is cancelled
     */
    CompletableFuture<Void> unsubscribe(BrokerSubscription subscription);

    /**
     * Closes the broker and releases any resources.
     * After closing, no more messages can be published or subscribers added.
     */
    @Override
    void close();
}
