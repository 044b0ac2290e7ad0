package com.p14n.entitystream.broker;

import java.util.UUID;

/**
 * Handle for a subscription registered with a {@link MessageBroker}.
 *
 * @param id    unique id of the subscription within the broker
 * @param topic the topic subscribed to
 */
public record BrokerSubscription(String id, String topic) {

    public static BrokerSubscription create(String topic) {
        return new BrokerSubscription(UUID.randomUUID().toString(), topic);
    }
}
