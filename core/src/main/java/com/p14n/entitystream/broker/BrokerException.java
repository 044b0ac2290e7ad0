package com.p14n.entitystream.broker;

/**
 * Raised (usually as the cause of a failed future) when a backing broker
 * rejects or cannot complete a publish or subscribe call.
 */
public class BrokerException extends RuntimeException {

    private final String topic;

    public BrokerException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public BrokerException(String topic, String message) {
        this(topic, message, null);
    }

    public String topic() {
        return topic;
    }
}
