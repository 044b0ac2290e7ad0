package com.p14n.entitystream.registry;

/**
 * A connection failed to accept an outbound envelope.
 */
public class DeliveryException extends RuntimeException {

    private final String connectionId;

    public DeliveryException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }

    public DeliveryException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }
}
