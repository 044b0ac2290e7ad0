package com.p14n.entitystream.protocol;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation names used on the wire. Only {@link #SUBSCRIBE},
 * {@link #UNSUBSCRIBE} and {@link #PUBLISH} may be sent by clients; the others
 * are server-initiated.
 */
public enum Operation {
    CONNECT("connect"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    PUBLISH("publish"),
    MESSAGE("message"),
    ERROR("error");

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isClientOperation() {
        return this == SUBSCRIBE || this == UNSUBSCRIBE || this == PUBLISH;
    }

    public static Optional<Operation> fromClient(String name) {
        for (Operation operation : values()) {
            if (operation.isClientOperation() && operation.wireName.equals(name)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
