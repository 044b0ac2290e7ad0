package com.p14n.entitystream.data;

import java.util.Locale;

/**
 * Backing broker strategies. Each can be selected by its product name or by
 * its generic kind.
 */
public enum BrokerType {
    KAFKA("kafka", "log-broker", 9092),
    RABBITMQ("rabbitmq", "queue-broker", 5672),
    MEMORY("memory", "in-memory", 0);

    private final String productName;
    private final String kindName;
    private final int defaultPort;

    BrokerType(String productName, String kindName, int defaultPort) {
        this.productName = productName;
        this.kindName = kindName;
        this.defaultPort = defaultPort;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public static BrokerType fromName(String name) {
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        for (BrokerType type : values()) {
            if (type.productName.equals(normalised) || type.kindName.equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown streaming broker: " + name);
    }
}
