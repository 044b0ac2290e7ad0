package com.p14n.entitystream.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A validated client request.
 *
 * @param operation  one of subscribe, unsubscribe, publish
 * @param topic      a well-formed topic name
 * @param data       payload for publish, may be null
 * @param entityType informational entity type, may be null
 * @param entityId   informational entity id, may be null
 */
public record InboundEnvelope(Operation operation,
        String topic,
        ObjectNode data,
        String entityType,
        String entityId) {

    public InboundEnvelope {
        if (operation == null || !operation.isClientOperation()) {
            throw new IllegalArgumentException("Not a client operation: " + operation);
        }
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
    }
}
