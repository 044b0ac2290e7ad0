package com.p14n.entitystream.publisher;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical payload published for one entity mutation.
 *
 * @param eventType  what happened to the entity
 * @param entityType the entity type as given by the persistence layer
 * @param entityId   the entity id
 * @param timestamp  seconds since the epoch, with fractional part
 * @param data       the entity's public fields, null for deleted entities
 */
public record EntityEvent(@JsonProperty("event_type") EventType eventType,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("data") Map<String, Object> data) {

    public EntityEvent {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (eventType == EventType.DELETED) {
            data = null;
        }
    }
}
