package com.p14n.entitystream.publisher;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of entity mutation an {@link EntityEvent} describes.
 */
public enum EventType {
    CREATED,
    UPDATED,
    DELETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
