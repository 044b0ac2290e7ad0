package com.p14n.entitystream.publisher;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides, per entity type, whether mutations are streamed. Supplied by the
 * persistence layer; the two factories cover configuration driven setups.
 */
@FunctionalInterface
public interface StreamablePolicy {

    boolean isStreamable(String entityType);

    static StreamablePolicy all() {
        return entityType -> true;
    }

    /**
     * Streams only the listed entity types, compared case-insensitively.
     */
    static StreamablePolicy of(Collection<String> entityTypes) {
        Set<String> allowed = entityTypes.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        return entityType -> entityType != null && allowed.contains(entityType.toLowerCase(Locale.ROOT));
    }
}
