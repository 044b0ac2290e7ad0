package com.p14n.entitystream.auth;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed view of a dot-segmented topic name.
 *
 * <p>
 * Recognised shapes:
 * </p>
 * <ul>
 * <li>{@code entity.<entity_type>.<entity_id>} ({@link Kind#ENTITY})</li>
 * <li>{@code entity.<entity_type>} ({@link Kind#ENTITY_TYPE})</li>
 * <li>{@code user.<user_id>.<suffix>} ({@link Kind#USER})</li>
 * <li>{@code public.<suffix>} ({@link Kind#PUBLIC})</li>
 * </ul>
 * Anything else parses as {@link Kind#OTHER}. Topics are never declared; a
 * topic exists as soon as something subscribes or publishes to its name.
 *
 * @param name       the full topic name
 * @param kind       the recognised shape
 * @param entityType entity type for entity topics, otherwise null
 * @param entityId   entity id for {@code ENTITY} topics, otherwise null
 * @param userId     user id for {@code USER} topics, otherwise null
 */
public record Topic(String name, Kind kind, String entityType, String entityId, String userId) {

    public enum Kind {
        ENTITY,
        ENTITY_TYPE,
        USER,
        PUBLIC,
        OTHER
    }

    public static final String ENTITY_PREFIX = "entity";
    public static final String USER_PREFIX = "user";
    public static final String PUBLIC_PREFIX = "public";

    // the character set Kafka accepts in topic names, minus the dot separator
    private static final Pattern SEGMENT = Pattern.compile("^[A-Za-z0-9_\\-]+$");
    private static final int MAX_LENGTH = 249;

    /**
     * Whether a topic name is syntactically acceptable: non-empty segments of
     * letters, digits, {@code _} and {@code -}, separated by single dots, no
     * broker wildcards.
     */
    public static boolean isWellFormed(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_LENGTH) {
            return false;
        }
        for (String segment : name.split("\\.", -1)) {
            if (!SEGMENT.matcher(segment).matches()) {
                return false;
            }
        }
        return true;
    }

    public static Topic parse(String name) {
        if (!isWellFormed(name)) {
            throw new IllegalArgumentException("Malformed topic: " + name);
        }
        String[] segments = name.split("\\.");
        switch (segments[0]) {
            case ENTITY_PREFIX:
                if (segments.length == 3) {
                    return new Topic(name, Kind.ENTITY, segments[1], segments[2], null);
                }
                if (segments.length == 2) {
                    return new Topic(name, Kind.ENTITY_TYPE, segments[1], null, null);
                }
                break;
            case USER_PREFIX:
                if (segments.length == 3) {
                    return new Topic(name, Kind.USER, null, null, segments[1]);
                }
                break;
            case PUBLIC_PREFIX:
                if (segments.length == 2) {
                    return new Topic(name, Kind.PUBLIC, null, null, null);
                }
                break;
            default:
                break;
        }
        return new Topic(name, Kind.OTHER, null, null, null);
    }

    /**
     * Topic carrying the events of a single entity instance. The entity type
     * is lower-cased.
     */
    public static String forEntity(String entityType, String entityId) {
        return ENTITY_PREFIX + "." + entityType.toLowerCase(Locale.ROOT) + "." + entityId;
    }

    public boolean isEntityScoped() {
        return kind == Kind.ENTITY || kind == Kind.ENTITY_TYPE;
    }

    /**
     * Whether events can ever be published to this topic. Entity events are
     * only published under the lower-cased entity type.
     */
    public boolean isCanonical() {
        return !isEntityScoped() || entityType.equals(entityType.toLowerCase(Locale.ROOT));
    }
}
