package com.p14n.entitystream.auth;

import java.util.Locale;

/**
 * Decides whether a principal may subscribe or publish to a topic.
 *
 * <p>
 * Rules, first match wins:
 * </p>
 * <ol>
 * <li>administrators may do anything</li>
 * <li>{@code entity.<type>[.<id>]}: subscribe needs {@code read_<type>},
 * publish needs {@code update_<type>}</li>
 * <li>{@code user.<uid>.<suffix>}: only the principal whose id is
 * {@code <uid>}</li>
 * <li>{@code public.<suffix>}: anyone may subscribe, nobody may publish</li>
 * <li>anything else is denied</li>
 * </ol>
 *
 * Stateless and side-effect free.
 */
public class TopicAuthorizer {

    public static final String READ_PREFIX = "read_";
    public static final String UPDATE_PREFIX = "update_";

    public boolean authorize(Principal principal, String topic, AccessMode mode) {
        if (principal == null || mode == null) {
            return false;
        }
        if (principal.administrator()) {
            return true;
        }
        if (!Topic.isWellFormed(topic)) {
            return false;
        }
        Topic parsed = Topic.parse(topic);
        switch (parsed.kind()) {
            case ENTITY:
            case ENTITY_TYPE:
                return principal.hasPrivilege(requiredPrivilege(parsed.entityType(), mode));
            case USER:
                return principal.userId().equals(parsed.userId());
            case PUBLIC:
                // publishing to public topics is not granted by any privilege
                return mode == AccessMode.SUBSCRIBE;
            default:
                return false;
        }
    }

    static String requiredPrivilege(String entityType, AccessMode mode) {
        String prefix = mode == AccessMode.SUBSCRIBE ? READ_PREFIX : UPDATE_PREFIX;
        return prefix + entityType.toLowerCase(Locale.ROOT);
    }
}
