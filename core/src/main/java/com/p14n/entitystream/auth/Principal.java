package com.p14n.entitystream.auth;

import java.util.Set;

/**
 * Authenticated identity of a client connection.
 *
 * @param userId        stable user id, compared against {@code user.<uid>.*}
 *                      topics
 * @param username      display name, may be null
 * @param privileges    granted privilege names, conventionally
 *                      {@code <action>_<entity_type>}
 * @param administrator whether the principal holds the administrator
 *                      capability
 */
public record Principal(String userId, String username, Set<String> privileges, boolean administrator) {

    public Principal {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or empty");
        }
        privileges = privileges == null ? Set.of() : Set.copyOf(privileges);
    }

    public static Principal user(String userId, String... privileges) {
        return new Principal(userId, null, Set.of(privileges), false);
    }

    public static Principal admin(String userId) {
        return new Principal(userId, null, Set.of(), true);
    }

    public boolean hasPrivilege(String privilege) {
        return privileges.contains(privilege);
    }

    /**
     * Name used in greetings and log lines: the username when present,
     * otherwise the user id.
     */
    public String displayName() {
        return username != null ? username : userId;
    }
}
