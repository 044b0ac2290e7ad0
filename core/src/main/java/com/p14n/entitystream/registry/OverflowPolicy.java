package com.p14n.entitystream.registry;

import java.util.Locale;

/**
 * What a connection does when its outbound queue is full.
 */
public enum OverflowPolicy {
    /** Discard the oldest queued frame to make room. */
    DROP_OLDEST,
    /** Close the connection as a slow consumer. */
    DISCONNECT;

    public static OverflowPolicy fromName(String name) {
        String normalised = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown overflow policy: " + name, e);
        }
    }
}
