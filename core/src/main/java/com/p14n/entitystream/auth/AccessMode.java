package com.p14n.entitystream.auth;

/**
 * What a principal intends to do with a topic.
 */
public enum AccessMode {
    SUBSCRIBE,
    PUBLISH
}
