package com.p14n.entitystream.registry;

/**
 * Key of a registered connection inside the {@link ConnectionRegistry}.
 *
 * @param connectionId the id of the registered {@link ClientConnection}
 */
public record ConnectionHandle(String connectionId) {
}
