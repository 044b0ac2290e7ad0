package com.p14n.entitystream.registry;

import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.protocol.OutboundEnvelope;

/**
 * One live client session as seen by the {@link ConnectionRegistry}.
 */
public interface ClientConnection {

    /**
     * @return identifier unique among live connections
     */
    String id();

    Principal principal();

    boolean isOpen();

    /**
     * Hands an envelope to the connection's outbound path.
     *
     * @param envelope the envelope to send
     * @return true if the envelope was accepted, false if the connection is
     *         already closed
     * @throws DeliveryException if the transport failed to accept the envelope
     */
    boolean send(OutboundEnvelope envelope);

    /**
     * Closes the underlying transport. Calling it more than once has no
     * further effect.
     *
     * @param reason human-readable close reason
     */
    void close(String reason);
}
