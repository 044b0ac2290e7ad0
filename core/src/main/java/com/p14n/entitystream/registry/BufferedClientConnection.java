package com.p14n.entitystream.registry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.protocol.EnvelopeCodec;
import com.p14n.entitystream.protocol.OutboundEnvelope;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientConnection} with a bounded outbound queue in front of a
 * {@link FrameSink}.
 *
 * <p>
 * Envelopes are encoded and queued by {@link #send}, then written while the
 * sink reports itself writable. When the sink's buffer is full, frames wait in
 * the queue until the transport calls {@link #flush()} again. A full queue is
 * handled according to the {@link OverflowPolicy}, so a slow client never holds
 * up delivery to others.
 * </p>
 */
public class BufferedClientConnection implements ClientConnection {
    private static final Logger logger = LoggerFactory.getLogger(BufferedClientConnection.class);

    public static final String SLOW_CONSUMER = "slow consumer";

    private final String id;
    private final Principal principal;
    private final FrameSink sink;
    private final EnvelopeCodec codec;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final StreamingMetrics metrics;

    private final Deque<String> pending = new ArrayDeque<>();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public BufferedClientConnection(String id, Principal principal, FrameSink sink, EnvelopeCodec codec,
            int capacity, OverflowPolicy overflowPolicy, StreamingMetrics metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Outbound queue capacity must be at least 1");
        }
        this.id = id;
        this.principal = principal;
        this.sink = sink;
        this.codec = codec;
        this.capacity = capacity;
        this.overflowPolicy = overflowPolicy;
        this.metrics = metrics;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Principal principal() {
        return principal;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public boolean send(OutboundEnvelope envelope) {
        if (!open.get()) {
            return false;
        }
        String frame = codec.encode(envelope);
        boolean overflow = false;
        synchronized (pending) {
            if (pending.size() >= capacity) {
                metrics.recordOutboundDropped();
                if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                    pending.pollFirst();
                    logger.atDebug().log("Outbound queue full for connection {}, dropped oldest frame", id);
                } else {
                    overflow = true;
                }
            }
            if (!overflow) {
                pending.addLast(frame);
            }
        }
        if (overflow) {
            logger.atWarn().log("Outbound queue full for connection {}, disconnecting slow consumer", id);
            close(SLOW_CONSUMER);
            throw new DeliveryException(id, "Outbound queue full, connection closed");
        }
        flush();
        return true;
    }

    /**
     * Writes queued frames until the queue is empty or the sink stops accepting.
     * Transports call this again once their buffer drains.
     *
     * @throws DeliveryException if the sink rejected a frame; the connection is
     *                           closed
     */
    public void flush() {
        synchronized (pending) {
            while (open.get() && !pending.isEmpty() && sink.isWritable()) {
                String frame = pending.peekFirst();
                try {
                    sink.write(frame);
                } catch (RuntimeException e) {
                    close("write failed");
                    throw new DeliveryException(id, "Failed to write to connection", e);
                }
                pending.pollFirst();
            }
        }
    }

    public int queued() {
        synchronized (pending) {
            return pending.size();
        }
    }

    @Override
    public void close(String reason) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        synchronized (pending) {
            pending.clear();
        }
        try {
            sink.close(reason);
        } catch (RuntimeException e) {
            logger.atWarn()
                    .addArgument(id)
                    .setCause(e)
                    .log("Error closing transport of connection {}");
        }
    }
}
