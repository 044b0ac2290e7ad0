package com.p14n.entitystream.registry;

/**
 * Transport side of a {@link BufferedClientConnection}: somewhere text frames
 * can be written.
 */
public interface FrameSink {

    /**
     * @return false while the transport's own write buffer is full
     */
    boolean isWritable();

    /**
     * Writes one text frame.
     *
     * @throws RuntimeException if the transport rejects the frame
     */
    void write(String frame);

    void close(String reason);
}
