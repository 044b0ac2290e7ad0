package com.p14n.entitystream.vertx;

import com.p14n.entitystream.registry.BufferedClientConnection;
import com.p14n.entitystream.registry.FrameSink;

import io.vertx.core.http.ServerWebSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FrameSink} writing text frames to a Vert.x server WebSocket.
 * Writability follows the socket's write queue.
 */
public class WebSocketFrameSink implements FrameSink {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameSink.class);

    static final short NORMAL_CLOSURE = 1000;
    static final short POLICY_VIOLATION = 1008;

    private final ServerWebSocket webSocket;

    public WebSocketFrameSink(ServerWebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public boolean isWritable() {
        return !webSocket.isClosed() && !webSocket.writeQueueFull();
    }

    @Override
    public void write(String frame) {
        if (webSocket.isClosed()) {
            throw new IllegalStateException("WebSocket is closed");
        }
        webSocket.writeTextMessage(frame).onFailure(e -> logger.atDebug()
                .setCause(e)
                .log("Write to WebSocket failed"));
    }

    @Override
    public void close(String reason) {
        if (webSocket.isClosed()) {
            return;
        }
        short status = BufferedClientConnection.SLOW_CONSUMER.equals(reason) ? POLICY_VIOLATION : NORMAL_CLOSURE;
        webSocket.close(status, reason).onFailure(e -> logger.atDebug()
                .setCause(e)
                .log("Closing WebSocket failed"));
    }
}
