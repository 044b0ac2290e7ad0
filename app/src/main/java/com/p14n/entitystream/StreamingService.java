package com.p14n.entitystream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.p14n.entitystream.broker.InMemoryMessageBroker;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.data.StreamingConfig;
import com.p14n.entitystream.protocol.ProtocolEngine;
import com.p14n.entitystream.publisher.EntityEventPublisher;
import com.p14n.entitystream.vertx.StreamingServer;
import com.p14n.entitystream.vertx.adapter.MessageBrokers;
import com.p14n.entitystream.vertx.auth.JwtPrincipalResolver;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the streaming subsystem together: one broker instance shared by the
 * protocol engine and the entity event publisher, and the WebSocket server in
 * front of the engine.
 *
 * <p>
 * With streaming disabled no broker connection or server is created and the
 * publisher skips every mutation.
 * </p>
 */
public class StreamingService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamingService.class);

    private final EntityEventPublisher publisher;
    private final StreamingServer server;
    private final List<AutoCloseable> closeables;

    private StreamingService(EntityEventPublisher publisher, StreamingServer server, List<AutoCloseable> closeables) {
        this.publisher = publisher;
        this.server = server;
        this.closeables = closeables;
    }

    public static StreamingService start(Vertx vertx, StreamingConfig config, OpenTelemetry ot)
            throws IOException, InterruptedException {
        if (!config.enabled()) {
            logger.atInfo().log("Streaming is disabled");
            MessageBroker idle = new InMemoryMessageBroker(ot, "in_memory_broker");
            return new StreamingService(new EntityEventPublisher(idle, config, ot), null, List.of(idle));
        }

        logger.atInfo().log("Starting streaming service");
        List<AutoCloseable> closeables = new ArrayList<>();
        MessageBroker broker = MessageBrokers.create(vertx, config, ot);
        closeables.add(broker);
        try {
            ProtocolEngine engine = new ProtocolEngine(broker, ot);
            StreamingServer server = new StreamingServer(vertx, engine,
                    new JwtPrincipalResolver(vertx, config.jwtSecret(), config.jwtAlgorithm()), config, ot);
            server.start();
            // the server closes the engine's sessions before the broker is closed
            closeables.add(0, server);
            return new StreamingService(new EntityEventPublisher(broker, config, ot), server,
                    List.copyOf(closeables));
        } catch (IOException | InterruptedException | RuntimeException e) {
            closeAll(closeables);
            throw e;
        }
    }

    /**
     * Entry point for the persistence layer.
     */
    public EntityEventPublisher publisher() {
        return publisher;
    }

    /**
     * @return the server port, or -1 when streaming is disabled
     */
    public int port() {
        return server == null ? -1 : server.port();
    }

    @Override
    public void close() {
        logger.atInfo().log("Stopping streaming service");
        closeAll(closeables);
    }

    private static void closeAll(List<AutoCloseable> closeables) {
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
    }
}
