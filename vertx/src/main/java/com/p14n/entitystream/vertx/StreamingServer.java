package com.p14n.entitystream.vertx;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.auth.PrincipalResolver;
import com.p14n.entitystream.data.StreamingConfig;
import com.p14n.entitystream.protocol.ProtocolEngine;
import com.p14n.entitystream.protocol.ProtocolSession;
import com.p14n.entitystream.registry.BufferedClientConnection;
import com.p14n.entitystream.registry.DeliveryException;
import com.p14n.entitystream.telemetry.StreamingMetrics;

import io.netty.handler.codec.http.QueryStringDecoder;
import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.ServerWebSocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket endpoint of the streaming service.
 *
 * <p>
 * The bearer token is read from the {@code Authorization} header or, for
 * browsers that cannot set headers on a WebSocket, from the {@code token}
 * query parameter. It is validated before the upgrade; an invalid token is
 * answered with HTTP 401 and no session is created. Accepted sockets get a
 * {@link BufferedClientConnection} and a {@link ProtocolSession}.
 * </p>
 *
 * <pre>{@code
 * StreamingServer server = new StreamingServer(vertx, engine, resolver, config, ot);
 * server.start(8000);
 * ...
 * server.stop();
 * }</pre>
 */
public class StreamingServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamingServer.class);

    static final String BEARER_PREFIX = "Bearer ";
    static final String TOKEN_PARAM = "token";
    private static final long START_TIMEOUT_SECONDS = 30;

    private final Vertx vertx;
    private final ProtocolEngine engine;
    private final PrincipalResolver resolver;
    private final StreamingConfig config;
    private final StreamingMetrics metrics;
    private HttpServer server;

    public StreamingServer(Vertx vertx, ProtocolEngine engine, PrincipalResolver resolver, StreamingConfig config,
            OpenTelemetry ot) {
        this.vertx = vertx;
        this.engine = engine;
        this.resolver = resolver;
        this.config = config;
        this.metrics = new StreamingMetrics(ot.getMeter("streaming_server"));
    }

    public void start() throws IOException, InterruptedException {
        start(config.serverPort());
    }

    /**
     * Binds the endpoint and waits until it is listening.
     *
     * @param port the port to listen on, 0 for any free port
     */
    public void start(int port) throws IOException, InterruptedException {
        logger.atInfo()
                .addArgument(port)
                .addArgument(config.path())
                .log("Starting streaming server on port {} at {}");

        HttpServer created = vertx.createHttpServer(new HttpServerOptions().setPort(port))
                .webSocketHandler(this::accept);
        try {
            server = created.listen()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start streaming server");
            throw new IOException("Failed to start streaming server on port " + port, e);
        }

        logger.atInfo()
                .addArgument(server.actualPort())
                .log("Streaming server listening on port {}");
    }

    /**
     * @return the bound port, or -1 before {@link #start} completed
     */
    public int port() {
        return server == null ? -1 : server.actualPort();
    }

    private void accept(ServerWebSocket webSocket) {
        if (!config.path().equals(webSocket.path())) {
            webSocket.setHandshake(Future.succeededFuture(404));
            return;
        }
        Promise<Integer> handshake = Promise.promise();
        Future<Integer> upgraded = webSocket.setHandshake(handshake.future());

        resolver.resolve(token(webSocket)).whenComplete((principal, error) -> {
            if (error != null) {
                logger.atInfo()
                        .addArgument(webSocket.remoteAddress())
                        .addArgument(error.getMessage())
                        .log("Rejected stream connection from {}: {}");
                handshake.complete(401);
                return;
            }
            handshake.complete(101);
            upgraded.onSuccess(status -> {
                if (status == 101) {
                    attach(webSocket, principal);
                }
            });
        });
    }

    private void attach(ServerWebSocket webSocket, Principal principal) {
        BufferedClientConnection connection = new BufferedClientConnection(UUID.randomUUID().toString(),
                principal,
                new WebSocketFrameSink(webSocket),
                engine.codec(),
                config.outboundQueueSize(),
                config.overflowPolicy(),
                metrics);
        ProtocolSession session = engine.openSession(connection);

        webSocket.textMessageHandler(session::onFrame);
        webSocket.drainHandler(v -> flush(connection));
        webSocket.closeHandler(v -> session.close());
        webSocket.exceptionHandler(e -> {
            logger.atWarn()
                    .addArgument(connection.id())
                    .setCause(e)
                    .log("Transport failure on connection {}");
            session.close();
        });
        if (webSocket.isClosed()) {
            session.close();
        }
    }

    private void flush(BufferedClientConnection connection) {
        try {
            connection.flush();
        } catch (DeliveryException e) {
            logger.atWarn()
                    .addArgument(connection.id())
                    .setCause(e)
                    .log("Failed to flush connection {}");
        }
    }

    static String token(ServerWebSocket webSocket) {
        String header = webSocket.headers().get(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return queryToken(webSocket.query());
    }

    static String queryToken(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        Map<String, List<String>> params = new QueryStringDecoder(query, false).parameters();
        List<String> values = params.get(TOKEN_PARAM);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Closes all sessions and stops listening.
     */
    public void stop() {
        logger.atInfo().log("Stopping streaming server");

        engine.close();
        if (server != null) {
            try {
                server.close()
                        .toCompletionStage()
                        .toCompletableFuture()
                        .get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.atWarn().setCause(e).log("Interrupted while stopping streaming server");
            } catch (ExecutionException | TimeoutException e) {
                logger.atWarn().setCause(e).log("Error stopping streaming server");
            }
            server = null;
        }

        logger.atInfo().log("Streaming server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
