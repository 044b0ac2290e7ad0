package com.p14n.entitystream;

import java.util.concurrent.CountDownLatch;

import com.p14n.entitystream.data.ConfigData;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        ConfigData cfg = ConfigData.fromEnv(System.getenv());
        OpenTelemetry ot = Opentelemetry.create("entity-stream", System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"));
        Vertx vertx = Vertx.vertx();

        StreamingService service;
        try {
            service = StreamingService.start(vertx, cfg, ot);
        } catch (Exception e) {
            logger.atError().setCause(e).log("Streaming service failed to start");
            vertx.close();
            throw e;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.close();
            vertx.close();
            stopped.countDown();
        }, "entity-stream-shutdown"));

        logger.atInfo()
                .addArgument(cfg.brokerType())
                .addArgument(service.port())
                .log("Entity stream running with {} broker on port {}");
        stopped.await();
    }
}
