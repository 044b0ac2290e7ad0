package com.p14n.entitystream.vertx.adapter;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.p14n.entitystream.broker.BrokerException;
import com.p14n.entitystream.broker.InMemoryMessageBroker;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.data.StreamingConfig;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the {@link MessageBroker} strategy at process start. The returned
 * instance is handed to the protocol engine and the entity event publisher by
 * the caller.
 */
public class MessageBrokers {
    private static final Logger logger = LoggerFactory.getLogger(MessageBrokers.class);

    private static final long CONNECT_TIMEOUT_SECONDS = 30;

    private MessageBrokers() {
    }

    /**
     * Creates and connects the configured broker.
     *
     * @throws BrokerException if the broker cannot be reached
     */
    public static MessageBroker create(Vertx vertx, StreamingConfig config, OpenTelemetry ot)
            throws InterruptedException {
        logger.atInfo()
                .addArgument(config.brokerType())
                .addArgument(config.brokerAddress())
                .log("Creating {} broker for {}");

        switch (config.brokerType()) {
            case KAFKA:
                return new KafkaMessageBroker(vertx, config.brokerAddress(), ot);
            case RABBITMQ:
                RabbitMqMessageBroker rabbit = new RabbitMqMessageBroker(vertx,
                        RabbitMqMessageBroker.options(config.brokerHost(), config.brokerPort(),
                                config.brokerUser(), config.brokerPassword()),
                        config.publishTimeoutMillis(), ot);
                try {
                    rabbit.start().get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                } catch (ExecutionException | TimeoutException e) {
                    rabbit.close();
                    throw new BrokerException(null, "Failed to connect to RabbitMQ at " + config.brokerAddress(), e);
                }
                return rabbit;
            case MEMORY:
                return new InMemoryMessageBroker(ot, "in_memory_broker");
            default:
                throw new IllegalArgumentException("Unsupported broker: " + config.brokerType());
        }
    }
}
