package com.p14n.entitystream.publisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.p14n.entitystream.auth.Topic;
import com.p14n.entitystream.broker.MessageBroker;
import com.p14n.entitystream.data.StreamingConfig;
import com.p14n.entitystream.protocol.EnvelopeCodec;
import com.p14n.entitystream.telemetry.OpenTelemetryFunctions;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes one {@link EntityEvent} per committed entity mutation.
 *
 * <p>
 * Called synchronously by the persistence layer after its transaction has
 * committed. Each event is published once to
 * {@code entity.<entity_type>.<entity_id>}; a broker failure or a publish that
 * does not complete within the configured timeout is logged and returned as a
 * {@link PublishOutcome.Status#WARNING}. This class never throws to the
 * mutation path.
 * </p>
 *
 * <pre>{@code
 * PublishOutcome outcome = publisher.onMutation("Product", "42", EventType.UPDATED,
 *         Map.of("price", 9.99));
 * if (outcome.isWarning()) {
 *     response.addWarning(outcome.warning());
 * }
 * }</pre>
 */
public class EntityEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(EntityEventPublisher.class);

    private final MessageBroker broker;
    private final StreamablePolicy policy;
    private final EnvelopeCodec codec;
    private final Duration publishTimeout;
    private final boolean enabled;
    private final Tracer tracer;
    private final Clock clock;

    public EntityEventPublisher(MessageBroker broker, StreamingConfig config, OpenTelemetry ot) {
        this(broker, config.streamablePolicy(), new EnvelopeCodec(), config.publishTimeout(), config.enabled(),
                ot.getTracer("entity_event_publisher"), Clock.systemUTC());
    }

    public EntityEventPublisher(MessageBroker broker, StreamablePolicy policy, EnvelopeCodec codec,
            Duration publishTimeout, boolean enabled, Tracer tracer, Clock clock) {
        this.broker = broker;
        this.policy = policy;
        this.codec = codec;
        this.publishTimeout = publishTimeout;
        this.enabled = enabled;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Streams a committed mutation.
     *
     * @param entityType the entity type; lower-cased in the topic
     * @param entityId   the entity id
     * @param eventType  what happened
     * @param snapshot   the entity's public fields, ignored for deletes
     * @return what happened to the event
     */
    public PublishOutcome onMutation(String entityType, String entityId, EventType eventType,
            Map<String, Object> snapshot) {
        if (!enabled) {
            return PublishOutcome.skipped();
        }
        Instant now = clock.instant();
        if (entityType == null || entityId == null || eventType == null) {
            return warn(null, "Cannot stream a mutation without entity type, id and event type", null);
        }
        if (!policy.isStreamable(entityType)) {
            return PublishOutcome.skipped();
        }
        String topic = Topic.forEntity(entityType, entityId);
        if (!Topic.isWellFormed(topic) || Topic.parse(topic).kind() != Topic.Kind.ENTITY) {
            return warn(null, "Cannot stream " + entityType + " " + entityId + ": " + topic
                    + " is not a valid entity topic", null);
        }

        return OpenTelemetryFunctions.processWithTelemetry(tracer, "publish_entity_event", topic, () -> {
            try {
                EntityEvent event = new EntityEvent(eventType, entityType, entityId, seconds(now), snapshot);
                publish(topic, codec.encodePayload(event));
                logger.atDebug()
                        .addArgument(eventType.wireName())
                        .addArgument(topic)
                        .log("Published {} event to {}");
                return PublishOutcome.published(topic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return warn(topic, "Interrupted while publishing to " + topic, e);
            } catch (TimeoutException e) {
                return warn(topic, "Timed out after " + publishTimeout.toMillis() + "ms publishing to " + topic, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                return warn(topic, "Failed to publish to " + topic + ": " + cause.getMessage(), cause);
            } catch (RuntimeException e) {
                return warn(topic, "Failed to publish to " + topic + ": " + e.getMessage(), e);
            }
        });
    }

    private void publish(String topic, byte[] payload)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Void> published = broker.publish(topic, payload);
        published.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private PublishOutcome warn(String topic, String message, Throwable cause) {
        logger.atWarn()
                .setCause(cause)
                .log(message);
        return PublishOutcome.warning(topic, message);
    }

    public PublishOutcome onCreated(String entityType, String entityId, Map<String, Object> snapshot) {
        return onMutation(entityType, entityId, EventType.CREATED, snapshot);
    }

    public PublishOutcome onUpdated(String entityType, String entityId, Map<String, Object> snapshot) {
        return onMutation(entityType, entityId, EventType.UPDATED, snapshot);
    }

    public PublishOutcome onDeleted(String entityType, String entityId) {
        return onMutation(entityType, entityId, EventType.DELETED, null);
    }

    static double seconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
