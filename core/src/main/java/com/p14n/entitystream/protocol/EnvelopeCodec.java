package com.p14n.entitystream.protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.p14n.entitystream.auth.Topic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoding of envelopes and broker payloads.
 *
 * <p>
 * Decoding classifies bad input the way clients see it:
 * </p>
 * <ul>
 * <li>text that is not JSON: {@link ErrorCode#INVALID_JSON}</li>
 * <li>JSON of the wrong shape: {@link ErrorCode#VALIDATION_ERROR}</li>
 * <li>an operation clients may not send: {@link ErrorCode#INVALID_OPERATION}</li>
 * </ul>
 */
public class EnvelopeCodec {
    private static final Logger logger = LoggerFactory.getLogger(EnvelopeCodec.class);

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses and validates a client frame.
     *
     * @param text the raw frame
     * @return the validated envelope
     * @throws StreamingException with the code describing why the frame was
     *                            rejected
     */
    public InboundEnvelope decode(String text) {
        JsonNode root;
        try {
            root = text == null ? null : mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new StreamingException(ErrorCode.INVALID_JSON, "Invalid JSON format", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new StreamingException(ErrorCode.INVALID_JSON, "Invalid JSON format");
        }
        if (!root.isObject()) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR, "Envelope must be a JSON object");
        }

        String operationName = requiredText(root, "operation");
        String topic = requiredText(root, "topic");

        Operation operation = Operation.fromClient(operationName)
                .orElseThrow(() -> new StreamingException(ErrorCode.INVALID_OPERATION,
                        "Unknown operation: " + operationName));

        if (!Topic.isWellFormed(topic)) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR, "Malformed topic: " + topic);
        }
        if (!Topic.parse(topic).isCanonical()) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR,
                    "Entity type must be lower case in topic: " + topic);
        }

        ObjectNode data = null;
        JsonNode dataNode = root.get("data");
        if (dataNode != null && !dataNode.isNull()) {
            if (!dataNode.isObject()) {
                throw new StreamingException(ErrorCode.VALIDATION_ERROR, "data must be a JSON object");
            }
            data = (ObjectNode) dataNode;
        }

        String entityType = optionalScalar(root, "entity_type", false);
        String entityId = optionalScalar(root, "entity_id", true);
        checkEntityConsistency(topic, entityType, entityId);

        return new InboundEnvelope(operation, topic, data, entityType, entityId);
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR,
                    field + " is required and must be a non-empty string");
        }
        return node.asText();
    }

    private static String optionalScalar(JsonNode root, String field, boolean allowNumber) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() || (allowNumber && node.isIntegralNumber())) {
            return node.asText();
        }
        throw new StreamingException(ErrorCode.VALIDATION_ERROR,
                field + " must be a " + (allowNumber ? "string or integer" : "string"));
    }

    private static void checkEntityConsistency(String topic, String entityType, String entityId) {
        if (entityType == null && entityId == null) {
            return;
        }
        Topic parsed = Topic.parse(topic);
        if (!parsed.isEntityScoped()) {
            return;
        }
        if (entityType != null && !entityType.equalsIgnoreCase(parsed.entityType())) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR,
                    "entity_type does not match topic " + topic);
        }
        if (entityId != null && parsed.entityId() != null && !entityId.equals(parsed.entityId())) {
            throw new StreamingException(ErrorCode.VALIDATION_ERROR,
                    "entity_id does not match topic " + topic);
        }
    }

    public String encode(OutboundEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new StreamingException(ErrorCode.INTERNAL_ERROR, "Failed to encode envelope", e);
        }
    }

    public byte[] encodePayload(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new StreamingException(ErrorCode.INTERNAL_ERROR, "Failed to encode payload", e);
        }
    }

    /**
     * Decodes a broker payload for delivery. Payloads that are not JSON are
     * relayed as a JSON string.
     */
    public JsonNode decodePayload(byte[] payload) {
        if (payload == null) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(payload);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (IOException e) {
            logger.atDebug().setCause(e).log("Broker payload is not JSON, relaying as text");
        }
        return TextNode.valueOf(new String(payload, StandardCharsets.UTF_8));
    }
}
