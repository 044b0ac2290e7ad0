package com.p14n.entitystream.protocol;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope sent from the server to a client. Null fields are left out of the
 * JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundEnvelope(Status status,
        Operation operation,
        String topic,
        String message,
        @JsonProperty("error_code") ErrorCode errorCode,
        JsonNode data) {

    public enum Status {
        SUCCESS,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static OutboundEnvelope success(Operation operation, String topic, String message) {
        return new OutboundEnvelope(Status.SUCCESS, operation, topic, message, null, null);
    }

    public static OutboundEnvelope message(String topic, JsonNode data) {
        return new OutboundEnvelope(Status.SUCCESS, Operation.MESSAGE, topic, null, null, data);
    }

    public static OutboundEnvelope error(ErrorCode code, String topic, String message) {
        return new OutboundEnvelope(Status.ERROR, Operation.ERROR, topic, message, code, null);
    }

    public boolean isError() {
        return status == Status.ERROR;
    }
}
