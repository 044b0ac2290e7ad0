package com.p14n.entitystream.protocol;

/**
 * Closed set of error codes carried in {@code error_code} of error envelopes.
 */
public enum ErrorCode {
    INVALID_JSON,
    VALIDATION_ERROR,
    INVALID_OPERATION,
    PERMISSION_DENIED,
    PUBLISH_FAILED,
    SUBSCRIPTION_ERROR,
    TOPIC_NOT_FOUND,
    INTERNAL_ERROR
}
