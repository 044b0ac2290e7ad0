package com.p14n.entitystream.protocol;

/**
 * A request failure that is reported to the client as an error envelope.
 */
public class StreamingException extends RuntimeException {

    private final ErrorCode code;

    public StreamingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StreamingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
