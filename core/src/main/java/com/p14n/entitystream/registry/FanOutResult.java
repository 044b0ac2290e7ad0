package com.p14n.entitystream.registry;

import java.util.List;

/**
 * Outcome of one {@link ConnectionRegistry#fanOut} call.
 *
 * @param topic     the topic fanned out to
 * @param delivered connections that accepted the envelope
 * @param skipped   connections that were closed by the time of delivery
 * @param failures  connections whose write failed
 */
public record FanOutResult(String topic, int delivered, int skipped, List<Failure> failures) {

    public record Failure(String connectionId, Throwable cause) {
    }

    public FanOutResult {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }
}
