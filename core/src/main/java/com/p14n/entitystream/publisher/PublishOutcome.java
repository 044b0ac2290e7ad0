package com.p14n.entitystream.publisher;

/**
 * Result of {@link EntityEventPublisher#onMutation}. A {@link Status#WARNING}
 * never means the mutation failed, only that streaming it did.
 *
 * @param status  what happened
 * @param topic   the topic published to, null when skipped
 * @param warning the failure description for {@link Status#WARNING}
 */
public record PublishOutcome(Status status, String topic, String warning) {

    public enum Status {
        PUBLISHED,
        SKIPPED,
        WARNING
    }

    public static PublishOutcome published(String topic) {
        return new PublishOutcome(Status.PUBLISHED, topic, null);
    }

    public static PublishOutcome skipped() {
        return new PublishOutcome(Status.SKIPPED, null, null);
    }

    public static PublishOutcome warning(String topic, String warning) {
        return new PublishOutcome(Status.WARNING, topic, warning);
    }

    public boolean isWarning() {
        return status == Status.WARNING;
    }
}
