package io.cleaninterfaces.observability.sink;

import java.util.Objects;

/**
 * Result of handing one record to one sink.
 *
 * @param status what happened to the record
 * @param reason human readable cause, only set for {@link Status#FAILED}
 */
public record SinkOutcome(Status status, String reason) {

    public enum Status {
        /** Written or exported. */
        DELIVERED,
        /** Accepted into the sink's batch buffer, export still pending. */
        QUEUED,
        /** Below the sink's minimum level. */
        SKIPPED,
        FAILED
    }

    private static final SinkOutcome DELIVERED = new SinkOutcome(Status.DELIVERED, null);
    private static final SinkOutcome QUEUED = new SinkOutcome(Status.QUEUED, null);
    private static final SinkOutcome SKIPPED = new SinkOutcome(Status.SKIPPED, null);

    public SinkOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.FAILED && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A failed outcome needs a reason");
        }
    }

    public static SinkOutcome delivered() {
        return DELIVERED;
    }

    public static SinkOutcome queued() {
        return QUEUED;
    }

    public static SinkOutcome skipped() {
        return SKIPPED;
    }

    public static SinkOutcome failed(String reason) {
        return new SinkOutcome(Status.FAILED, reason);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
