package org.nostrpool.pool;

/**
 * Outcome of a publish on one relay.
 */
public final class PublishOutcome {

    private final PublishStatus status;
    private final String message;

    private PublishOutcome(PublishStatus status, String message) {
        this.status = status;
        this.message = message != null ? message : "";
    }

    public static PublishOutcome accepted(String message) {
        return new PublishOutcome(PublishStatus.ACCEPTED, message);
    }

    public static PublishOutcome rejected(String reason) {
        return new PublishOutcome(PublishStatus.REJECTED, reason);
    }

    public static PublishOutcome notAttempted(String reason) {
        return new PublishOutcome(PublishStatus.NOT_ATTEMPTED, reason);
    }

    public static PublishOutcome failed(String reason) {
        return new PublishOutcome(PublishStatus.FAILED, reason);
    }

    public PublishStatus getStatus() {
        return status;
    }

    /** Relay message for ACCEPTED/REJECTED, local reason otherwise. Never null. */
    public String getMessage() {
        return message;
    }

    public boolean isAccepted() {
        return status == PublishStatus.ACCEPTED;
    }

    @Override
    public String toString() {
        return message.isEmpty() ? status.toString() : status + "(" + message + ")";
    }
}
