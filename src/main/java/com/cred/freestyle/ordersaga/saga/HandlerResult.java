package com.cred.freestyle.ordersaga.saga;

/**
 * Outcome of one participant handling one event.
 *
 * The dispatcher decides ack versus redelivery from these results instead of
 * relying on exceptions escaping the handler.
 *
 * @author Order Saga Team
 */
public final class HandlerResult {

    /**
     * Handler outcome.
     */
    public enum Outcome {
        /**
         * Local state changed and the follow-up event was published (best effort).
         */
        APPLIED,

        /**
         * Idempotent no-op: duplicate, not found, or already in the target state.
         */
        SKIPPED,

        /**
         * Payload failed validation; the event is dropped.
         */
        REJECTED,

        /**
         * Provider or persistence failure; a *.failed event was published.
         */
        FAILED
    }

    private final Outcome outcome;
    private final String aggregateId;
    private final String errorCode;
    private final String message;
    private final boolean retryable;

    private HandlerResult(Outcome outcome, String aggregateId, String errorCode, String message, boolean retryable) {
        this.outcome = outcome;
        this.aggregateId = aggregateId;
        this.errorCode = errorCode;
        this.message = message;
        this.retryable = retryable;
    }

    public static HandlerResult applied(String aggregateId) {
        return new HandlerResult(Outcome.APPLIED, aggregateId, null, null, false);
    }

    public static HandlerResult skipped(String message) {
        return new HandlerResult(Outcome.SKIPPED, null, null, message, false);
    }

    public static HandlerResult skipped(String aggregateId, String message) {
        return new HandlerResult(Outcome.SKIPPED, aggregateId, null, message, false);
    }

    public static HandlerResult rejected(String message) {
        return new HandlerResult(Outcome.REJECTED, null, null, message, false);
    }

    /**
     * Business failure that redelivery cannot fix (e.g. no valid items).
     */
    public static HandlerResult failed(String errorCode, String message) {
        return new HandlerResult(Outcome.FAILED, null, errorCode, message, false);
    }

    /**
     * Infrastructure failure; the same event may succeed if redelivered.
     */
    public static HandlerResult retryableFailure(String aggregateId, String errorCode, String message) {
        return new HandlerResult(Outcome.FAILED, aggregateId, errorCode, message, true);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    @Override
    public String toString() {
        return "HandlerResult{" +
                "outcome=" + outcome +
                ", aggregateId='" + aggregateId + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", message='" + message + '\'' +
                ", retryable=" + retryable +
                '}';
    }
}
