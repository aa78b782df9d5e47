package com.intteq.reliable.message.broker.retry;

/**
 * Header keys carrying retry bookkeeping inside the message itself.
 *
 * <p>These names are part of the wire contract with other consumers and must not change.
 */
public final class RetryHeaders {

    /** Number of attempts that already failed and were sent to the delay path (int). */
    public static final String ATTEMPT_COUNT = "x-attempt-count";

    /** Routing key the message was first published with (string). */
    public static final String ORIGINAL_ROUTING_KEY = "x-original-routing-key";

    /** Binding pattern of the handler that failed (string). */
    public static final String FAILED_HANDLER_ROUTING_KEY = "x-failed-handler-routing-key";

    /** Why a message ended in its dead-letter queue (string). */
    public static final String DEAD_LETTER_REASON = "x-dead-letter-reason";

    /** Wait before redelivery, in milliseconds (int). */
    public static final String DELAY = "x-delay";

    /** Correlation id propagated between publishers and consumers (string). */
    public static final String CONTEXT_ID = "x-context-id";

    private RetryHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }
}
