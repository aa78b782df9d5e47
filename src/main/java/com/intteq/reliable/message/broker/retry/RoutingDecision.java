package com.intteq.reliable.message.broker.retry;

import lombok.Value;

/**
 * What {@link RetryRouter} did with a delivery.
 */
@Value
public class RoutingDecision {

    DeliveryStatus status;

    /** The attempt that just ran, starting at 1. */
    int attemptCount;

    /** Wait in milliseconds before redelivery; 0 unless the status is {@link DeliveryStatus#RETRY}. */
    int delayMillis;

    /** Failure reported for this delivery, {@code null} on success. */
    Throwable error;
}
