package com.intteq.reliable.message.broker.inspection;

import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.retry.DeliveryStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One terminal outcome of a delivery.
 */
@Value
@Builder
public class InspectionRecord {

    Binding binding;
    int attemptCount;
    DeliveryStatus status;

    /** {@code null} on success. */
    Throwable error;

    /** Routing key the handler was selected with. */
    String routingKey;

    String messageId;
    String contextId;

    /** Time spent in the handler, {@code null} if it never ran. */
    Duration handlerDuration;
}
