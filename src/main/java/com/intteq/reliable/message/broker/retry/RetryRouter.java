package com.intteq.reliable.message.broker.retry;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.binding.ListenerRegistration;
import com.intteq.reliable.message.broker.binding.RetryPolicy;
import com.intteq.reliable.message.broker.exception.MaxAttemptsExceededException;
import com.intteq.reliable.message.broker.rabbitmq.BrokerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;

/**
 * Turns a handler outcome into the broker action that settles the delivery.
 *
 * <p>States, final per delivery:
 * <ul>
 *     <li>success: acknowledged, headers untouched</li>
 *     <li>validation fault: published unchanged to {@code <queue>.dead}, nacked without requeue</li>
 *     <li>failure without retry policy: same, reason "no policy"</li>
 *     <li>policy fault with attempts left: attempt stamped, delay written, published to the
 *     delay exchange addressed at the queue, nacked without requeue</li>
 *     <li>policy fault on the last attempt: published to {@code <queue>.dead}, nacked without
 *     requeue, reported with {@link MaxAttemptsExceededException}</li>
 * </ul>
 *
 * <p>Handler faults never escape this class. Broker failures do, unchanged: once the broker
 * is unreachable the delivery has no retry path left.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryRouter {

    private final BrokerGateway broker;
    private final AttemptTracker attemptTracker;
    private final RetryTopology topology;

    public RoutingDecision route(MessageContext context, ListenerRegistration registration, Outcome outcome) {
        Binding binding = registration.getBinding();
        Message message = context.message();
        int currentAttempt = attemptTracker.read(message);

        if (outcome.isSuccess()) {
            broker.acknowledge(context);
            return new RoutingDecision(DeliveryStatus.ACK, currentAttempt, 0, null);
        }

        Throwable error = outcome.getError();

        if (outcome.getFailureKind() == FailureKind.VALIDATION) {
            deadLetter(context, binding, "Invalid message: " + describe(error));
            return new RoutingDecision(DeliveryStatus.DEAD_LETTER_INVALID, currentAttempt, 0, error);
        }

        RetryPolicy policy = binding.getRetryPolicy();
        if (policy == null) {
            deadLetter(context, binding, "No retry policy: " + describe(error));
            return new RoutingDecision(DeliveryStatus.DEAD_LETTER_NO_POLICY, currentAttempt, 0, error);
        }

        if (currentAttempt < policy.getMaxAttempts()) {
            int delayMillis = RetryTopology.toDelayMillis(policy.delaySecondsAfter(currentAttempt));

            attemptTracker.stamp(message, attemptTracker.effectiveRoutingKey(message),
                    registration.getRoutingKeyPattern(), currentAttempt);
            topology.prepareForRelay(message.getMessageProperties(), delayMillis);

            broker.publish(RetryTopology.DELAY_EXCHANGE, binding.getQueue(), message);
            broker.negativeAcknowledge(context, false);

            log.debug("Scheduled retry {}/{} in {}ms for {}",
                    currentAttempt + 1, policy.getMaxAttempts(), delayMillis, binding.describe());
            return new RoutingDecision(DeliveryStatus.RETRY, currentAttempt, delayMillis, error);
        }

        deadLetter(context, binding, "Maximum attempts of " + policy.getMaxAttempts() + " reached: " + describe(error));
        return new RoutingDecision(DeliveryStatus.DEAD_LETTER_MAX_ATTEMPTS, currentAttempt, 0,
                new MaxAttemptsExceededException(currentAttempt, error));
    }

    private void deadLetter(MessageContext context, Binding binding, String reason) {
        Message message = context.message();
        message.getMessageProperties().setHeader(RetryHeaders.DEAD_LETTER_REASON, reason);

        broker.sendToQueue(RetryTopology.deadLetterQueue(binding.getQueue()), message);
        broker.negativeAcknowledge(context, false);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null
                ? error.getClass().getSimpleName() + ": " + error.getMessage()
                : error.getClass().getSimpleName();
    }
}
