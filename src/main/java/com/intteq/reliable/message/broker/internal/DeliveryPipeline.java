package com.intteq.reliable.message.broker.internal;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.binding.ListenerRegistration;
import com.intteq.reliable.message.broker.binding.ListenerRegistry;
import com.intteq.reliable.message.broker.exception.RoutingConfigurationException;
import com.intteq.reliable.message.broker.inspection.DeliveryInspector;
import com.intteq.reliable.message.broker.inspection.InspectionRecord;
import com.intteq.reliable.message.broker.retry.AttemptTracker;
import com.intteq.reliable.message.broker.retry.DeliveryStatus;
import com.intteq.reliable.message.broker.retry.FailureClassifier;
import com.intteq.reliable.message.broker.retry.Outcome;
import com.intteq.reliable.message.broker.retry.RetryRouter;
import com.intteq.reliable.message.broker.retry.RoutingDecision;
import com.intteq.reliable.message.broker.routing.HandlerDispatcher;
import com.intteq.reliable.message.broker.throttle.ThrottleController;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Runs one delivery through dispatch, the handler, retry routing, inspection and throttling.
 *
 * <p>Flow:
 * <pre>
 *   resolve handler ─ no single match ─▶ inspect as unmatched, leave unsettled
 *         │
 *   invoke handler, await its stage, classify ─▶ Outcome
 *         │
 *   RetryRouter.route ─ broker failure ─▶ inspect as FailedPolicy, rethrow
 *         │
 *   inspect decision, throttle the consumer if the binding asks for it
 * </pre>
 *
 * <p>Broker failures leave this class uncaught: the delivery stays unsettled, the consumer
 * closes and reopens its channel, and the broker redelivers the delivery.
 */
@Slf4j
public class DeliveryPipeline implements Consumer<MessageContext> {

    private final Map<String, HandlerDispatcher> dispatchers = new LinkedHashMap<>();
    private final AttemptTracker attemptTracker;
    private final FailureClassifier failureClassifier;
    private final RetryRouter retryRouter;
    private final ThrottleController throttleController;
    private final DeliveryInspector inspector;

    public DeliveryPipeline(ListenerRegistry registry,
                            AttemptTracker attemptTracker,
                            FailureClassifier failureClassifier,
                            RetryRouter retryRouter,
                            ThrottleController throttleController,
                            DeliveryInspector inspector) {
        this.attemptTracker = attemptTracker;
        this.failureClassifier = failureClassifier;
        this.retryRouter = retryRouter;
        this.throttleController = throttleController;
        this.inspector = inspector;

        for (String queue : registry.consumedQueues()) {
            dispatchers.put(queue, new HandlerDispatcher(queue, registry.registrationsFor(queue), attemptTracker));
        }
    }

    @Override
    public void accept(MessageContext context) {
        handle(context);
    }

    public void handle(MessageContext context) {
        try (DeliveryMdc ignored = DeliveryMdc.open(context)) {
            ListenerRegistration registration;
            try {
                registration = resolve(context);
            } catch (RoutingConfigurationException e) {
                inspector.inspectUnmatched(e);
                return;
            }

            Binding binding = registration.getBinding();
            int attempt = attemptTracker.read(context.message());
            String routingKey = attemptTracker.effectiveRoutingKey(context.message());

            long start = System.nanoTime();
            Outcome outcome = invoke(registration, context);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            RoutingDecision decision;
            try {
                decision = retryRouter.route(context, registration, outcome);
            } catch (RuntimeException e) {
                inspector.inspectInbound(InspectionRecord.builder()
                        .binding(binding)
                        .attemptCount(attempt)
                        .status(DeliveryStatus.FAILED_POLICY)
                        .error(e)
                        .routingKey(routingKey)
                        .messageId(context.messageId())
                        .contextId(context.contextId())
                        .handlerDuration(elapsed)
                        .build());
                throw e;
            }

            inspector.inspectInbound(InspectionRecord.builder()
                    .binding(binding)
                    .attemptCount(decision.getAttemptCount())
                    .status(decision.getStatus())
                    .error(decision.getError())
                    .routingKey(routingKey)
                    .messageId(context.messageId())
                    .contextId(context.contextId())
                    .handlerDuration(elapsed)
                    .build());

            if (binding.isThrottled()) {
                throttleController.throttle(context.consumerTag(), binding.getTargetRatePerSecond());
            }
        }
    }

    private ListenerRegistration resolve(MessageContext context) {
        HandlerDispatcher dispatcher = dispatchers.get(context.consumerQueue());
        if (dispatcher == null) {
            throw new RoutingConfigurationException(context.consumerQueue(), context.routingKey(),
                    "No handler is registered for the queue");
        }
        return dispatcher.resolve(context.message());
    }

    private Outcome invoke(ListenerRegistration registration, MessageContext context) {
        try {
            CompletionStage<?> stage = registration.getHandler().handle(context);
            if (stage != null) {
                stage.toCompletableFuture().join();
            }
            return Outcome.success();
        } catch (Exception e) {
            Outcome failure = Outcome.failure(e, failureClassifier);
            log.debug("Handler {} failed with {}", registration.getBinding().describe(), failure.getFailureKind(), e);
            return failure;
        }
    }
}
