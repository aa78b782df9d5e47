package com.intteq.reliable.message.broker.routing;

import com.intteq.reliable.message.broker.binding.ListenerRegistration;
import com.intteq.reliable.message.broker.exception.RoutingConfigurationException;
import com.intteq.reliable.message.broker.retry.AttemptTracker;
import com.intteq.reliable.message.broker.retry.RetryHeaders;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import org.springframework.amqp.core.Message;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the single handler of a physical queue that owns a delivered message.
 *
 * <p>Rules:
 * <ul>
 *     <li>Live traffic is matched on the effective routing key: the
 *     {@code x-original-routing-key} header of a redelivery, otherwise the physical key.</li>
 *     <li>A redelivery carrying {@code x-failed-handler-routing-key} only goes back to the
 *     handler whose pattern failed.</li>
 *     <li>A physical key ending in {@code .dead} is terminal traffic and is matched on the
 *     physical key only.</li>
 *     <li>No match, or more than one, is a {@link RoutingConfigurationException}.</li>
 * </ul>
 */
public class HandlerDispatcher {

    private final String queue;
    private final List<ListenerRegistration> registrations;
    private final AttemptTracker attemptTracker;

    public HandlerDispatcher(String queue, List<ListenerRegistration> registrations, AttemptTracker attemptTracker) {
        this.queue = queue;
        this.registrations = List.copyOf(registrations);
        this.attemptTracker = attemptTracker;
    }

    public ListenerRegistration resolve(Message message) {
        String physicalKey = message.getMessageProperties().getReceivedRoutingKey();
        boolean terminal = RetryTopology.isDeadLetterRoutingKey(physicalKey);
        String routingKey = terminal ? physicalKey : attemptTracker.effectiveRoutingKey(message);

        List<ListenerRegistration> candidates = registrations.stream()
                .filter(r -> r.matches(routingKey))
                .collect(Collectors.toList());

        if (!terminal) {
            Object failedHandler = message.getMessageProperties().getHeader(RetryHeaders.FAILED_HANDLER_ROUTING_KEY);
            if (failedHandler != null) {
                String failedPattern = failedHandler.toString();
                candidates.removeIf(r -> !r.getRoutingKeyPattern().equals(failedPattern));
            }
        }

        if (candidates.isEmpty()) {
            throw new RoutingConfigurationException(queue, routingKey, "No handler matches the message");
        }
        if (candidates.size() > 1) {
            String patterns = candidates.stream()
                    .map(ListenerRegistration::getRoutingKeyPattern)
                    .collect(Collectors.joining(", "));
            throw new RoutingConfigurationException(queue, routingKey,
                    "Handlers [" + patterns + "] all match the message");
        }
        return candidates.get(0);
    }

    public String getQueue() {
        return queue;
    }
}
