package com.intteq.reliable.message.broker.exception;

import lombok.Getter;

/**
 * No single handler bound on a queue matches a delivered message.
 *
 * <p>This is a deployment problem, not a retryable failure: the message is logged and
 * dropped and an operator has to fix the bindings.
 */
@Getter
public class RoutingConfigurationException extends RuntimeException {

    private final String queue;
    private final String routingKey;

    public RoutingConfigurationException(String queue, String routingKey, String message) {
        super(message + " (queue=" + queue + ", routingKey=" + routingKey + ")");
        this.queue = queue;
        this.routingKey = routingKey;
    }
}
