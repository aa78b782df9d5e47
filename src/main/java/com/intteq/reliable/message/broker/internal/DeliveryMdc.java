package com.intteq.reliable.message.broker.internal;

import com.intteq.reliable.message.broker.MessageContext;
import org.slf4j.MDC;

/**
 * Auto-closeable MDC scope for one delivery.
 *
 * <pre>
 * try (DeliveryMdc mdc = DeliveryMdc.open(context)) {
 *     log.info("Handling"); // carries contextId, messageId, routingKey, queue
 * }
 * </pre>
 */
final class DeliveryMdc implements AutoCloseable {

    static final String CONTEXT_ID = "contextId";
    static final String MESSAGE_ID = "messageId";
    static final String ROUTING_KEY = "routingKey";
    static final String QUEUE = "queue";

    private DeliveryMdc() {
    }

    static DeliveryMdc open(MessageContext context) {
        putIfPresent(CONTEXT_ID, context.contextId());
        putIfPresent(MESSAGE_ID, context.messageId());
        putIfPresent(ROUTING_KEY, context.routingKey());
        putIfPresent(QUEUE, context.consumerQueue());
        return new DeliveryMdc();
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        MDC.remove(CONTEXT_ID);
        MDC.remove(MESSAGE_ID);
        MDC.remove(ROUTING_KEY);
        MDC.remove(QUEUE);
    }
}
