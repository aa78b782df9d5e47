package com.intteq.reliable.message.broker.inspection;

import com.intteq.reliable.message.broker.exception.RoutingConfigurationException;
import org.springframework.amqp.core.Message;

/**
 * Receives what happened to every delivery and every publish.
 */
public interface DeliveryInspector {

    void inspectInbound(InspectionRecord record);

    /**
     * @param error {@code null} when the publish succeeded
     */
    void inspectOutbound(String exchange, String routingKey, Message message, Throwable error);

    /**
     * A delivery no handler claimed. It is left unsettled.
     */
    void inspectUnmatched(RoutingConfigurationException error);
}
