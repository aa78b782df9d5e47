package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.BrokerCommunicationException;
import org.springframework.amqp.core.Message;

/**
 * Broker operations the reliability layer depends on.
 *
 * <p>Every call returns once the broker client accepted the operation. Failures are raised as
 * {@link BrokerCommunicationException} and are not retried here.
 */
public interface BrokerGateway {

    void publish(String exchange, String routingKey, Message message);

    /**
     * Publishes through the default exchange, addressed at {@code queue}.
     */
    void sendToQueue(String queue, Message message);

    void acknowledge(MessageContext context);

    void negativeAcknowledge(MessageContext context, boolean requeue);

    /**
     * Stops deliveries to the consumer with the given tag.
     */
    void cancelConsumer(String consumerTag);

    /**
     * Restarts a consumer previously stopped with {@link #cancelConsumer(String)}.
     */
    void resumeConsumer(String consumerTag);
}
