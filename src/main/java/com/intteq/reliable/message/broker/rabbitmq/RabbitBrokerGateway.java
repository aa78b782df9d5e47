package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.BrokerCommunicationException;
import com.intteq.reliable.message.broker.inspection.DeliveryInspector;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * {@link BrokerGateway} backed by a {@link RabbitTemplate} for publishing, the delivery channel
 * for settlement and the {@link ConsumerRegistry} for consumer control.
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitBrokerGateway implements BrokerGateway {

    private final RabbitTemplate rabbitTemplate;
    private final ConsumerRegistry consumerRegistry;
    private final DeliveryInspector inspector;

    @Override
    public void publish(String exchange, String routingKey, Message message) {
        keepDeliveryMode(message.getMessageProperties());
        try {
            rabbitTemplate.send(exchange, routingKey, message);
            inspector.inspectOutbound(exchange, routingKey, message, null);
        } catch (AmqpException e) {
            inspector.inspectOutbound(exchange, routingKey, message, e);
            throw new BrokerCommunicationException(
                    "Failed to publish to exchange '" + exchange + "' with routing key '" + routingKey + "'", e);
        }
    }

    @Override
    public void sendToQueue(String queue, Message message) {
        publish(RetryTopology.DEFAULT_EXCHANGE, queue, message);
    }

    @Override
    public void acknowledge(MessageContext context) {
        context.ack();
    }

    @Override
    public void negativeAcknowledge(MessageContext context, boolean requeue) {
        context.nack(requeue);
    }

    @Override
    public void cancelConsumer(String consumerTag) {
        consumerRegistry.require(consumerTag).pause();
    }

    @Override
    public void resumeConsumer(String consumerTag) {
        consumerRegistry.require(consumerTag).resume();
    }

    /**
     * A received message only carries the delivery mode it arrived with; republished copies keep it.
     */
    private static void keepDeliveryMode(MessageProperties properties) {
        if (properties.getDeliveryMode() == null) {
            MessageDeliveryMode received = properties.getReceivedDeliveryMode();
            properties.setDeliveryMode(received != null ? received : MessageDeliveryMode.PERSISTENT);
        }
    }
}
