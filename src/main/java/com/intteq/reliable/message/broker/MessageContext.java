package com.intteq.reliable.message.broker;

import com.intteq.reliable.message.broker.exception.BrokerCommunicationException;
import com.intteq.reliable.message.broker.retry.RetryHeaders;
import com.rabbitmq.client.Channel;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One delivery as seen by handlers and by the reliability pipeline.
 *
 * <p>Usage:
 * <pre>
 *   MessageContext ctx = MessageContext.forRabbitMQ(channel, message);
 *   ctx.routingKey();     // physical routing key of this delivery
 *   ctx.header("x-attempt-count");
 *   ctx.ack();            // settle (done by the pipeline, not by handlers)
 * </pre>
 *
 * <p>Notes:
 * <ul>
 *     <li>A delivery is settled exactly once; a second {@link #ack()} or {@link #nack(boolean)}
 *     raises {@link IllegalStateException}.</li>
 *     <li>Channel I/O failures are wrapped in {@link BrokerCommunicationException}.</li>
 *     <li>The headers map is mutable and only touched by the single in-flight handling of
 *     this delivery.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@Slf4j
public class MessageContext {

    private final Channel channel;
    private final Message message;
    private final long deliveryTag;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean settled = new AtomicBoolean();

    /**
     * Create a context for a manually acknowledged RabbitMQ delivery.
     *
     * @param channel the channel the message was delivered on (must not be null)
     * @param message the received message with its delivery tag set
     * @return a new {@link MessageContext}
     */
    public static MessageContext forRabbitMQ(Channel channel, Message message) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return new MessageContext(channel, message, message.getMessageProperties().getDeliveryTag());
    }

    private MessageContext(Channel channel, Message message, long deliveryTag) {
        this.channel = channel;
        this.message = message;
        this.deliveryTag = deliveryTag;
    }

    // -----------------------
    // Delivery metadata
    // -----------------------

    public MessageProperties properties() {
        return message.getMessageProperties();
    }

    /** Routing key the broker delivered this message with. */
    public String routingKey() {
        return properties().getReceivedRoutingKey();
    }

    public String consumerTag() {
        return properties().getConsumerTag();
    }

    public String consumerQueue() {
        return properties().getConsumerQueue();
    }

    public String messageId() {
        return properties().getMessageId();
    }

    public String contextId() {
        Object value = properties().getHeader(RetryHeaders.CONTEXT_ID);
        return value != null ? value.toString() : null;
    }

    public <T> T header(String name) {
        return properties().getHeader(name);
    }

    public byte[] body() {
        return message.getBody();
    }

    public String bodyAsString() {
        return new String(message.getBody(), StandardCharsets.UTF_8);
    }

    public boolean isSettled() {
        return settled.get();
    }

    // -----------------------
    // Settlement
    // -----------------------

    /**
     * Acknowledge the delivery.
     *
     * @throws BrokerCommunicationException if the channel call fails
     */
    public void ack() {
        markSettled("ack");
        try {
            channel.basicAck(deliveryTag, false);
            log.debug("RabbitMQ ack successful (tag={})", deliveryTag);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to ack message (tag={}, messageId={})", deliveryTag, messageId(), e);
            throw new BrokerCommunicationException("Failed to ack message", e);
        }
    }

    /**
     * Negatively acknowledge the delivery.
     *
     * @param requeue whether the broker should put the message back on its queue
     * @throws BrokerCommunicationException if the channel call fails
     */
    public void nack(boolean requeue) {
        markSettled("nack");
        try {
            channel.basicNack(deliveryTag, false, requeue);
            log.debug("RabbitMQ nack issued (tag={}, requeue={})", deliveryTag, requeue);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to nack message (tag={}, messageId={})", deliveryTag, messageId(), e);
            throw new BrokerCommunicationException("Failed to nack message", e);
        }
    }

    private void markSettled(String operation) {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException(
                    "Delivery " + deliveryTag + " already settled, cannot " + operation + " again");
        }
    }
}
