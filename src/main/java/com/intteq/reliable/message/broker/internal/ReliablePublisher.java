package com.intteq.reliable.message.broker.internal;

import com.intteq.reliable.message.broker.exception.MessagingPublishException;
import com.intteq.reliable.message.broker.inspection.DeliveryInspector;
import com.intteq.reliable.message.broker.retry.RetryHeaders;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.MessageConversionException;
import org.springframework.amqp.support.converter.MessageConverter;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes application messages with the metadata the consuming side relies on.
 *
 * <p>Supports:
 * <ul>
 *     <li>JSON payloads through the template's {@link MessageConverter}; {@code byte[]} and
 *     {@link Message} are sent as they are</li>
 *     <li>a {@code messageId} and an {@code x-context-id} header on every message</li>
 *     <li>retry of transient failures with a fixed backoff</li>
 *     <li>Micrometer metrics and outbound inspection</li>
 * </ul>
 *
 * <pre>
 * publisher.publish("orders.exchange", "orders.eu.created", new OrderCreated(...));
 * publisher.sendToQueue("orders", payload, Map.of("tenant", "acme"));
 * </pre>
 */
@Slf4j
public class ReliablePublisher {

    static final int MAX_ATTEMPTS = 3;
    static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    private final RabbitTemplate rabbitTemplate;
    private final DeliveryInspector inspector;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    private final Duration retryBackoff;

    public ReliablePublisher(RabbitTemplate rabbitTemplate, DeliveryInspector inspector,
                             @Nullable MeterRegistry meterRegistry) {
        this(rabbitTemplate, inspector, meterRegistry, RETRY_BACKOFF);
    }

    ReliablePublisher(RabbitTemplate rabbitTemplate, DeliveryInspector inspector,
                      @Nullable MeterRegistry meterRegistry, Duration retryBackoff) {
        this.rabbitTemplate = rabbitTemplate;
        this.inspector = inspector;
        this.meterRegistry = meterRegistry;
        this.retryBackoff = retryBackoff;
    }

    // ========================================================================
    //   Publishing
    // ========================================================================

    public void publish(String exchange, String routingKey, Object payload) {
        publish(exchange, routingKey, payload, Map.of());
    }

    /**
     * @throws MessagingPublishException if the payload cannot be serialised or every attempt failed
     */
    public void publish(String exchange, String routingKey, Object payload, Map<String, ?> headers) {
        Message message = toMessage(payload, headers);
        increment("reliability.publish.attempt", exchange);

        try {
            retry(() -> rabbitTemplate.send(exchange, routingKey, message));
            inspector.inspectOutbound(exchange, routingKey, message, null);
            increment("reliability.publish.success", exchange);
        } catch (AmqpException ex) {
            inspector.inspectOutbound(exchange, routingKey, message, ex);
            increment("reliability.publish.failure", exchange);
            log.error("Failed to publish message exchange={} routingKey={}", exchange, routingKey, ex);
            throw new MessagingPublishException("Failed to publish message", ex);
        }
    }

    public void sendToQueue(String queue, Object payload) {
        sendToQueue(queue, payload, Map.of());
    }

    /**
     * Publishes through the default exchange, addressed at {@code queue}.
     */
    public void sendToQueue(String queue, Object payload, Map<String, ?> headers) {
        publish(RetryTopology.DEFAULT_EXCHANGE, queue, payload, headers);
    }

    // ========================================================================
    //   Message building
    // ========================================================================

    private Message toMessage(Object payload, Map<String, ?> headers) {
        if (payload == null) {
            throw new MessagingPublishException("Payload must not be null");
        }

        Message message;
        if (payload instanceof Message given) {
            message = given;
        } else {
            MessageProperties properties = new MessageProperties();
            properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
            if (payload instanceof byte[] bytes) {
                properties.setContentType(MessageProperties.CONTENT_TYPE_BYTES);
                message = new Message(bytes, properties);
            } else {
                try {
                    message = rabbitTemplate.getMessageConverter().toMessage(payload, properties);
                } catch (MessageConversionException e) {
                    throw new MessagingPublishException(
                            "Failed to serialize message payload: " + payload.getClass().getName(), e);
                }
            }
        }

        MessageProperties properties = message.getMessageProperties();
        headers.forEach(properties::setHeader);
        if (properties.getMessageId() == null) {
            properties.setMessageId(UUID.randomUUID().toString());
        }
        if (properties.getHeader(RetryHeaders.CONTEXT_ID) == null) {
            String contextId = MDC.get(DeliveryMdc.CONTEXT_ID);
            properties.setHeader(RetryHeaders.CONTEXT_ID, contextId != null ? contextId : UUID.randomUUID().toString());
        }
        return message;
    }

    // ========================================================================
    //   Retry Logic
    // ========================================================================

    private void retry(Runnable action) {
        int attempt = 1;

        while (true) {
            try {
                action.run();
                return;

            } catch (AmqpException ex) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw ex;
                }

                log.warn("Publish attempt {} failed. Retrying in {}ms",
                        attempt, retryBackoff.toMillis(), ex);

                sleep(retryBackoff);
                attempt++;
            }
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingPublishException("Interrupted while waiting to retry a publish", e);
        }
    }

    private void increment(String name, String exchange) {
        if (meterRegistry == null) return;
        meterRegistry.counter(name, "exchange", exchange).increment();
    }
}
