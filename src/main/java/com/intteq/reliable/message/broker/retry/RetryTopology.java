package com.intteq.reliable.message.broker.retry;

import lombok.Getter;
import org.springframework.amqp.core.MessageProperties;

import java.util.Objects;

/**
 * Fixed names of the delayed-redelivery topology and the way a message is prepared for it.
 *
 * <p>Two delay modes are supported:
 * <ul>
 *     <li>{@link DelayMode#NATIVE}: the delay exchange is an {@code x-delayed-message} exchange
 *     that honours the {@code x-delay} header; the relay queue has a zero TTL and only releases
 *     messages back to the default exchange.</li>
 *     <li>{@link DelayMode#TTL_RELAY}: for brokers without the delayed-message plugin. The delay
 *     exchange is a plain topic exchange and the relay queue holds each message until its
 *     per-message {@code expiration} elapses, then dead-letters it to the default exchange.</li>
 * </ul>
 * Either way the message is published with the target queue name as routing key, so the
 * default exchange delivers it back to that queue once released.
 */
@Getter
public class RetryTopology {

    public static final String DEFAULT_EXCHANGE = "";
    public static final String DELAY_EXCHANGE = "delayed.retrial.v1.exchange";
    public static final String RELAY_QUEUE = "delayed.retrial.v1.rerouter.queue";
    public static final String DEAD_LETTER_SUFFIX = ".dead";

    public enum DelayMode {
        NATIVE,
        TTL_RELAY
    }

    private final DelayMode delayMode;

    public RetryTopology(DelayMode delayMode) {
        this.delayMode = Objects.requireNonNull(delayMode, "delayMode must not be null");
    }

    public static String deadLetterQueue(String queue) {
        return queue + DEAD_LETTER_SUFFIX;
    }

    public static boolean isDeadLetterRoutingKey(String routingKey) {
        return routingKey != null && routingKey.endsWith(DEAD_LETTER_SUFFIX);
    }

    /**
     * Converts a delay in seconds to the int milliseconds carried by {@code x-delay}.
     */
    public static int toDelayMillis(double delaySeconds) {
        double millis = delaySeconds * 1000d;
        if (millis >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(0L, Math.round(millis));
    }

    /**
     * Writes the delay onto the message before it is published to {@link #DELAY_EXCHANGE}.
     */
    public void prepareForRelay(MessageProperties properties, int delayMillis) {
        properties.setHeader(RetryHeaders.DELAY, delayMillis);
        if (delayMode == DelayMode.TTL_RELAY) {
            properties.setExpiration(Integer.toString(delayMillis));
        }
    }
}
