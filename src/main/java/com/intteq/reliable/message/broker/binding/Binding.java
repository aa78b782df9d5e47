package com.intteq.reliable.message.broker.binding;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Declared association of an exchange, a routing-key pattern and a queue, plus the
 * reliability settings of the handler that consumes it.
 *
 * <p>Bindings are created once at registration time and never change afterwards.
 *
 * <pre>
 * Binding.builder()
 *         .exchange("orders.exchange")
 *         .routingKey("orders.*.created")
 *         .queue("orders")
 *         .retryPolicy(RetryPolicy.builder().maxAttempts(3).baseDelaySeconds(1).build())
 *         .targetRatePerSecond(20.0)
 *         .build();
 * </pre>
 *
 * <p>An empty exchange name means the default exchange. That is how a handler consumes a
 * {@code <queue>.dead} queue: messages arrive there by queue name, so no exchange binding is
 * declared.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Binding {

    private final String exchange;

    /** Topic pattern: {@code *} matches one segment, {@code #} one or more. */
    private final String routingKey;

    private final String queue;

    /** Named channel whose prefetch applies to the queue; {@code null} for the default channel. */
    private final String channel;

    /** {@code null} when failures are dead-lettered without retry. */
    private final RetryPolicy retryPolicy;

    /** {@code null} when deliveries are not throttled. */
    private final Double targetRatePerSecond;

    @Builder(toBuilder = true)
    private Binding(String exchange,
                    String routingKey,
                    String queue,
                    String channel,
                    RetryPolicy retryPolicy,
                    Double targetRatePerSecond) {
        this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
        this.routingKey = requireText(routingKey, "routingKey");
        this.queue = requireText(queue, "queue");
        this.channel = channel;
        this.retryPolicy = retryPolicy;
        if (targetRatePerSecond != null && !(targetRatePerSecond > 0)) {
            throw new IllegalArgumentException("targetRatePerSecond must be > 0 but was " + targetRatePerSecond);
        }
        this.targetRatePerSecond = targetRatePerSecond;
    }

    public boolean hasRetryPolicy() {
        return retryPolicy != null;
    }

    public boolean isThrottled() {
        return targetRatePerSecond != null;
    }

    public boolean isOnDefaultExchange() {
        return exchange.isEmpty();
    }

    /** {@code [exchange]::[routingKey]::[queue]}, used in log lines. */
    public String describe() {
        return "[" + exchange + "]::[" + routingKey + "]::[" + queue + "]";
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
