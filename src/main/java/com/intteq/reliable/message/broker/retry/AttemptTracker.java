package com.intteq.reliable.message.broker.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

/**
 * Reads and writes the retry bookkeeping carried in message headers.
 *
 * <p>{@code x-attempt-count} holds the number of attempts that already failed and went through
 * the delay path. The attempt currently executing is therefore that value plus one, and 1 for
 * a message that never failed. No state is kept outside the message.
 */
@Slf4j
public class AttemptTracker {

    /**
     * Number of the attempt currently executing, starting at 1.
     */
    public int read(Message message) {
        return recordedFailures(message.getMessageProperties()) + 1;
    }

    /**
     * Routing key used to dispatch live traffic: the original key of a redelivery, otherwise
     * the key the message was delivered with.
     */
    public String effectiveRoutingKey(Message message) {
        MessageProperties properties = message.getMessageProperties();
        Object original = properties.getHeader(RetryHeaders.ORIGINAL_ROUTING_KEY);
        if (original != null && !original.toString().isEmpty()) {
            return original.toString();
        }
        return properties.getReceivedRoutingKey();
    }

    /**
     * Records a failed attempt on the message in place.
     *
     * @param effectiveRoutingKey key the message must be dispatched on when it comes back
     * @param handlerRoutingKey   pattern of the handler that failed
     * @param failedAttempts      attempts failed so far, including the one that just failed
     */
    public void stamp(Message message, String effectiveRoutingKey, String handlerRoutingKey, int failedAttempts) {
        MessageProperties properties = message.getMessageProperties();
        properties.setHeader(RetryHeaders.ATTEMPT_COUNT, failedAttempts);
        properties.setHeader(RetryHeaders.ORIGINAL_ROUTING_KEY, effectiveRoutingKey);
        properties.setHeader(RetryHeaders.FAILED_HANDLER_ROUTING_KEY, handlerRoutingKey);
    }

    private int recordedFailures(MessageProperties properties) {
        Object raw = properties.getHeader(RetryHeaders.ATTEMPT_COUNT);
        if (raw == null) {
            return 0;
        }
        try {
            long value = raw instanceof Number number
                    ? number.longValue()
                    : Long.parseLong(raw.toString().trim());
            if (value < 0) {
                log.warn("Ignoring negative {} header: {}", RetryHeaders.ATTEMPT_COUNT, raw);
                return 0;
            }
            return (int) Math.min(value, Integer.MAX_VALUE - 1L);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable {} header: {}", RetryHeaders.ATTEMPT_COUNT, raw);
            return 0;
        }
    }
}
