package com.intteq.reliable.message.broker.retry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Final state of one delivery as reported to the inspector.
 */
@Getter
@RequiredArgsConstructor
public enum DeliveryStatus {

    ACK("Ack"),
    RETRY("Nack::Retry"),
    DEAD_LETTER_INVALID("Nack::DeadLetter::Invalid"),
    DEAD_LETTER_MAX_ATTEMPTS("Nack::DeadLetter::MaxAttempts"),
    DEAD_LETTER_NO_POLICY("Nack::DeadLetter::NoPolicy"),
    /** The broker rejected a routing action; the delivery was left unsettled. */
    FAILED_POLICY("Nack::Requeue::FailedPolicy");

    private final String label;

    public boolean isDeadLetter() {
        return this == DEAD_LETTER_INVALID || this == DEAD_LETTER_MAX_ATTEMPTS || this == DEAD_LETTER_NO_POLICY;
    }

    @Override
    public String toString() {
        return label;
    }
}
