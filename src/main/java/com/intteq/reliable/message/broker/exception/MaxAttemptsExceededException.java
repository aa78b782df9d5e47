package com.intteq.reliable.message.broker.exception;

import lombok.Getter;

/**
 * Terminal signal reported when a message exhausted its retry policy.
 *
 * <p>Wraps the fault of the last attempt. It is handed to the inspector for diagnostics and
 * is never thrown past the retry router.
 */
@Getter
public class MaxAttemptsExceededException extends RuntimeException {

    private final int attempts;

    public MaxAttemptsExceededException(int attempts, Throwable lastFailure) {
        super("Maximum attempts of " + attempts + " reached", lastFailure);
        this.attempts = attempts;
    }
}
