package com.intteq.reliable.message.broker.exception;

/**
 * Signals a client/input fault: the message can never be processed successfully, so it is
 * dead-lettered immediately and never retried.
 *
 * <p>Handlers throw this for payloads that fail parsing or validation.
 */
public class InvalidMessageException extends RuntimeException {

    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
