package com.intteq.reliable.message.broker.exception;

/**
 * Exception thrown when {@link com.intteq.reliable.message.broker.internal.ReliablePublisher}
 * fails to send a message after its retry attempts.
 */
public class MessagingPublishException extends RuntimeException {

    public MessagingPublishException(String message) {
        super(message);
    }

    public MessagingPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
