package com.intteq.reliable.message.broker.exception;

/**
 * A publish, acknowledge or consumer operation against the broker failed.
 *
 * <p>Once the broker cannot be reached there is no further retry path for the delivery,
 * so this exception is never caught by the reliability layer.
 */
public class BrokerCommunicationException extends RuntimeException {

    public BrokerCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
