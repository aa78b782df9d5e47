package com.intteq.reliable.message.broker.binding;

import com.intteq.reliable.message.broker.MessageContext;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Application logic invoked for a delivery.
 *
 * <p>The returned stage is awaited in full before the outcome is classified; a {@code null}
 * stage counts as completed. Throwing, or completing the stage exceptionally, is a failure.
 * Handlers must not settle the delivery themselves.
 */
@FunctionalInterface
public interface MessageHandler {

    CompletionStage<?> handle(MessageContext context) throws Exception;

    /**
     * Adapts synchronous code.
     */
    static MessageHandler blocking(BlockingHandler handler) {
        return context -> {
            handler.handle(context);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface BlockingHandler {
        void handle(MessageContext context) throws Exception;
    }
}
