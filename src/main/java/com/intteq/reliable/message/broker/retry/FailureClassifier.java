package com.intteq.reliable.message.broker.retry;

import com.intteq.reliable.message.broker.exception.InvalidMessageException;
import jakarta.validation.ConstraintViolationException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a handler failure is a validation fault or a retryable policy fault.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable error);

    /**
     * Validation for {@link InvalidMessageException} and bean-validation violations, policy for
     * everything else. Wrappers added by futures and reflection are looked through.
     */
    static FailureClassifier defaultClassifier() {
        return error -> {
            Throwable cause = unwrap(error);
            if (cause instanceof InvalidMessageException || cause instanceof ConstraintViolationException) {
                return FailureKind.VALIDATION;
            }
            return FailureKind.POLICY;
        };
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException
                || current instanceof UndeclaredThrowableException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
