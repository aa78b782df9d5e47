package com.intteq.reliable.message.broker.retry;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * Result of one handler invocation: success, or a failure with its classification.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome {

    private static final Outcome SUCCESS = new Outcome(null, null);

    /** {@code null} on success. */
    private final FailureKind failureKind;

    /** {@code null} on success. */
    private final Throwable error;

    public static Outcome success() {
        return SUCCESS;
    }

    public static Outcome failure(FailureKind kind, Throwable error) {
        return new Outcome(Objects.requireNonNull(kind, "kind must not be null"),
                Objects.requireNonNull(error, "error must not be null"));
    }

    public static Outcome failure(Throwable error, FailureClassifier classifier) {
        Throwable cause = FailureClassifier.unwrap(error);
        return failure(classifier.classify(cause), cause);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }
}
