package com.intteq.reliable.message.broker.retry;

/**
 * How a handler failure is treated by {@link RetryRouter}.
 */
public enum FailureKind {
    /** Client/input error: dead-lettered immediately, never retried. */
    VALIDATION,
    /** Transient or business error: retried according to the binding's policy. */
    POLICY
}
