package com.intteq.reliable.message.broker.retry;

/**
 * Maps an attempt number to the wait before the next redelivery.
 *
 * <p>Implementations receive the attempt that just failed (starting at 1), the policy's base
 * delay and its optional cap, all in seconds.
 */
@FunctionalInterface
public interface DelayCalculator {

    double delaySeconds(int currentAttempt, double baseDelaySeconds, Double maxDelaySeconds);

    /**
     * {@code base * 2^(attempt - 1)}, clamped to the cap when one is set.
     */
    static DelayCalculator exponential() {
        return (currentAttempt, baseDelaySeconds, maxDelaySeconds) -> {
            double delay = baseDelaySeconds * Math.pow(2, currentAttempt - 1);
            return maxDelaySeconds != null && delay > maxDelaySeconds ? maxDelaySeconds : delay;
        };
    }

    /**
     * Always the base delay.
     */
    static DelayCalculator constant() {
        return (currentAttempt, baseDelaySeconds, maxDelaySeconds) -> baseDelaySeconds;
    }
}
