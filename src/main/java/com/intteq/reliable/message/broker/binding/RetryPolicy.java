package com.intteq.reliable.message.broker.binding;

import com.intteq.reliable.message.broker.retry.DelayCalculator;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Retry settings attached to a {@link Binding}.
 *
 * <p>Example:
 * <pre>
 * RetryPolicy.builder()
 *         .maxAttempts(5)
 *         .baseDelaySeconds(2)
 *         .maxDelaySeconds(60.0)
 *         .build();
 * </pre>
 *
 * <p>Without an explicit calculator the delay doubles with every attempt.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    private final int maxAttempts;
    private final double baseDelaySeconds;

    /** Optional cap on the computed delay; {@code null} when uncapped. */
    private final Double maxDelaySeconds;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final DelayCalculator delayCalculator;

    @Builder(toBuilder = true)
    private RetryPolicy(int maxAttempts,
                        double baseDelaySeconds,
                        Double maxDelaySeconds,
                        DelayCalculator delayCalculator) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (!(baseDelaySeconds > 0)) {
            throw new IllegalArgumentException("baseDelaySeconds must be > 0 but was " + baseDelaySeconds);
        }
        if (maxDelaySeconds != null && !(maxDelaySeconds > 0)) {
            throw new IllegalArgumentException("maxDelaySeconds must be > 0 but was " + maxDelaySeconds);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxDelaySeconds = maxDelaySeconds;
        this.delayCalculator = delayCalculator != null ? delayCalculator : DelayCalculator.exponential();
    }

    /**
     * Delay in seconds before the attempt following {@code currentAttempt}.
     */
    public double delaySecondsAfter(int currentAttempt) {
        return delayCalculator.delaySeconds(currentAttempt, baseDelaySeconds, maxDelaySeconds);
    }
}
