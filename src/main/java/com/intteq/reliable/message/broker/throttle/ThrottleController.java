package com.intteq.reliable.message.broker.throttle;

import com.intteq.reliable.message.broker.rabbitmq.BrokerGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces a minimum gap between deliveries of a consumer.
 *
 * <p>After each handled delivery the consumer is cancelled and a resume is scheduled
 * {@code 1000 / targetRatePerSecond} milliseconds later. While a consumer is paused, further
 * throttle requests for it are ignored, so pause windows never overlap. Deliveries already
 * prefetched are not limited.
 *
 * <p>The resume runs on the scheduler, outside the delivery flow. If the process stops before
 * it fires, the consumer stays paused until the next start.
 */
@Slf4j
public class ThrottleController implements DisposableBean {

    private final BrokerGateway broker;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Set<String> paused = ConcurrentHashMap.newKeySet();

    public ThrottleController(BrokerGateway broker, TaskScheduler scheduler, Clock clock) {
        this.broker = broker;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Pauses the consumer and schedules its resume.
     *
     * @return the pause window, or {@link Duration#ZERO} if the consumer was already paused
     */
    public Duration throttle(String consumerTag, double targetRatePerSecond) {
        if (!(targetRatePerSecond > 0)) {
            throw new IllegalArgumentException("targetRatePerSecond must be > 0 but was " + targetRatePerSecond);
        }
        if (!paused.add(consumerTag)) {
            log.debug("Consumer {} already paused, skipping throttle", consumerTag);
            return Duration.ZERO;
        }

        Duration wait = Duration.ofMillis(Math.max(1L, Math.round(1000d / targetRatePerSecond)));
        try {
            broker.cancelConsumer(consumerTag);
            scheduler.schedule(() -> resume(consumerTag), clock.instant().plus(wait));
        } catch (RuntimeException e) {
            paused.remove(consumerTag);
            throw e;
        }

        log.debug("Throttled consumer {} for {}ms", consumerTag, wait.toMillis());
        return wait;
    }

    public boolean isPaused(String consumerTag) {
        return paused.contains(consumerTag);
    }

    private void resume(String consumerTag) {
        try {
            broker.resumeConsumer(consumerTag);
        } catch (RuntimeException e) {
            log.error("Failed to resume throttled consumer {}; it stays paused until its channel is recovered", consumerTag, e);
        } finally {
            paused.remove(consumerTag);
        }
    }

    @Override
    public void destroy() throws Exception {
        if (scheduler instanceof DisposableBean disposable) {
            disposable.destroy();
        }
        paused.clear();
    }
}
