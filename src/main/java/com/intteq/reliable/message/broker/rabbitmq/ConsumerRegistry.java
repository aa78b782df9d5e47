package com.intteq.reliable.message.broker.rabbitmq;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running consumers keyed by consumer tag.
 */
@Slf4j
public class ConsumerRegistry {

    private final Map<String, RabbitQueueConsumer> consumers = new ConcurrentHashMap<>();

    public void register(RabbitQueueConsumer consumer) {
        RabbitQueueConsumer previous = consumers.putIfAbsent(consumer.getConsumerTag(), consumer);
        if (previous != null && previous != consumer) {
            throw new IllegalStateException("Consumer tag already in use: " + consumer.getConsumerTag());
        }
        log.debug("Registered consumer {} on queue {}", consumer.getConsumerTag(), consumer.getQueue());
    }

    public void unregister(String consumerTag) {
        consumers.remove(consumerTag);
    }

    public Optional<RabbitQueueConsumer> find(String consumerTag) {
        return Optional.ofNullable(consumerTag).map(consumers::get);
    }

    /**
     * @throws IllegalStateException if no consumer with that tag is running
     */
    public RabbitQueueConsumer require(String consumerTag) {
        return find(consumerTag)
                .orElseThrow(() -> new IllegalStateException("Unknown consumer tag: " + consumerTag));
    }

    public Collection<RabbitQueueConsumer> consumers() {
        return List.copyOf(consumers.values());
    }

    public void clear() {
        consumers.clear();
    }
}
