package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.ReliableMessagingProperties;
import com.intteq.reliable.message.broker.binding.ListenerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Starts one {@link RabbitQueueConsumer} per queue that has handlers.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Resolves each queue's prefetch from the channel its bindings name</li>
 *     <li>Gives every consumer a client-chosen tag and registers it in the {@link ConsumerRegistry}</li>
 *     <li>Hands every delivery to the delivery handler (the pipeline)</li>
 *     <li>Stops consumers gracefully, waiting for in-flight handlings</li>
 * </ul>
 *
 * <p>Opening the first consumer connection triggers topology declaration by the {@code AmqpAdmin},
 * so queues exist before {@code basicConsume} is issued.</p>
 */
@Slf4j
public class ReliableListenerContainer implements SmartLifecycle {

    private final ListenerRegistry registry;
    private final ConsumerRegistry consumerRegistry;
    private final ConnectionFactory connectionFactory;
    private final ReliableMessagingProperties properties;
    private final Consumer<MessageContext> deliveryHandler;

    private final List<RabbitQueueConsumer> consumers = new ArrayList<>();
    private volatile boolean running;

    public ReliableListenerContainer(ListenerRegistry registry,
                                     ConsumerRegistry consumerRegistry,
                                     ConnectionFactory connectionFactory,
                                     ReliableMessagingProperties properties,
                                     Consumer<MessageContext> deliveryHandler) {
        this.registry = registry;
        this.consumerRegistry = consumerRegistry;
        this.connectionFactory = connectionFactory;
        this.properties = properties;
        this.deliveryHandler = deliveryHandler;
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Starting reliable RabbitMQ consumers for {} queue(s)...", registry.consumedQueues().size());

        running = true;
        try {
            for (String queue : registry.consumedQueues()) {
                int prefetch = properties.prefetchFor(registry.channelFor(queue));
                RabbitQueueConsumer consumer = new RabbitQueueConsumer(
                        queue, consumerTag(queue), prefetch, connectionFactory, deliveryHandler);

                consumerRegistry.register(consumer);
                consumers.add(consumer);
                consumer.start();
            }
        } catch (RuntimeException e) {
            log.error("Failed to start reliable RabbitMQ consumers, stopping the ones already running", e);
            stop();
            throw e;
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping reliable RabbitMQ consumers...");

        consumers.forEach(consumer -> {
            try {
                consumer.stop(properties.getShutdownTimeout());
            } catch (RuntimeException e) {
                log.warn("Failed to stop RabbitMQ consumer → queue={}", consumer.getQueue(), e);
            } finally {
                consumerRegistry.unregister(consumer.getConsumerTag());
            }
        });

        consumers.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStartup();
    }

    /** Started late and stopped early, so publishers and the admin outlive consumers. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }

    public List<RabbitQueueConsumer> getConsumers() {
        return List.copyOf(consumers);
    }

    private static String consumerTag(String queue) {
        return "reliable::" + queue + "::" + UUID.randomUUID();
    }
}
