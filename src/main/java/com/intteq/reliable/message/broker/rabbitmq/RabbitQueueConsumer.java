package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.BrokerCommunicationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.amqp.rabbit.support.DefaultMessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.MessagePropertiesConverter;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.FixedBackOff;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Manual-ack consumer of a single queue on its own channel.
 *
 * <p>Unlike a listener container, the consumer can be cancelled and resumed under the same
 * client-chosen tag, which is what throttling relies on. Deliveries are handed to a worker pool
 * as large as the prefetch, so at most {@code prefetch} handlings run at once.
 *
 * <p>Lifecycle:
 * <pre>
 *   start()  → channel opened, basicQos(prefetch), basicConsume(tag)
 *   pause()  → basicCancel(tag)
 *   resume() → basicConsume(tag)
 *   stop()   → cancel, drain workers, close channel
 * </pre>
 *
 * <p>When the broker closes the channel, or settling a delivery fails with a
 * {@link BrokerCommunicationException}, the channel is closed (the broker requeues its unacked
 * deliveries) and reopened on a recovery thread, every {@link #RECOVERY_INTERVAL} by default.
 * The consumer tag stays the same, so throttling keeps addressing this consumer.
 */
@Slf4j
public class RabbitQueueConsumer {

    static final Duration RECOVERY_INTERVAL = Duration.ofSeconds(3);

    @Getter
    private final String queue;

    @Getter
    private final String consumerTag;

    @Getter
    private final int prefetch;

    private final ConnectionFactory connectionFactory;
    private final Consumer<MessageContext> deliveryHandler;
    private final BackOff recoveryBackOff;
    private final MessagePropertiesConverter propertiesConverter = new DefaultMessagePropertiesConverter();

    private Channel channel;
    private ExecutorService workers;
    private ExecutorService recovery;
    private volatile boolean consuming;
    private volatile boolean stopping;

    public RabbitQueueConsumer(String queue,
                               String consumerTag,
                               int prefetch,
                               ConnectionFactory connectionFactory,
                               Consumer<MessageContext> deliveryHandler) {
        this(queue, consumerTag, prefetch, connectionFactory, deliveryHandler,
                new FixedBackOff(RECOVERY_INTERVAL.toMillis(), FixedBackOff.UNLIMITED_ATTEMPTS));
    }

    RabbitQueueConsumer(String queue,
                        String consumerTag,
                        int prefetch,
                        ConnectionFactory connectionFactory,
                        Consumer<MessageContext> deliveryHandler,
                        BackOff recoveryBackOff) {
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be >= 1 but was " + prefetch);
        }
        this.queue = queue;
        this.consumerTag = consumerTag;
        this.prefetch = prefetch;
        this.connectionFactory = connectionFactory;
        this.deliveryHandler = deliveryHandler;
        this.recoveryBackOff = recoveryBackOff;
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    public synchronized void start() {
        if (workers != null) {
            return;
        }
        stopping = false;
        workers = Executors.newFixedThreadPool(prefetch, new WorkerThreadFactory(queue));
        recovery = Executors.newSingleThreadExecutor(runnable ->
                new Thread(runnable, "reliable-" + queue + "-recovery"));
        try {
            openChannel();
            log.info("RabbitMQ consumer started → queue={} tag={} prefetch={}", queue, consumerTag, prefetch);
        } catch (IOException | RuntimeException e) {
            closeChannel();
            workers.shutdownNow();
            recovery.shutdownNow();
            workers = null;
            recovery = null;
            throw new BrokerCommunicationException("Failed to start consumer on queue '" + queue + "'", e);
        }
    }

    /**
     * Stops new deliveries, waits for in-flight handlings and closes the channel.
     */
    public void stop(Duration timeout) {
        ExecutorService draining;
        synchronized (this) {
            if (workers == null) {
                return;
            }
            stopping = true;
            recovery.shutdownNow();
            if (consuming) {
                try {
                    channel.basicCancel(consumerTag);
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to cancel consumer {} on queue {}", consumerTag, queue, e);
                }
                consuming = false;
            }
            draining = workers;
            workers = null;
            recovery = null;
        }

        draining.shutdown();
        try {
            if (!draining.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight handlings on queue {} did not finish within {}", queue, timeout);
                draining.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            draining.shutdownNow();
        }

        synchronized (this) {
            closeChannel();
        }
        log.info("Stopped RabbitMQ consumer → queue={} tag={}", queue, consumerTag);
    }

    // =====================================================================
    // FLOW CONTROL
    // =====================================================================

    public synchronized void pause() {
        if (!consuming) {
            return;
        }
        try {
            channel.basicCancel(consumerTag);
            consuming = false;
            log.debug("Paused consumer {} on queue {}", consumerTag, queue);
        } catch (IOException | RuntimeException e) {
            throw new BrokerCommunicationException("Failed to cancel consumer '" + consumerTag + "'", e);
        }
    }

    public synchronized void resume() {
        if (consuming || stopping || channel == null) {
            return;
        }
        try {
            consume();
            log.debug("Resumed consumer {} on queue {}", consumerTag, queue);
        } catch (IOException | RuntimeException e) {
            throw new BrokerCommunicationException("Failed to resume consumer '" + consumerTag + "'", e);
        }
    }

    public boolean isConsuming() {
        return consuming;
    }

    // =====================================================================
    // RECOVERY
    // =====================================================================

    /**
     * Closes {@code failed} and reopens the consumer in the background. Ignored when the
     * channel was already replaced or the consumer is stopping.
     */
    void recover(Channel failed) {
        synchronized (this) {
            if (stopping || failed == null || channel != failed) {
                return;
            }
            closeChannel();
            recovery.execute(this::reopen);
        }
        log.warn("Recovering consumer {} on queue {}", consumerTag, queue);
    }

    private void reopen() {
        BackOffExecution execution = recoveryBackOff.start();
        while (true) {
            long wait = execution.nextBackOff();
            if (wait == BackOffExecution.STOP) {
                log.error("Giving up recovering consumer {} on queue {}", consumerTag, queue);
                return;
            }
            try {
                Thread.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            synchronized (this) {
                if (stopping || channel != null) {
                    return;
                }
                try {
                    openChannel();
                    log.info("RabbitMQ consumer recovered → queue={} tag={}", queue, consumerTag);
                    return;
                } catch (IOException | RuntimeException e) {
                    closeChannel();
                    log.warn("Failed to reopen consumer {} on queue {}, will retry", consumerTag, queue, e);
                }
            }
        }
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private void openChannel() throws IOException {
        Connection connection = connectionFactory.createConnection();
        channel = connection.createChannel(false);
        channel.basicQos(prefetch);
        consume();
    }

    private void consume() throws IOException {
        channel.basicConsume(queue, false, consumerTag, new DeliveryConsumer(channel));
        consuming = true;
    }

    private void closeChannel() {
        if (channel != null) {
            RabbitUtils.setPhysicalCloseRequired(channel, true);
            RabbitUtils.closeChannel(channel);
            channel = null;
        }
        consuming = false;
    }

    private void dispatch(Channel deliveryChannel, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        MessageProperties messageProperties =
                propertiesConverter.toMessageProperties(properties, envelope, StandardCharsets.UTF_8.name());
        messageProperties.setConsumerTag(consumerTag);
        messageProperties.setConsumerQueue(queue);

        MessageContext context = MessageContext.forRabbitMQ(deliveryChannel, new Message(body, messageProperties));
        try {
            workers.execute(() -> handle(deliveryChannel, context));
        } catch (RejectedExecutionException e) {
            log.warn("Consumer {} is stopping, returning delivery {} to queue {}",
                    consumerTag, envelope.getDeliveryTag(), queue);
            try {
                deliveryChannel.basicNack(envelope.getDeliveryTag(), false, true);
            } catch (IOException nackFailure) {
                log.error("Failed to return delivery {} to queue {}", envelope.getDeliveryTag(), queue, nackFailure);
            }
        }
    }

    private void handle(Channel deliveryChannel, MessageContext context) {
        try {
            deliveryHandler.accept(context);
        } catch (BrokerCommunicationException e) {
            log.error("Broker failure while handling delivery {} on queue {}, the channel is reopened",
                    context.deliveryTag(), queue, e);
            recover(deliveryChannel);
        }
    }

    private class DeliveryConsumer extends DefaultConsumer {

        DeliveryConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            dispatch(getChannel(), envelope, properties, body);
        }

        @Override
        public void handleCancel(String tag) {
            consuming = false;
            log.warn("Broker cancelled consumer {} on queue {}", tag, queue);
        }

        @Override
        public void handleShutdownSignal(String tag, ShutdownSignalException signal) {
            consuming = false;
            if (!stopping && !signal.isInitiatedByApplication()) {
                log.error("Channel of consumer {} on queue {} was closed by the broker", tag, queue, signal);
                recover(getChannel());
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final String queue;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String queue) {
            this.queue = queue;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "reliable-" + queue + "-" + counter.incrementAndGet());
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Unhandled failure while handling a delivery on queue {}", queue, e));
            return thread;
        }
    }
}
