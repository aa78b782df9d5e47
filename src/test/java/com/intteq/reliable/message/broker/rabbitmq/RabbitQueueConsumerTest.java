package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.BrokerCommunicationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.util.backoff.FixedBackOff;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RabbitQueueConsumerTest {

    @Mock
    private ConnectionFactory connectionFactory;

    @Mock
    private Connection connection;

    @Mock
    private Channel channel;

    @Mock
    private Channel reopenedChannel;

    @BeforeEach
    void setUp() {
        lenient().when(connectionFactory.createConnection()).thenReturn(connection);
        lenient().when(connection.createChannel(false)).thenReturn(channel);
    }

    @Test
    void startAppliesPrefetchAndConsumesWithClientTag() throws IOException {
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 4, connectionFactory, ctx -> { });

        consumer.start();

        InOrder order = inOrder(channel);
        order.verify(channel).basicQos(4);
        order.verify(channel).basicConsume(eq("orders"), eq(false), eq("tag-1"), any(Consumer.class));
        assertThat(consumer.isConsuming()).isTrue();
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void pauseCancelsAndResumeConsumesAgainWithTheSameTag() throws IOException {
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> { });
        consumer.start();

        consumer.pause();
        consumer.pause();
        assertThat(consumer.isConsuming()).isFalse();
        consumer.resume();

        verify(channel, times(1)).basicCancel("tag-1");
        verify(channel, times(2)).basicConsume(eq("orders"), eq(false), eq("tag-1"), any(Consumer.class));
        assertThat(consumer.isConsuming()).isTrue();
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void deliveriesReachTheHandlerWithQueueAndTag() throws Exception {
        CountDownLatch handled = new CountDownLatch(1);
        AtomicReference<MessageContext> received = new AtomicReference<>();
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 2, connectionFactory, ctx -> {
            received.set(ctx);
            handled.countDown();
        });
        consumer.start();

        ArgumentCaptor<Consumer> callback = ArgumentCaptor.forClass(Consumer.class);
        verify(channel).basicConsume(eq("orders"), eq(false), eq("tag-1"), callback.capture());
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .messageId("m-1")
                .headers(Map.of("x-attempt-count", 1))
                .build();
        callback.getValue().handleDelivery("tag-1", new Envelope(9L, false, "orders.exchange", "orders.eu.created"),
                properties, "{}".getBytes(StandardCharsets.UTF_8));

        assertThat(handled.await(5, TimeUnit.SECONDS)).isTrue();
        MessageContext context = received.get();
        assertThat(context.deliveryTag()).isEqualTo(9L);
        assertThat(context.routingKey()).isEqualTo("orders.eu.created");
        assertThat(context.consumerQueue()).isEqualTo("orders");
        assertThat(context.consumerTag()).isEqualTo("tag-1");
        assertThat(context.messageId()).isEqualTo("m-1");
        assertThat((Object) context.header("x-attempt-count")).isEqualTo(1);
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void failedResumeIsABrokerCommunicationFault() throws IOException {
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> { });
        consumer.start();
        consumer.pause();
        when(channel.basicConsume(anyString(), anyBoolean(), anyString(), any(Consumer.class)))
                .thenThrow(new IOException("channel closed"));

        assertThatThrownBy(consumer::resume).isInstanceOf(BrokerCommunicationException.class);
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void brokerShutdownReopensTheChannelUnderTheSameTag() throws Exception {
        when(connection.createChannel(false)).thenReturn(channel, reopenedChannel);
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> { },
                new FixedBackOff(10, 5));
        consumer.start();
        Consumer callback = capturedConsumer();

        callback.handleShutdownSignal("tag-1", new ShutdownSignalException(false, false, null, channel));

        verify(reopenedChannel, timeout(5000)).basicConsume(eq("orders"), eq(false), eq("tag-1"), any(Consumer.class));
        verify(reopenedChannel).basicQos(1);
        verify(connectionFactory, times(2)).createConnection();
        verify(channel).close();

        consumer.pause();
        verify(reopenedChannel).basicCancel("tag-1");
        consumer.resume();
        verify(reopenedChannel, times(2)).basicConsume(eq("orders"), eq(false), eq("tag-1"), any(Consumer.class));
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void applicationInitiatedShutdownIsNotRecovered() throws Exception {
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> { },
                new FixedBackOff(10, 5));
        consumer.start();

        capturedConsumer().handleShutdownSignal("tag-1", new ShutdownSignalException(false, true, null, channel));

        Thread.sleep(100);
        verify(connectionFactory, times(1)).createConnection();
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void brokerFaultWhileSettlingClosesAndReopensTheChannel() throws Exception {
        when(connection.createChannel(false)).thenReturn(channel, reopenedChannel);
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> {
            throw new BrokerCommunicationException("Failed to publish", new IOException("connection reset"));
        }, new FixedBackOff(10, 5));
        consumer.start();

        capturedConsumer().handleDelivery("tag-1", new Envelope(9L, false, "orders.exchange", "orders.eu.created"),
                new AMQP.BasicProperties.Builder().messageId("m-1").build(), "{}".getBytes(StandardCharsets.UTF_8));

        verify(reopenedChannel, timeout(5000)).basicConsume(eq("orders"), eq(false), eq("tag-1"), any(Consumer.class));
        verify(channel).close();
        verify(channel, never()).basicAck(9L, false);
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
        consumer.stop(Duration.ofSeconds(1));
    }

    @Test
    void stopDuringRecoveryAbandonsTheReopen() throws Exception {
        RabbitQueueConsumer consumer = new RabbitQueueConsumer("orders", "tag-1", 1, connectionFactory, ctx -> { },
                new FixedBackOff(60_000, 5));
        consumer.start();
        capturedConsumer().handleShutdownSignal("tag-1", new ShutdownSignalException(false, false, null, channel));

        consumer.stop(Duration.ofSeconds(1));

        verify(connectionFactory, times(1)).createConnection();
        assertThat(consumer.isConsuming()).isFalse();
    }

    @Test
    void rejectsPrefetchBelowOne() {
        assertThatThrownBy(() -> new RabbitQueueConsumer("orders", "tag-1", 0, connectionFactory, ctx -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Consumer capturedConsumer() throws IOException {
        ArgumentCaptor<Consumer> callback = ArgumentCaptor.forClass(Consumer.class);
        verify(channel).basicConsume(eq("orders"), eq(false), eq("tag-1"), callback.capture());
        return callback.getValue();
    }
}
