package com.intteq.reliable.message.broker.routing;

import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.binding.ListenerRegistration;
import com.intteq.reliable.message.broker.binding.MessageHandler;
import com.intteq.reliable.message.broker.exception.RoutingConfigurationException;
import com.intteq.reliable.message.broker.retry.AttemptTracker;
import com.intteq.reliable.message.broker.retry.RetryHeaders;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlerDispatcherTest {

    private static final MessageHandler NOOP = MessageHandler.blocking(ctx -> { });

    private final ListenerRegistration created = registration("orders.exchange", "orders.*.created", "orders");
    private final ListenerRegistration cancelled = registration("orders.exchange", "orders.*.cancelled", "orders");
    private final ListenerRegistration terminal = registration("", "orders.dead", "orders");

    private final HandlerDispatcher dispatcher =
            new HandlerDispatcher("orders", List.of(created, cancelled, terminal), new AttemptTracker());

    @Test
    void firstDeliveryMatchesOnPhysicalKey() {
        assertThat(dispatcher.resolve(message("orders.eu.cancelled"))).isSameAs(cancelled);
    }

    @Test
    void redeliveryMatchesOnOriginalKey() {
        Message redelivered = message("orders");
        redelivered.getMessageProperties().setHeader(RetryHeaders.ORIGINAL_ROUTING_KEY, "orders.eu.created");

        assertThat(dispatcher.resolve(redelivered)).isSameAs(created);
    }

    @Test
    void deadSuffixMatchesOnPhysicalKeyOnly() {
        Message deadLettered = message("orders.dead");
        deadLettered.getMessageProperties().setHeader(RetryHeaders.ORIGINAL_ROUTING_KEY, "orders.eu.created");
        deadLettered.getMessageProperties().setHeader(RetryHeaders.FAILED_HANDLER_ROUTING_KEY, "orders.*.created");

        assertThat(dispatcher.resolve(deadLettered)).isSameAs(terminal);
    }

    @Test
    void redeliveryIsPinnedToTheHandlerThatFailed() {
        ListenerRegistration everything = registration("orders.exchange", "orders.#", "audit");
        ListenerRegistration euOnly = registration("orders.exchange", "orders.eu.*", "audit");
        HandlerDispatcher audit = new HandlerDispatcher("audit", List.of(everything, euOnly), new AttemptTracker());

        Message redelivered = message("audit");
        redelivered.getMessageProperties().setHeader(RetryHeaders.ORIGINAL_ROUTING_KEY, "orders.eu.created");
        redelivered.getMessageProperties().setHeader(RetryHeaders.FAILED_HANDLER_ROUTING_KEY, "orders.eu.*");

        assertThat(audit.resolve(redelivered)).isSameAs(euOnly);
    }

    @Test
    void noMatchIsARoutingConfigurationFault() {
        assertThatThrownBy(() -> dispatcher.resolve(message("orders.eu.shipped")))
                .isInstanceOf(RoutingConfigurationException.class)
                .hasMessageContaining("orders.eu.shipped");
    }

    @Test
    void severalMatchesIsARoutingConfigurationFault() {
        ListenerRegistration everything = registration("orders.exchange", "orders.#", "audit");
        ListenerRegistration euOnly = registration("orders.exchange", "orders.eu.*", "audit");
        HandlerDispatcher audit = new HandlerDispatcher("audit", List.of(everything, euOnly), new AttemptTracker());

        assertThatThrownBy(() -> audit.resolve(message("orders.eu.created")))
                .isInstanceOf(RoutingConfigurationException.class)
                .hasMessageContaining("orders.#")
                .hasMessageContaining("orders.eu.*");
    }

    private static ListenerRegistration registration(String exchange, String pattern, String queue) {
        return ListenerRegistration.of(
                Binding.builder().exchange(exchange).routingKey(pattern).queue(queue).build(), NOOP);
    }

    private static Message message(String receivedRoutingKey) {
        MessageProperties properties = new MessageProperties();
        properties.setReceivedRoutingKey(receivedRoutingKey);
        return new Message(new byte[0], properties);
    }
}
