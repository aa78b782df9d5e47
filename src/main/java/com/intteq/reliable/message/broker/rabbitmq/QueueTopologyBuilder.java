package com.intteq.reliable.message.broker.rabbitmq;

import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.binding.ListenerRegistration;
import com.intteq.reliable.message.broker.binding.ListenerRegistry;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.CustomExchange;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the broker topology from the registered bindings:
 * <ul>
 *     <li>one durable topic exchange per binding exchange (the default exchange is never declared)</li>
 *     <li>one durable queue per registered queue, bound with every pattern registered on it</li>
 *     <li>one durable {@code <queue>.dead} queue per registered queue</li>
 *     <li>the shared delay exchange and the relay queue releasing messages to the default exchange</li>
 * </ul>
 *
 * <p>This class contains no consumer logic. The returned {@link Declarables} are declared by
 * the {@code AmqpAdmin} when the connection opens.
 */
@Slf4j
@RequiredArgsConstructor
public class QueueTopologyBuilder {

    private final RetryTopology topology;

    public Declarables build(ListenerRegistry registry) {
        List<Declarable> declarables = new ArrayList<>();

        // ---------------------------------------------------------------------
        // 1. Binding exchanges
        // ---------------------------------------------------------------------
        Map<String, TopicExchange> exchanges = new LinkedHashMap<>();
        for (ListenerRegistration registration : registry.registrations()) {
            Binding binding = registration.getBinding();
            if (binding.isOnDefaultExchange() || exchanges.containsKey(binding.getExchange())) {
                continue;
            }
            TopicExchange exchange = new TopicExchange(binding.getExchange(), true, false);
            exchanges.put(binding.getExchange(), exchange);
            declarables.add(exchange);
            log.info("Declared exchange: {}", binding.getExchange());
        }

        // ---------------------------------------------------------------------
        // 2. Queues, their bindings and their dead-letter queues
        // ---------------------------------------------------------------------
        Set<String> queueNames = new LinkedHashSet<>(registry.declaredQueues());
        Set<String> declaredNames = new LinkedHashSet<>();

        for (String queueName : queueNames) {
            Queue queue = QueueBuilder.durable(queueName).build();
            if (declaredNames.add(queueName)) {
                declarables.add(queue);
                log.info("Declared queue: {}", queueName);
            }

            for (ListenerRegistration registration : registry.registrationsFor(queueName)) {
                Binding binding = registration.getBinding();
                if (binding.isOnDefaultExchange()) {
                    continue;
                }
                declarables.add(BindingBuilder.bind(queue)
                        .to(exchanges.get(binding.getExchange()))
                        .with(binding.getRoutingKey()));
                log.info("Binding created: queue={} exchange={} routingKey={}",
                        queueName, binding.getExchange(), binding.getRoutingKey());
            }
        }

        for (String queueName : queueNames) {
            String deadLetterQueue = RetryTopology.deadLetterQueue(queueName);
            if (declaredNames.add(deadLetterQueue)) {
                declarables.add(QueueBuilder.durable(deadLetterQueue).build());
                log.info("Declared dead-letter queue: {}", deadLetterQueue);
            }
        }

        // ---------------------------------------------------------------------
        // 3. Delayed redelivery
        // ---------------------------------------------------------------------
        Exchange delayExchange = delayExchange();
        Queue relayQueue = relayQueue();
        declarables.add(delayExchange);
        declarables.add(relayQueue);
        declarables.add(BindingBuilder.bind(relayQueue).to(delayExchange).with("#").noargs());
        log.info("Declared delay relay: exchange={} queue={} mode={}",
                RetryTopology.DELAY_EXCHANGE, RetryTopology.RELAY_QUEUE, topology.getDelayMode());

        return new Declarables(declarables);
    }

    private Exchange delayExchange() {
        if (topology.getDelayMode() == RetryTopology.DelayMode.NATIVE) {
            return new CustomExchange(RetryTopology.DELAY_EXCHANGE, "x-delayed-message", true, false,
                    Map.of("x-delayed-type", "topic"));
        }
        return new TopicExchange(RetryTopology.DELAY_EXCHANGE, true, false);
    }

    private Queue relayQueue() {
        QueueBuilder builder = QueueBuilder.durable(RetryTopology.RELAY_QUEUE)
                .deadLetterExchange(RetryTopology.DEFAULT_EXCHANGE);
        if (topology.getDelayMode() == RetryTopology.DelayMode.NATIVE) {
            builder.ttl(0);
        }
        return builder.build();
    }
}
