package com.intteq.reliable.message.broker.binding;

/**
 * Callback through which applications register their handlers.
 *
 * <p>Every bean of this type is applied to the shared {@link ListenerRegistry} before the
 * broker topology is declared:
 * <pre>
 * {@code
 * @Bean
 * ListenerConfigurer orderListeners(OrderService orders) {
 *     return registry -> registry.register(
 *             Binding.builder().exchange("orders.exchange").routingKey("orders.created").queue("orders").build(),
 *             MessageHandler.blocking(ctx -> orders.process(ctx.bodyAsString())));
 * }
 * }
 * </pre>
 */
@FunctionalInterface
public interface ListenerConfigurer {

    void configure(ListenerRegistry registry);
}
