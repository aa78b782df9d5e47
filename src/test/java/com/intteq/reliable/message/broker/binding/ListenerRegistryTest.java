package com.intteq.reliable.message.broker.binding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenerRegistryTest {

    private static final MessageHandler NOOP = MessageHandler.blocking(ctx -> { });

    @Test
    void severalPatternsMayShareOneQueue() {
        ListenerRegistry registry = new ListenerRegistry()
                .register(binding("orders.*.created", "orders", null), NOOP)
                .register(binding("orders.*.cancelled", "orders", null), NOOP)
                .register(binding("payments.#", "payments", "bulk"), NOOP);

        assertThat(registry.consumedQueues()).containsExactly("orders", "payments");
        assertThat(registry.registrationsFor("orders"))
                .extracting(ListenerRegistration::getRoutingKeyPattern)
                .containsExactly("orders.*.created", "orders.*.cancelled");
        assertThat(registry.channelFor("payments")).isEqualTo("bulk");
        assertThat(registry.channelFor("orders")).isNull();
        assertThat(registry.registrations()).hasSize(3);
    }

    @Test
    void duplicatePatternOnQueueIsRejected() {
        ListenerRegistry registry = new ListenerRegistry().register(binding("orders.created", "orders", null), NOOP);

        assertThatThrownBy(() -> registry.register(binding("orders.created", "orders", null), NOOP))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("orders.created");
    }

    @Test
    void conflictingChannelsOnQueueAreRejected() {
        ListenerRegistry registry = new ListenerRegistry().register(binding("orders.created", "orders", "fast"), NOOP);

        assertThatThrownBy(() -> registry.register(binding("orders.updated", "orders", "slow"), NOOP))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fast");
    }

    @Test
    void declaredQueuesIncludeQueuesWithoutHandlers() {
        ListenerRegistry registry = new ListenerRegistry()
                .declareQueue("audit")
                .register(binding("orders.created", "orders", null), NOOP);

        assertThat(registry.declaredQueues()).containsExactly("audit", "orders");
        assertThat(registry.consumedQueues()).containsExactly("orders");
        assertThat(registry.isEmpty()).isFalse();
        assertThat(new ListenerRegistry().isEmpty()).isTrue();
    }

    @Test
    void bindingAndPolicyValidateOnConstruction() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).baseDelaySeconds(1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(3).baseDelaySeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(3).baseDelaySeconds(1).maxDelaySeconds(-1.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Binding.builder().exchange("x").routingKey(" ").queue("q").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Binding.builder().exchange("x").routingKey("k").queue("q").targetRatePerSecond(0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Binding.builder().routingKey("k").queue("q").build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void policyDefaultsToExponentialDelay() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(5).baseDelaySeconds(1).maxDelaySeconds(5.0).build();

        assertThat(policy.delaySecondsAfter(1)).isEqualTo(1);
        assertThat(policy.delaySecondsAfter(2)).isEqualTo(2);
        assertThat(policy.delaySecondsAfter(4)).isEqualTo(5);
    }

    private static Binding binding(String pattern, String queue, String channel) {
        return Binding.builder()
                .exchange("events")
                .routingKey(pattern)
                .queue(queue)
                .channel(channel)
                .build();
    }
}
