package com.intteq.reliable.message.broker;

import com.intteq.reliable.message.broker.inspection.InspectTraffic;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the reliable message broker.
 *
 * <p>Prefix: {@code messaging.reliability.*}
 *
 * <p>Examples:
 * <pre>
 * messaging.reliability.app-name=orders-service
 * messaging.reliability.delay-mode=ttl-relay
 * messaging.reliability.inspect-traffic=inbound
 * messaging.reliability.default-prefetch=1
 * messaging.reliability.channels.bulk.prefetch-count=20
 * messaging.reliability.shutdown-timeout=15s
 * </pre>
 *
 * <p>Connection settings are read from {@code spring.rabbitmq.*}. These properties are validated
 * at startup; invalid values make the application fail fast.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "messaging.reliability")
public class ReliableMessagingProperties {

    /** Switches the whole auto-configuration off when false. */
    private boolean enabled = true;

    /** Start consumers together with the application context. */
    private boolean autoStartup = true;

    /** AMQP connection name. Falls back to {@code spring.application.name}, then to a hostname-based name. */
    private String appName;

    /** How delayed redelivery is realised on the broker. */
    @NotNull(message = "messaging.reliability.delay-mode must not be null")
    private RetryTopology.DelayMode delayMode = RetryTopology.DelayMode.NATIVE;

    /** Which directions of traffic are logged. */
    @NotNull(message = "messaging.reliability.inspect-traffic must not be null")
    private InspectTraffic inspectTraffic = InspectTraffic.ALL;

    /** Prefetch of queues whose bindings name no channel. */
    @Min(value = 1, message = "messaging.reliability.default-prefetch must be >= 1")
    private int defaultPrefetch = 1;

    /** How long stopping waits for in-flight handlings per queue. */
    @NotNull(message = "messaging.reliability.shutdown-timeout must not be null")
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /** Named channels referenced by bindings. */
    @Valid
    private Map<String, ChannelConfig> channels = new HashMap<>();

    /**
     * Prefetch for the queues bound on {@code channel}.
     *
     * @throws IllegalStateException if the channel is not configured
     */
    public int prefetchFor(String channel) {
        if (channel == null) {
            return defaultPrefetch;
        }
        ChannelConfig config = channels.get(channel);
        if (config == null) {
            throw new IllegalStateException("Binding references unknown channel '" + channel
                    + "'. Configure messaging.reliability.channels." + channel + ".prefetch-count");
        }
        return config.getPrefetchCount();
    }

    // ========================================================================
    // Channel
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class ChannelConfig {

        @Min(value = 1, message = "channel.prefetch-count must be >= 1")
        private int prefetchCount = 1;
    }
}
