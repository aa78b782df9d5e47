package com.intteq.reliable.message.broker;

import com.intteq.reliable.message.broker.binding.ListenerConfigurer;
import com.intteq.reliable.message.broker.binding.ListenerRegistry;
import com.intteq.reliable.message.broker.inspection.DeliveryInspector;
import com.intteq.reliable.message.broker.inspection.LoggingDeliveryInspector;
import com.intteq.reliable.message.broker.internal.DeliveryPipeline;
import com.intteq.reliable.message.broker.internal.ReliablePublisher;
import com.intteq.reliable.message.broker.rabbitmq.BrokerGateway;
import com.intteq.reliable.message.broker.rabbitmq.ConsumerRegistry;
import com.intteq.reliable.message.broker.rabbitmq.QueueTopologyBuilder;
import com.intteq.reliable.message.broker.rabbitmq.RabbitBrokerGateway;
import com.intteq.reliable.message.broker.rabbitmq.RabbitMQConfig;
import com.intteq.reliable.message.broker.rabbitmq.ReliableListenerContainer;
import com.intteq.reliable.message.broker.retry.AttemptTracker;
import com.intteq.reliable.message.broker.retry.FailureClassifier;
import com.intteq.reliable.message.broker.retry.RetryRouter;
import com.intteq.reliable.message.broker.retry.RetryTopology;
import com.intteq.reliable.message.broker.throttle.ThrottleController;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Auto-configuration for the reliable message broker.
 *
 * <p>Applications contribute {@link ListenerConfigurer} beans; everything else is wired here.
 * Enabled by default and can be disabled with:
 *
 * <pre>
 *   messaging.reliability.enabled = false
 * </pre>
 *
 * <p>The {@link MeterRegistry} is optional; metrics are skipped when none is present. Runs
 * before Spring Boot's RabbitMQ auto-configuration so that its connection factory and template
 * back off in favour of the ones in {@link RabbitMQConfig}, while its {@code AmqpAdmin} still
 * declares the topology.
 */
@Slf4j
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@ConditionalOnClass(RabbitTemplate.class)
@ConditionalOnProperty(prefix = "messaging.reliability", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({ReliableMessagingProperties.class, RabbitProperties.class})
@Import(RabbitMQConfig.class)
public class ReliableMessagingAutoConfiguration {

    // =====================================================================
    // REGISTRATION
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public ListenerRegistry listenerRegistry(ObjectProvider<ListenerConfigurer> configurers) {
        ListenerRegistry registry = new ListenerRegistry();
        configurers.orderedStream().forEach(configurer -> configurer.configure(registry));
        log.info("Listener registry built: {} handler(s) on {} queue(s)",
                registry.registrations().size(), registry.declaredQueues().size());
        return registry;
    }

    // =====================================================================
    // TOPOLOGY
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public RetryTopology retryTopology(ReliableMessagingProperties properties) {
        return new RetryTopology(properties.getDelayMode());
    }

    @Bean
    public Declarables reliableMessagingDeclarables(RetryTopology topology, ListenerRegistry registry) {
        return new QueueTopologyBuilder(topology).build(registry);
    }

    // =====================================================================
    // BROKER ACCESS
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public DeliveryInspector deliveryInspector(ReliableMessagingProperties properties,
                                               ObjectProvider<MeterRegistry> meterRegistry) {
        return new LoggingDeliveryInspector(properties.getInspectTraffic(), meterRegistry.getIfAvailable());
    }

    @Bean
    public ConsumerRegistry consumerRegistry() {
        return new ConsumerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerGateway brokerGateway(RabbitTemplate rabbitTemplate,
                                       ConsumerRegistry consumerRegistry,
                                       DeliveryInspector inspector) {
        return new RabbitBrokerGateway(rabbitTemplate, consumerRegistry, inspector);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReliablePublisher reliablePublisher(RabbitTemplate rabbitTemplate,
                                               DeliveryInspector inspector,
                                               ObjectProvider<MeterRegistry> meterRegistry) {
        return new ReliablePublisher(rabbitTemplate, inspector, meterRegistry.getIfAvailable());
    }

    // =====================================================================
    // DELIVERY PIPELINE
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public AttemptTracker attemptTracker() {
        return new AttemptTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureClassifier failureClassifier() {
        return FailureClassifier.defaultClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryRouter retryRouter(BrokerGateway brokerGateway, AttemptTracker attemptTracker, RetryTopology topology) {
        return new RetryRouter(brokerGateway, attemptTracker, topology);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThrottleController throttleController(BrokerGateway brokerGateway) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reliable-throttle-");
        scheduler.initialize();
        return new ThrottleController(brokerGateway, scheduler, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryPipeline deliveryPipeline(ListenerRegistry registry,
                                             AttemptTracker attemptTracker,
                                             FailureClassifier failureClassifier,
                                             RetryRouter retryRouter,
                                             ThrottleController throttleController,
                                             DeliveryInspector inspector) {
        return new DeliveryPipeline(registry, attemptTracker, failureClassifier, retryRouter,
                throttleController, inspector);
    }

    @Bean
    public ReliableListenerContainer reliableListenerContainer(ListenerRegistry registry,
                                                               ConsumerRegistry consumerRegistry,
                                                               ConnectionFactory connectionFactory,
                                                               ReliableMessagingProperties properties,
                                                               DeliveryPipeline pipeline) {
        return new ReliableListenerContainer(registry, consumerRegistry, connectionFactory, properties, pipeline);
    }
}
