package com.intteq.reliable.message.broker.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.message.broker.ReliableMessagingProperties;
import com.intteq.reliable.message.broker.inspection.DeliveryInspector;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpMessageReturnedException;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * RabbitMQ connection and publishing setup.
 *
 * Connection settings come from {@code spring.rabbitmq.*}. SSL is handled by Spring Boot when
 * {@code spring.rabbitmq.ssl.enabled=true}. Each bean backs off when the application defines its own.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RabbitMQConfig {

    static final String LIBRARY_NAME = "reliable-message-broker";

    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory connectionFactory(RabbitProperties rabbitProps,
                                               ReliableMessagingProperties properties,
                                               Environment environment) {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(rabbitProps.determineHost());
        factory.setPort(rabbitProps.determinePort());
        factory.setUsername(rabbitProps.determineUsername());
        factory.setPassword(rabbitProps.determinePassword());
        if (rabbitProps.determineVirtualHost() != null) {
            factory.setVirtualHost(rabbitProps.determineVirtualHost());
        }

        var timeout = rabbitProps.getConnectionTimeout();
        factory.setConnectionTimeout(timeout != null ? (int) timeout.toMillis() : 10000);

        var heartbeat = rabbitProps.getRequestedHeartbeat();
        factory.setRequestedHeartBeat(heartbeat != null ? (int) heartbeat.getSeconds() : 60);

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(50);
        factory.setChannelCheckoutTimeout(10_000);

        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        String connectionName = connectionName(properties.getAppName(),
                environment.getProperty("spring.application.name"), hostname());
        factory.setConnectionNameStrategy(cf -> connectionName);

        if (Boolean.TRUE.equals(rabbitProps.getSsl().getEnabled())) {
            log.info("RabbitMQ SSL enabled by application properties");
        }

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} connectionName={}",
                rabbitProps.determineHost(), rabbitProps.determinePort(), connectionName);

        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageConverter messageConverter(ObjectProvider<ObjectMapper> objectMapper) {
        Jackson2JsonMessageConverter converter =
                new Jackson2JsonMessageConverter(objectMapper.getIfAvailable(ObjectMapper::new));
        converter.setCreateMessageIds(true);
        return converter;
    }

    @Bean
    @ConditionalOnMissingBean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         MessageConverter messageConverter,
                                         ObjectProvider<DeliveryInspector> inspector) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish failed: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        DeliveryInspector deliveryInspector = inspector.getIfAvailable();
        template.setReturnsCallback(returned -> reportReturned(returned, deliveryInspector));

        return template;
    }

    /**
     * A returned message was unroutable, so a retry or dead-letter republish may have been lost.
     * Reported as a failed outbound publish.
     */
    static void reportReturned(ReturnedMessage returned, @Nullable DeliveryInspector inspector) {
        if (inspector == null) {
            log.error("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                    returned.getExchange(),
                    returned.getRoutingKey(),
                    returned.getReplyCode(),
                    returned.getReplyText());
            return;
        }
        inspector.inspectOutbound(returned.getExchange(), returned.getRoutingKey(), returned.getMessage(),
                new AmqpMessageReturnedException(
                        "Message returned: " + returned.getReplyCode() + " " + returned.getReplyText(), returned));
    }

    /**
     * Name shown for the connection in the broker UI: the configured app name, else
     * {@code spring.application.name}, else {@code <host>::reliable-message-broker}.
     */
    static String connectionName(String appName, String springApplicationName, String host) {
        if (StringUtils.hasText(appName)) {
            return appName;
        }
        if (StringUtils.hasText(springApplicationName)) {
            return springApplicationName;
        }
        return host + "::" + LIBRARY_NAME;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local hostname for the connection name", e);
            return "unknown-host";
        }
    }
}
