package com.intteq.message.scheduler.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.message.scheduler.SchedulerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * RabbitMQ infrastructure configuration for the message scheduler.
 *
 * <p>Runs before Spring Boot's own Rabbit auto-configuration so that its connection factory
 * matches what {@link RabbitAdvancedBus} expects (confirm mode when
 * {@code messaging.scheduler.publisher-confirms=true}). Every bean backs off when the
 * application defines its own.
 *
 * SSL is supported automatically if spring.rabbitmq.ssl.enabled=true.
 */
@Slf4j
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@ConditionalOnClass(RabbitTemplate.class)
@EnableConfigurationProperties({RabbitProperties.class, SchedulerProperties.class})
@ConditionalOnProperty(prefix = "messaging.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RabbitMQConfig {

    private final RabbitProperties rabbitProps;
    private final SchedulerProperties schedulerProps;

    public RabbitMQConfig(RabbitProperties rabbitProps, SchedulerProperties schedulerProps) {
        this.rabbitProps = rabbitProps;
        this.schedulerProps = schedulerProps;
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public CachingConnectionFactory connectionFactory() {
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

        // Relay publishes wait for the broker ack on their own channel
        if (schedulerProps.isPublisherConfirms()) {
            factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.SIMPLE);
        }

        // SSL handled automatically by Spring Boot when enabled
        if (Boolean.TRUE.equals(rabbitProps.getSsl().getEnabled())) {
            log.info("RabbitMQ SSL enabled by application properties");
        }

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} confirms={}",
                rabbitProps.determineHost(), rabbitProps.determinePort(), schedulerProps.isPublisherConfirms());

        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(MessageConverter.class)
    public MessageConverter messageConverter(ObjectProvider<ObjectMapper> objectMapper) {
        Jackson2JsonMessageConverter converter = new Jackson2JsonMessageConverter(
                objectMapper.getIfAvailable(ObjectMapper::new));
        converter.setCreateMessageIds(true);
        return converter;
    }

    @Bean
    @ConditionalOnMissingBean(RabbitTemplate.class)
    public RabbitTemplate rabbitTemplate(
            ConnectionFactory connectionFactory,
            MessageConverter messageConverter
    ) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        // relay publishes are never mandatory; unroutable messages are dropped by the broker
        template.setMandatory(false);
        return template;
    }

    @Bean
    @ConditionalOnMissingBean(AmqpAdmin.class)
    public RabbitAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);
        // declaration errors must reach the caller of each scheduling call
        admin.setIgnoreDeclarationExceptions(false);
        return admin;
    }
}
