package com.intteq.message.scheduler;

import com.intteq.message.scheduler.internal.DeadLetterExchangeAndMessageTtlScheduler;
import com.intteq.message.scheduler.internal.DefaultConventions;
import com.intteq.message.scheduler.internal.DefaultExchangeDeclareStrategy;
import com.intteq.message.scheduler.internal.DefaultMessageDeliveryModeStrategy;
import com.intteq.message.scheduler.internal.SchedulerExecutors;
import com.intteq.message.scheduler.rabbitmq.RabbitAdvancedBus;
import com.intteq.message.scheduler.rabbitmq.RabbitMQConfig;
import com.intteq.message.scheduler.spi.AdvancedBus;
import com.intteq.message.scheduler.spi.Conventions;
import com.intteq.message.scheduler.spi.ExchangeDeclareStrategy;
import com.intteq.message.scheduler.spi.MessageDeliveryModeStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.amqp.support.converter.SimpleMessageConverter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for the message scheduler.
 *
 * <p>This configuration exposes the {@link MessageScheduler} and the strategies it is built
 * from. It is enabled by default and can be disabled by setting:
 *
 * <pre>
 *   messaging.scheduler.enabled = false
 * </pre>
 *
 * <p>Every strategy ({@link Conventions}, {@link MessageDeliveryModeStrategy},
 * {@link ExchangeDeclareStrategy}, {@link AdvancedBus}) backs off when the application provides
 * its own bean. The {@link MeterRegistry} is optional; without one, counters go to a private
 * {@link SimpleMeterRegistry}.
 */
@AutoConfiguration(after = {RabbitMQConfig.class, RabbitAutoConfiguration.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "messaging.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessagingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Conventions conventions() {
        return new DefaultConventions();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageDeliveryModeStrategy messageDeliveryModeStrategy(SchedulerProperties props) {
        return new DefaultMessageDeliveryModeStrategy(props.isPersistentMessages());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerExecutors schedulerExecutors(SchedulerProperties props) {
        return new SchedulerExecutors(props.getBrokerIoThreads());
    }

    @Bean
    @ConditionalOnMissingBean
    public AdvancedBus advancedBus(AmqpAdmin amqpAdmin,
                                   RabbitTemplate rabbitTemplate,
                                   SchedulerExecutors executors,
                                   SchedulerProperties props) {
        return new RabbitAdvancedBus(amqpAdmin, rabbitTemplate, executors.getBrokerExecutor(),
                props.isPublisherConfirms(), props.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExchangeDeclareStrategy exchangeDeclareStrategy(AdvancedBus advancedBus) {
        return new DefaultExchangeDeclareStrategy(advancedBus);
    }

    /**
     * Creates the {@link MessageScheduler}. The meterRegistry is optional and the message converter
     * falls back to {@link SimpleMessageConverter} when the application defines none.
     */
    @Bean
    @ConditionalOnMissingBean
    public MessageScheduler messageScheduler(SchedulerProperties props,
                                             AdvancedBus advancedBus,
                                             Conventions conventions,
                                             MessageDeliveryModeStrategy messageDeliveryModeStrategy,
                                             ExchangeDeclareStrategy exchangeDeclareStrategy,
                                             SchedulerExecutors executors,
                                             ObjectProvider<MessageConverter> messageConverter,
                                             ObjectProvider<MeterRegistry> meterRegistry) {
        return new DeadLetterExchangeAndMessageTtlScheduler(
                props.getTimeout(),
                advancedBus,
                conventions,
                messageDeliveryModeStrategy,
                exchangeDeclareStrategy,
                messageConverter.getIfUnique(SimpleMessageConverter::new),
                executors.getTimeoutScheduler(),
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
                Clock.systemUTC());
    }
}
