package com.intteq.message.scheduler.rabbitmq;

import com.intteq.message.scheduler.spi.AdvancedBus;
import com.rabbitmq.client.AMQP;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.support.DefaultMessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.MessagePropertiesConverter;
import org.springframework.util.Assert;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * {@link AdvancedBus} on top of Spring AMQP.
 *
 * <p>Spring AMQP's {@link AmqpAdmin} and {@link RabbitTemplate} block until the broker answers,
 * so every operation runs on {@code brokerExecutor} and the caller only ever holds a future.
 * Cancelling a returned future releases the caller immediately; a call already handed to the
 * broker runs to completion on the worker thread.
 *
 * <p>Exchanges and queues are durable and never auto-deleted, matching the rest of the
 * application topology. Publishing goes through {@link RabbitTemplate#execute} so the
 * {@code mandatory} flag can be chosen per call rather than per template.
 */
@Slf4j
public class RabbitAdvancedBus implements AdvancedBus {

    private final AmqpAdmin amqpAdmin;
    private final RabbitTemplate rabbitTemplate;
    private final Executor brokerExecutor;
    private final boolean waitForConfirms;
    private final Duration confirmTimeout;
    private final MessagePropertiesConverter propertiesConverter = new DefaultMessagePropertiesConverter();

    public RabbitAdvancedBus(AmqpAdmin amqpAdmin,
                             RabbitTemplate rabbitTemplate,
                             Executor brokerExecutor,
                             boolean waitForConfirms,
                             Duration confirmTimeout) {
        Assert.notNull(amqpAdmin, "amqpAdmin must not be null");
        Assert.notNull(rabbitTemplate, "rabbitTemplate must not be null");
        Assert.notNull(brokerExecutor, "brokerExecutor must not be null");
        Assert.notNull(confirmTimeout, "confirmTimeout must not be null");
        this.amqpAdmin = amqpAdmin;
        this.rabbitTemplate = rabbitTemplate;
        this.brokerExecutor = brokerExecutor;
        this.waitForConfirms = waitForConfirms;
        this.confirmTimeout = confirmTimeout;
    }

    @Override
    public CompletableFuture<Exchange> exchangeDeclareAsync(String name, String type) {
        return submit(() -> {
            Exchange exchange = new ExchangeBuilder(name, type).durable(true).build();
            amqpAdmin.declareExchange(exchange);
            log.debug("Declared exchange: name={} type={}", name, type);
            return exchange;
        });
    }

    @Override
    public CompletableFuture<Queue> queueDeclareAsync(String name, UnaryOperator<QueueBuilder> configure) {
        return submit(() -> {
            Queue queue = configure.apply(QueueBuilder.durable(name)).build();
            amqpAdmin.declareQueue(queue);
            log.debug("Declared queue: name={} arguments={}", name, queue.getArguments());
            return queue;
        });
    }

    @Override
    public CompletableFuture<Void> bindAsync(Exchange exchange, Queue queue, String routingKey) {
        return submit(() -> {
            Binding binding = BindingBuilder.bind(queue).to(exchange).with(routingKey).noargs();
            amqpAdmin.declareBinding(binding);
            log.debug("Binding created: queue={} exchange={} routingKey='{}'",
                    queue.getName(), exchange.getName(), routingKey);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> publishAsync(Exchange exchange, String routingKey, boolean mandatory, Message message) {
        return submit(() -> {
            rabbitTemplate.execute(channel -> {
                AMQP.BasicProperties properties = propertiesConverter.fromMessageProperties(
                        message.getMessageProperties(), StandardCharsets.UTF_8.name());
                channel.basicPublish(exchange.getName(), routingKey, mandatory, properties, message.getBody());
                if (waitForConfirms) {
                    channel.waitForConfirmsOrDie(confirmTimeout.toMillis());
                }
                return null;
            });
            log.debug("Published: exchange={} routingKey='{}' expiration={}",
                    exchange.getName(), routingKey, message.getMessageProperties().getExpiration());
            return null;
        });
    }

    private <R> CompletableFuture<R> submit(Supplier<R> operation) {
        return CompletableFuture.supplyAsync(operation, brokerExecutor);
    }
}
