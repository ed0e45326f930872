package com.intteq.message.scheduler.spi;

import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Low-level asynchronous broker operations used by the scheduler.
 *
 * <p>Every operation returns a {@link CompletableFuture} that completes once the broker has
 * answered. A failed operation completes exceptionally with the broker error, untouched.
 * Cancelling a returned future aborts the pending operation as far as the implementation allows.
 *
 * <p>Declarations must be idempotent: declaring an object that already exists with identical
 * parameters succeeds, declaring it with conflicting parameters fails.
 */
public interface AdvancedBus {

    /**
     * Declare an exchange.
     *
     * @param name exchange name
     * @param type exchange type, see {@link org.springframework.amqp.core.ExchangeTypes}
     * @return the declared exchange
     */
    CompletableFuture<Exchange> exchangeDeclareAsync(String name, String type);

    /**
     * Declare a queue. The queue is durable; {@code configure} adds arguments such as
     * {@code x-dead-letter-exchange} and {@code x-dead-letter-routing-key}.
     *
     * @param name      queue name
     * @param configure customisation applied to the builder before the queue is built
     * @return the declared queue
     */
    CompletableFuture<Queue> queueDeclareAsync(String name, UnaryOperator<QueueBuilder> configure);

    /**
     * Bind a queue to an exchange on an exact routing key.
     */
    CompletableFuture<Void> bindAsync(Exchange exchange, Queue queue, String routingKey);

    /**
     * Publish a message.
     *
     * @param exchange   target exchange
     * @param routingKey routing key
     * @param mandatory  whether the broker must return unroutable messages
     * @param message    message with body and properties already built
     */
    CompletableFuture<Void> publishAsync(Exchange exchange, String routingKey, boolean mandatory, Message message);
}
