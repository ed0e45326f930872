package com.intteq.message.scheduler.annotation;

import java.lang.annotation.*;

/**
 * Declares the default topic (routing key) of a message type.
 *
 * <p>The topic is used when a caller schedules a message without choosing one
 * explicitly. It becomes both the binding key of the relay queue and the routing key
 * the message carries when it is dead-lettered into the destination exchange.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @MessagingExchange("orders.exchange")
 * @MessagingTopic("orders.created")
 * public record OrderCreated(String orderId) {
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface MessagingTopic {

    /**
     * Default topic, e.g. {@code "orders.created"}.
     */
    String value();
}
