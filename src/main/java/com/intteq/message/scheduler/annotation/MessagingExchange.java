package com.intteq.message.scheduler.annotation;

import java.lang.annotation.*;

/**
 * Overrides the exchange a message type is published to.
 *
 * <p>Without this annotation the default conventions use the fully-qualified class name
 * of the message type. Scheduled messages are dead-lettered into this exchange once their
 * delay has elapsed, so immediate publishers of the same type must use the same name.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @MessagingExchange("orders.exchange")
 * public record OrderCreated(String orderId) {
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface MessagingExchange {

    /**
     * Physical exchange name (e.g. "orders.exchange"). Must not be blank.
     */
    String value();
}
