package com.intteq.message.scheduler.spi;

import org.springframework.amqp.core.MessageDeliveryMode;

/**
 * Resolves whether messages of a type are published persistent or transient.
 */
@FunctionalInterface
public interface MessageDeliveryModeStrategy {

    MessageDeliveryMode deliveryModeFor(Class<?> messageType);
}
