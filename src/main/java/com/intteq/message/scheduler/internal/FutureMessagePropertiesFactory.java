package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.FuturePublishConfiguration;
import com.intteq.message.scheduler.spi.MessageDeliveryModeStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.MessageProperties;

import java.time.Duration;

/**
 * Builds the properties that make the broker hold a message in the relay queue for the
 * requested delay.
 *
 * <p>The delay travels as the per-message {@code expiration} property: the total number of
 * milliseconds as a decimal string, which is the only representation RabbitMQ accepts.
 * Sub-millisecond remainders are dropped.
 */
@RequiredArgsConstructor
public class FutureMessagePropertiesFactory {

    private final MessageDeliveryModeStrategy deliveryModeStrategy;

    public MessageProperties create(Class<?> messageType, Duration delay, FuturePublishConfiguration configuration) {
        MessageProperties properties = new MessageProperties();
        // MessageProperties starts with priority 0; an unset priority must stay absent
        properties.setPriority(configuration.hasPriority() ? configuration.priority() : null);
        properties.setDeliveryMode(deliveryModeStrategy.deliveryModeFor(messageType));
        properties.setExpiration(expiration(delay));
        return properties;
    }

    public static String expiration(Duration delay) {
        return Long.toString(delay.toMillis());
    }
}
