package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.annotation.DeliveryMode;
import com.intteq.message.scheduler.spi.MessageDeliveryModeStrategy;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.core.annotation.AnnotationUtils;

/**
 * Uses {@link DeliveryMode} on the message type when present, the configured default otherwise.
 */
public class DefaultMessageDeliveryModeStrategy implements MessageDeliveryModeStrategy {

    private final boolean persistentByDefault;

    public DefaultMessageDeliveryModeStrategy(boolean persistentByDefault) {
        this.persistentByDefault = persistentByDefault;
    }

    @Override
    public MessageDeliveryMode deliveryModeFor(Class<?> messageType) {
        DeliveryMode annotation = AnnotationUtils.findAnnotation(messageType, DeliveryMode.class);
        boolean persistent = annotation != null ? annotation.persistent() : persistentByDefault;
        return persistent ? MessageDeliveryMode.PERSISTENT : MessageDeliveryMode.NON_PERSISTENT;
    }
}
