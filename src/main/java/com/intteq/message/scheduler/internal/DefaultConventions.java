package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.annotation.MessagingExchange;
import com.intteq.message.scheduler.annotation.MessagingTopic;
import com.intteq.message.scheduler.spi.Conventions;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Default naming:
 * <ul>
 *     <li>exchange: {@link MessagingExchange} value, else the fully-qualified class name</li>
 *     <li>queue: {@code <fully-qualified class name>_<suffix>}, or the class name alone for an empty
 *     suffix; {@link MessagingExchange} does not affect it</li>
 *     <li>topic: {@link MessagingTopic} value, else empty</li>
 * </ul>
 */
public class DefaultConventions implements Conventions {

    @Override
    public String exchangeName(Class<?> messageType) {
        Assert.notNull(messageType, "messageType must not be null");
        MessagingExchange exchange = AnnotationUtils.findAnnotation(messageType, MessagingExchange.class);
        if (exchange != null) {
            Assert.hasText(exchange.value(), "@MessagingExchange on " + messageType.getName() + " must not be blank");
            return exchange.value();
        }
        return messageType.getName();
    }

    @Override
    public String queueName(Class<?> messageType, String suffix) {
        Assert.notNull(messageType, "messageType must not be null");
        return StringUtils.hasLength(suffix) ? messageType.getName() + "_" + suffix : messageType.getName();
    }

    @Override
    public String topicName(Class<?> messageType) {
        Assert.notNull(messageType, "messageType must not be null");
        MessagingTopic topic = AnnotationUtils.findAnnotation(messageType, MessagingTopic.class);
        return topic != null ? topic.value() : "";
    }
}
