package com.intteq.message.scheduler.spi;

/**
 * Naming conventions that map a message type to broker object names.
 *
 * <p>Scheduled and immediate publishing of the same type must share these conventions,
 * otherwise delayed messages are dead-lettered to a different exchange than the one
 * consumers listen on.
 */
public interface Conventions {

    /**
     * Name of the topic exchange that consumers of {@code messageType} bind to.
     */
    String exchangeName(Class<?> messageType);

    /**
     * Name of a queue for {@code messageType}, qualified with {@code suffix}.
     */
    String queueName(Class<?> messageType, String suffix);

    /**
     * Topic used when the caller does not provide one. May be empty.
     */
    String topicName(Class<?> messageType);
}
