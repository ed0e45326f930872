package com.intteq.message.scheduler;

/**
 * Per-call options for a scheduled publish.
 *
 * @param topic    routing key of the message, or {@code null} for the default topic of the
 *                 message type. An empty string is a legal, explicit topic.
 * @param priority AMQP priority (0..255), or {@code null} to leave the property unset.
 */
public record FuturePublishConfiguration(String topic, Integer priority) {

    private static final FuturePublishConfiguration DEFAULTS = new FuturePublishConfiguration(null, null);

    public FuturePublishConfiguration {
        if (priority != null && (priority < 0 || priority > 255)) {
            throw new IllegalArgumentException("priority must be between 0 and 255, was " + priority);
        }
    }

    public static FuturePublishConfiguration defaults() {
        return DEFAULTS;
    }

    public static FuturePublishConfiguration forTopic(String topic) {
        return new FuturePublishConfiguration(topic, null);
    }

    public FuturePublishConfiguration withTopic(String topic) {
        return new FuturePublishConfiguration(topic, priority);
    }

    public FuturePublishConfiguration withPriority(int priority) {
        return new FuturePublishConfiguration(topic, priority);
    }

    public boolean hasPriority() {
        return priority != null;
    }
}
