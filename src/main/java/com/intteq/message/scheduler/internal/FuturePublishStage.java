package com.intteq.message.scheduler.internal;

/**
 * Stages of a single scheduling call, in execution order. A call never moves backwards
 * and no stage is retried; any failure ends the call in {@link #FAILED}.
 */
public enum FuturePublishStage {
    CONFIGURING,
    DECLARING_DESTINATION,
    DECLARING_FUTURE_EXCHANGE,
    DECLARING_RELAY_QUEUE,
    BINDING,
    PUBLISHING,
    DONE,
    FAILED
}
