package com.intteq.message.scheduler.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown when a scheduling call does not finish within
 * {@code messaging.scheduler.timeout}.
 *
 * <p>Broker objects declared before the timeout are left in place; the message itself
 * has not been accepted and the whole call may be repeated.
 */
@Getter
public class FuturePublishTimeoutException extends RuntimeException {

    /** Name of the stage that was still pending when the budget ran out. */
    private final String stage;

    private final Duration timeout;

    public FuturePublishTimeoutException(String stage, Duration timeout) {
        super("Scheduling did not complete within " + timeout.toMillis() + "ms (pending stage: " + stage + ")");
        this.stage = stage;
        this.timeout = timeout;
    }
}
