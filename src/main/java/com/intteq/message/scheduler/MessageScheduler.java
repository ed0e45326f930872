package com.intteq.message.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Schedules messages for delivery after a delay.
 *
 * <p>The returned future completes once the broker has accepted the message for later
 * delivery; from then on the broker alone is responsible for delivering it. Failures are
 * reported through the future:
 * <ul>
 *     <li>broker errors are passed through unchanged</li>
 *     <li>{@link com.intteq.message.scheduler.exception.FuturePublishTimeoutException} when the
 *     configured timeout elapses</li>
 *     <li>{@link CancellationException} when the caller cancels the returned future</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * {@code
 * scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofMinutes(5),
 *         FuturePublishConfiguration.forTopic("orders.created").withPriority(3));
 * }
 * </pre>
 *
 * <p>A timeout or cancellation ends the call at once, but a broker call already running on a
 * worker thread is not interrupted. A relay publish in progress may therefore still reach the
 * broker after the caller has seen the failure, and retrying can schedule the message twice.
 *
 * <p>Invalid arguments are rejected synchronously, before any broker interaction.
 */
public interface MessageScheduler {

    /**
     * Schedule {@code message} for delivery to the exchange of {@code messageType} after {@code delay}.
     *
     * @param message       payload, must not be null
     * @param messageType   type driving exchange, queue and topic naming
     * @param delay         non-negative delay
     * @param configuration topic and priority options
     * @return a future completing once the broker has accepted the message
     */
    <T> CompletableFuture<Void> futurePublishAsync(T message,
                                                   Class<T> messageType,
                                                   Duration delay,
                                                   FuturePublishConfiguration configuration);

    @SuppressWarnings("unchecked")
    default <T> CompletableFuture<Void> futurePublishAsync(T message,
                                                           Duration delay,
                                                           FuturePublishConfiguration configuration) {
        Objects.requireNonNull(message, "message must not be null");
        return futurePublishAsync(message, (Class<T>) message.getClass(), delay, configuration);
    }

    default <T> CompletableFuture<Void> futurePublishAsync(T message, Duration delay) {
        return futurePublishAsync(message, delay, FuturePublishConfiguration.defaults());
    }

    default <T> CompletableFuture<Void> futurePublishAsync(T message, Duration delay, String topic) {
        return futurePublishAsync(message, delay, FuturePublishConfiguration.forTopic(topic));
    }

    /**
     * Schedule {@code message} for delivery at {@code deliverAt}. An instant in the past
     * results in a zero delay.
     */
    <T> CompletableFuture<Void> futurePublishAsync(T message,
                                                   Instant deliverAt,
                                                   FuturePublishConfiguration configuration);

    /**
     * Blocking variant of {@link #futurePublishAsync(Object, Duration, FuturePublishConfiguration)}.
     * Rethrows the original failure rather than an {@link ExecutionException}.
     */
    default <T> void futurePublish(T message, Duration delay, FuturePublishConfiguration configuration) {
        await(futurePublishAsync(message, delay, configuration));
    }

    default <T> void futurePublish(T message, Duration delay) {
        futurePublish(message, delay, FuturePublishConfiguration.defaults());
    }

    private static void await(CompletableFuture<Void> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            CancellationException cancelled = new CancellationException("Interrupted while waiting for scheduling");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }
}
