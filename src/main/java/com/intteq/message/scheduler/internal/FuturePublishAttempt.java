package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.exception.FuturePublishTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * State of one scheduling call.
 *
 * <p>Tracks the current {@link FuturePublishStage} and the broker operation in flight, and
 * owns the future handed back to the caller. When that future ends early, either because
 * the timeout fired or because the caller cancelled it, the in-flight operation is cancelled
 * and no further stage is started. Completed declarations are never rolled back.
 */
@Slf4j
final class FuturePublishAttempt {

    private final String description;
    private final Duration timeout;
    private final CompletableFuture<Void> result = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();

    private volatile FuturePublishStage stage = FuturePublishStage.CONFIGURING;

    FuturePublishAttempt(String description, Duration timeout, ScheduledExecutorService timeoutScheduler) {
        this.description = description;
        this.timeout = timeout;

        ScheduledFuture<?> timer = timeoutScheduler.schedule(
                this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);

        result.whenComplete((ignored, error) -> {
            timer.cancel(false);
            if (error != null) {
                cancelInFlight();
            }
        });
    }

    /**
     * Enter {@code next} and start its broker operation, unless the call has already ended.
     */
    <R> CompletableFuture<R> step(FuturePublishStage next, Supplier<CompletableFuture<R>> operation) {
        if (result.isDone()) {
            return CompletableFuture.failedFuture(
                    new CancellationException("Scheduling ended before stage " + next));
        }

        stage = next;
        log.debug("Future publish {} -> {}", description, next);

        CompletableFuture<R> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        inFlight.set(future);
        // timeout or cancellation may have landed while the operation was being started
        if (result.isDone()) {
            future.cancel(true);
        }
        return future;
    }

    /**
     * Wire the outcome of the stage sequence into the caller's future.
     */
    CompletableFuture<Void> complete(CompletableFuture<Void> sequence) {
        sequence.whenComplete((ignored, error) -> {
            if (error == null) {
                stage = FuturePublishStage.DONE;
                result.complete(null);
            } else {
                Throwable cause = unwrap(error);
                if (result.completeExceptionally(cause)) {
                    log.debug("Future publish {} failed in stage {}", description, stage);
                    stage = FuturePublishStage.FAILED;
                }
            }
        });
        return result;
    }

    private void expire() {
        FuturePublishStage pending = stage;
        if (result.completeExceptionally(new FuturePublishTimeoutException(pending.name(), timeout))) {
            log.warn("Future publish {} timed out after {}ms in stage {}", description, timeout.toMillis(), pending);
            stage = FuturePublishStage.FAILED;
        }
    }

    private void cancelInFlight() {
        CompletableFuture<?> pending = inFlight.get();
        if (pending != null && !pending.isDone()) {
            pending.cancel(true);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
