package com.intteq.message.scheduler.spi;

import org.springframework.amqp.core.Exchange;

import java.util.concurrent.CompletableFuture;

/**
 * Declares exchanges on behalf of the scheduler. Must be idempotent for an identical
 * {@code (name, type)} pair.
 */
@FunctionalInterface
public interface ExchangeDeclareStrategy {

    CompletableFuture<Exchange> declareExchangeAsync(String name, String type);
}
