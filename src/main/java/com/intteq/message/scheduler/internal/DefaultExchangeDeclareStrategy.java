package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.spi.AdvancedBus;
import com.intteq.message.scheduler.spi.ExchangeDeclareStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.Exchange;

import java.util.concurrent.CompletableFuture;

/**
 * Declares exchanges directly on the bus.
 */
@RequiredArgsConstructor
public class DefaultExchangeDeclareStrategy implements ExchangeDeclareStrategy {

    private final AdvancedBus advancedBus;

    @Override
    public CompletableFuture<Exchange> declareExchangeAsync(String name, String type) {
        return advancedBus.exchangeDeclareAsync(name, type);
    }
}
