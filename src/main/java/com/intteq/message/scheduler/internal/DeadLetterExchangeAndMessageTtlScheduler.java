package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.FuturePublishConfiguration;
import com.intteq.message.scheduler.MessageScheduler;
import com.intteq.message.scheduler.exception.FuturePublishTimeoutException;
import com.intteq.message.scheduler.spi.AdvancedBus;
import com.intteq.message.scheduler.spi.Conventions;
import com.intteq.message.scheduler.spi.ExchangeDeclareStrategy;
import com.intteq.message.scheduler.spi.MessageDeliveryModeStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Scheduler built on dead-letter exchanges and per-message TTL.
 *
 * <p>A scheduled message is published to {@code <exchange>_FuturePublishes} and routed to a
 * relay queue nobody consumes. The message carries its delay as {@code expiration}; when it
 * expires the broker dead-letters it into the real exchange with the original topic as routing
 * key. No timer runs in this process once the publish has been accepted.
 *
 * <p>Per call, strictly in order: declare destination exchange, declare future exchange,
 * declare relay queue, bind, publish. Each step waits for the previous one, the whole sequence
 * shares one timeout, and a failure at any step ends the call with that step's error.
 * Distinct calls run concurrently without any local locking.
 *
 * <p>The relay publish is not mandatory: if the binding is missing the broker drops the message
 * silently, which this class cannot observe.
 */
@Slf4j
public class DeadLetterExchangeAndMessageTtlScheduler implements MessageScheduler {

    static final String METRIC_NAME = "scheduler.future_publish";

    private final Duration timeout;
    private final AdvancedBus advancedBus;
    private final Conventions conventions;
    private final MessageConverter messageConverter;
    private final ScheduledExecutorService timeoutScheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final FutureTopologyProvisioner topologyProvisioner;
    private final FutureMessagePropertiesFactory propertiesFactory;

    public DeadLetterExchangeAndMessageTtlScheduler(Duration timeout,
                                                     AdvancedBus advancedBus,
                                                     Conventions conventions,
                                                     MessageDeliveryModeStrategy messageDeliveryModeStrategy,
                                                     ExchangeDeclareStrategy exchangeDeclareStrategy,
                                                     MessageConverter messageConverter,
                                                     ScheduledExecutorService timeoutScheduler,
                                                     MeterRegistry meterRegistry,
                                                     Clock clock) {
        Assert.notNull(timeout, "timeout must not be null");
        Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        Assert.notNull(advancedBus, "advancedBus must not be null");
        Assert.notNull(conventions, "conventions must not be null");
        Assert.notNull(messageDeliveryModeStrategy, "messageDeliveryModeStrategy must not be null");
        Assert.notNull(exchangeDeclareStrategy, "exchangeDeclareStrategy must not be null");
        Assert.notNull(messageConverter, "messageConverter must not be null");
        Assert.notNull(timeoutScheduler, "timeoutScheduler must not be null");
        Assert.notNull(meterRegistry, "meterRegistry must not be null");
        Assert.notNull(clock, "clock must not be null");

        this.timeout = timeout;
        this.advancedBus = advancedBus;
        this.conventions = conventions;
        this.messageConverter = messageConverter;
        this.timeoutScheduler = timeoutScheduler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.topologyProvisioner = new FutureTopologyProvisioner(conventions, exchangeDeclareStrategy, advancedBus);
        this.propertiesFactory = new FutureMessagePropertiesFactory(messageDeliveryModeStrategy);
    }

    @Override
    public <T> CompletableFuture<Void> futurePublishAsync(T message,
                                                          Class<T> messageType,
                                                          Duration delay,
                                                          FuturePublishConfiguration configuration) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(messageType, "messageType must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }

        String topic = resolveTopic(messageType, configuration);
        FuturePublishAttempt attempt = new FuturePublishAttempt(
                messageType.getName() + "[topic='" + topic + "', delay=" + delay.toMillis() + "ms]",
                timeout, timeoutScheduler);

        CompletableFuture<Void> sequence = topologyProvisioner.provision(messageType, topic, attempt)
                .thenCompose(topology -> {
                    Message relayMessage = toMessage(message, messageType, delay, configuration);
                    return attempt.step(FuturePublishStage.PUBLISHING,
                            () -> advancedBus.publishAsync(topology.futureExchange(), topic, false, relayMessage));
                });

        CompletableFuture<Void> result = attempt.complete(sequence);
        result.whenComplete((ignored, error) -> recordOutcome(messageType, topic, delay, error));
        return result;
    }

    @Override
    public <T> CompletableFuture<Void> futurePublishAsync(T message,
                                                          Instant deliverAt,
                                                          FuturePublishConfiguration configuration) {
        Objects.requireNonNull(deliverAt, "deliverAt must not be null");
        Duration delay = Duration.between(clock.instant(), deliverAt);
        return futurePublishAsync(message, delay.isNegative() ? Duration.ZERO : delay, configuration);
    }

    private String resolveTopic(Class<?> messageType, FuturePublishConfiguration configuration) {
        if (configuration.topic() != null) {
            return configuration.topic();
        }
        String defaultTopic = conventions.topicName(messageType);
        return defaultTopic != null ? defaultTopic : "";
    }

    private Message toMessage(Object payload, Class<?> messageType, Duration delay,
                              FuturePublishConfiguration configuration) {
        MessageProperties properties = propertiesFactory.create(messageType, delay, configuration);
        return messageConverter.toMessage(payload, properties);
    }

    private void recordOutcome(Class<?> messageType, String topic, Duration delay, Throwable error) {
        String outcome;
        if (error == null) {
            outcome = "success";
            log.debug("Scheduled {} on topic='{}' with delay={}ms", messageType.getName(), topic, delay.toMillis());
        } else if (error instanceof FuturePublishTimeoutException) {
            outcome = "timeout";
        } else if (error instanceof CancellationException) {
            outcome = "cancelled";
            log.warn("Scheduling of {} on topic='{}' was cancelled", messageType.getName(), topic);
        } else {
            outcome = "failure";
            log.error("Failed to schedule {} on topic='{}'", messageType.getName(), topic, error);
        }
        meterRegistry.counter(METRIC_NAME, "type", messageType.getSimpleName(), "result", outcome).increment();
    }
}
