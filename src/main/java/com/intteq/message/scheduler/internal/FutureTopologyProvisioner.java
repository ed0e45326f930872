package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.spi.AdvancedBus;
import com.intteq.message.scheduler.spi.Conventions;
import com.intteq.message.scheduler.spi.ExchangeDeclareStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeTypes;
import org.springframework.amqp.core.Queue;

import java.util.concurrent.CompletableFuture;

/**
 * Ensures the topology needed to delay messages of one type on one topic:
 * <ul>
 *     <li>the destination topic exchange, named by the conventions</li>
 *     <li>a future topic exchange, {@code <destination>_FuturePublishes}</li>
 *     <li>a relay queue that dead-letters into the destination exchange with the original topic</li>
 *     <li>a binding from the future exchange to the relay queue on the exact topic</li>
 * </ul>
 *
 * <p>Every call declares everything again and relies on the broker treating identical
 * declarations as no-ops. Nothing is cached locally, so concurrent first use of a pair and
 * broker restarts need no coordination here.
 */
@Slf4j
@RequiredArgsConstructor
public class FutureTopologyProvisioner {

    public static final String FUTURE_PUBLISHES = "FuturePublishes";

    private final Conventions conventions;
    private final ExchangeDeclareStrategy exchangeDeclareStrategy;
    private final AdvancedBus advancedBus;

    CompletableFuture<FutureTopology> provision(Class<?> messageType, String topic, FuturePublishAttempt attempt) {
        String exchangeName = conventions.exchangeName(messageType);
        String futureExchangeName = futureExchangeName(exchangeName);
        String relayQueueName = conventions.queueName(messageType, relayQueueSuffix(topic));

        return attempt.step(FuturePublishStage.DECLARING_DESTINATION,
                        () -> exchangeDeclareStrategy.declareExchangeAsync(exchangeName, ExchangeTypes.TOPIC))
                .thenCompose(destination -> attempt.step(FuturePublishStage.DECLARING_FUTURE_EXCHANGE,
                                () -> exchangeDeclareStrategy.declareExchangeAsync(futureExchangeName, ExchangeTypes.TOPIC))
                        .thenCompose(futureExchange -> declareRelayQueue(relayQueueName, destination, topic, attempt)
                                .thenCompose(relayQueue -> bind(futureExchange, relayQueue, topic, attempt)
                                        .thenApply(bound -> new FutureTopology(destination, futureExchange, relayQueue, topic)))));
    }

    private CompletableFuture<Queue> declareRelayQueue(String name, Exchange destination, String topic,
                                                       FuturePublishAttempt attempt) {
        return attempt.step(FuturePublishStage.DECLARING_RELAY_QUEUE, () -> {
            log.debug("Declaring relay queue={} dlx={} dlrk='{}'", name, destination.getName(), topic);
            return advancedBus.queueDeclareAsync(name, queue -> queue
                    .deadLetterExchange(destination.getName())
                    .deadLetterRoutingKey(topic));
        });
    }

    private CompletableFuture<Void> bind(Exchange futureExchange, Queue relayQueue, String topic,
                                        FuturePublishAttempt attempt) {
        return attempt.step(FuturePublishStage.BINDING, () -> {
            log.debug("Binding relay queue={} exchange={} routingKey='{}'",
                    relayQueue.getName(), futureExchange.getName(), topic);
            return advancedBus.bindAsync(futureExchange, relayQueue, topic);
        });
    }

    public static String futureExchangeName(String exchangeName) {
        return exchangeName + "_" + FUTURE_PUBLISHES;
    }

    /**
     * {@code FuturePublishes} for an empty topic, {@code FuturePublishes_<topic>} otherwise.
     */
    public static String relayQueueSuffix(String topic) {
        return topic == null || topic.isEmpty() ? FUTURE_PUBLISHES : FUTURE_PUBLISHES + "_" + topic;
    }
}
