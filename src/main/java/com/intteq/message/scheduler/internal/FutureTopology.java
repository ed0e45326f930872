package com.intteq.message.scheduler.internal;

import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

/**
 * Broker objects backing scheduled publishes of one (message type, topic) pair.
 *
 * @param destination    exchange consumers bind to; dead-letter target of the relay queue
 * @param futureExchange exchange scheduled messages are published to
 * @param relayQueue     queue holding messages until their TTL expires
 * @param topic          binding key on the future exchange and dead-letter routing key
 */
public record FutureTopology(Exchange destination, Exchange futureExchange, Queue relayQueue, String topic) {
}
