package com.intteq.message.scheduler.internal;

import com.intteq.message.scheduler.FuturePublishConfiguration;
import com.intteq.message.scheduler.exception.FuturePublishTimeoutException;
import com.intteq.message.scheduler.spi.AdvancedBus;
import com.intteq.message.scheduler.spi.ExchangeDeclareStrategy;
import com.intteq.message.scheduler.support.AuditRecorded;
import com.intteq.message.scheduler.support.OrderCreated;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeTypes;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.SimpleMessageConverter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DeadLetterExchangeAndMessageTtlSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final String ORDER_RELAY_QUEUE =
            OrderCreated.class.getName() + "_FuturePublishes_orders.created";

    @Mock
    private AdvancedBus advancedBus;

    @Mock
    private ExchangeDeclareStrategy exchangeDeclareStrategy;

    @Captor
    private ArgumentCaptor<Message> messageCaptor;

    @Captor
    private ArgumentCaptor<UnaryOperator<QueueBuilder>> queueConfigCaptor;

    private ScheduledExecutorService timeoutScheduler;
    private SimpleMeterRegistry meterRegistry;
    private DeadLetterExchangeAndMessageTtlScheduler scheduler;

    @BeforeEach
    void setUp() {
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        meterRegistry = new SimpleMeterRegistry();
        scheduler = newScheduler(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        timeoutScheduler.shutdownNow();
    }

    private DeadLetterExchangeAndMessageTtlScheduler newScheduler(Duration timeout) {
        return new DeadLetterExchangeAndMessageTtlScheduler(
                timeout,
                advancedBus,
                new DefaultConventions(),
                new DefaultMessageDeliveryModeStrategy(true),
                exchangeDeclareStrategy,
                new SimpleMessageConverter(),
                timeoutScheduler,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenBrokerAcceptsEverything() {
        lenient().when(exchangeDeclareStrategy.declareExchangeAsync(anyString(), anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(new TopicExchange(inv.getArgument(0))));
        lenient().when(advancedBus.queueDeclareAsync(anyString(), any()))
                .thenAnswer(inv -> {
                    UnaryOperator<QueueBuilder> configure = inv.getArgument(1);
                    Queue queue = configure.apply(QueueBuilder.durable(inv.<String>getArgument(0))).build();
                    return CompletableFuture.completedFuture(queue);
                });
        lenient().when(advancedBus.bindAsync(any(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        lenient().when(advancedBus.publishAsync(any(), anyString(), anyBoolean(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    private Message publishedMessage() {
        verify(advancedBus).publishAsync(any(), anyString(), eq(false), messageCaptor.capture());
        return messageCaptor.getValue();
    }

    private double counter(String result) {
        return meterRegistry.get("scheduler.future_publish").tag("result", result).counter().count();
    }

    @Nested
    @DisplayName("topology and publish")
    class Provisioning {

        @Test
        @DisplayName("declares destination, future exchange, relay queue and binding before publishing")
        void futurePublish_declaresTopologyInOrder() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(30)).get(5, TimeUnit.SECONDS);

            // then
            InOrder order = inOrder(exchangeDeclareStrategy, advancedBus);
            order.verify(exchangeDeclareStrategy).declareExchangeAsync("orders.exchange", ExchangeTypes.TOPIC);
            order.verify(exchangeDeclareStrategy).declareExchangeAsync("orders.exchange_FuturePublishes", ExchangeTypes.TOPIC);
            order.verify(advancedBus).queueDeclareAsync(eq(ORDER_RELAY_QUEUE), any());
            order.verify(advancedBus).bindAsync(any(Exchange.class), any(Queue.class), eq("orders.created"));
            order.verify(advancedBus).publishAsync(any(Exchange.class), eq("orders.created"), eq(false), any(Message.class));

            assertThat(counter("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("relay queue dead-letters into the destination exchange with the original topic")
        void futurePublish_relayQueueDeadLettersToDestination() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(30)).get(5, TimeUnit.SECONDS);

            // then
            verify(advancedBus).queueDeclareAsync(eq(ORDER_RELAY_QUEUE), queueConfigCaptor.capture());
            Queue relayQueue = queueConfigCaptor.getValue().apply(QueueBuilder.durable(ORDER_RELAY_QUEUE)).build();
            assertThat(relayQueue.getArguments())
                    .containsEntry("x-dead-letter-exchange", "orders.exchange")
                    .containsEntry("x-dead-letter-routing-key", "orders.created");
        }

        @Test
        @DisplayName("binds and publishes on the future exchange, not the destination")
        void futurePublish_publishesToFutureExchange() throws Exception {
            // given
            givenBrokerAcceptsEverything();
            ArgumentCaptor<Exchange> bound = ArgumentCaptor.forClass(Exchange.class);
            ArgumentCaptor<Exchange> published = ArgumentCaptor.forClass(Exchange.class);

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            // then
            verify(advancedBus).bindAsync(bound.capture(), any(), eq("orders.created"));
            verify(advancedBus).publishAsync(published.capture(), eq("orders.created"), eq(false), any());
            assertThat(bound.getValue().getName()).isEqualTo("orders.exchange_FuturePublishes");
            assertThat(published.getValue().getName()).isEqualTo("orders.exchange_FuturePublishes");
        }

        @Test
        @DisplayName("explicit topic overrides the type's default topic")
        void futurePublish_explicitTopic() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1), "orders.cancelled")
                    .get(5, TimeUnit.SECONDS);

            // then
            verify(advancedBus).queueDeclareAsync(
                    eq(OrderCreated.class.getName() + "_FuturePublishes_orders.cancelled"), any());
            verify(advancedBus).publishAsync(any(), eq("orders.cancelled"), eq(false), any());
        }

        @Test
        @DisplayName("empty topic falls back to the bare FuturePublishes queue suffix")
        void futurePublish_emptyTopicQueueName() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new AuditRecorded("login"), Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            // then
            verify(advancedBus).queueDeclareAsync(eq(AuditRecorded.class.getName() + "_FuturePublishes"), any());
            verify(advancedBus).bindAsync(any(), any(), eq(""));
        }

        @Test
        @DisplayName("explicit empty topic wins over an annotated default")
        void futurePublish_explicitEmptyTopic() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1), "").get(5, TimeUnit.SECONDS);

            // then
            verify(advancedBus).queueDeclareAsync(eq(OrderCreated.class.getName() + "_FuturePublishes"), any());
            verify(advancedBus).publishAsync(any(), eq(""), eq(false), any());
        }
    }

    @Nested
    @DisplayName("message properties")
    class Properties {

        @Test
        @DisplayName("expiration is the delay in whole milliseconds")
        void futurePublish_expirationInMillis() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofMillis(1500)).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getExpiration()).isEqualTo("1500");
        }

        @Test
        @DisplayName("priority from the configuration is passed through")
        void futurePublish_priorityPassThrough() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1),
                    FuturePublishConfiguration.defaults().withPriority(7)).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getPriority()).isEqualTo(7);
        }

        @Test
        @DisplayName("priority zero is kept and distinct from an unset priority")
        void futurePublish_priorityZero() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1),
                    FuturePublishConfiguration.defaults().withPriority(0)).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getPriority()).isZero();
        }

        @Test
        @DisplayName("no priority is set when the configuration has none")
        void futurePublish_noPriority() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getPriority()).isNull();
        }

        @Test
        @DisplayName("delivery mode comes from the delivery mode strategy")
        void futurePublish_deliveryMode() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new AuditRecorded("login"), Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getDeliveryMode())
                    .isEqualTo(MessageDeliveryMode.NON_PERSISTENT);
        }

        @Test
        @DisplayName("delivery instant is converted to a delay against the clock")
        void futurePublish_deliverAt() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), NOW.plusSeconds(2),
                    FuturePublishConfiguration.defaults()).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getExpiration()).isEqualTo("2000");
        }

        @Test
        @DisplayName("delivery instant in the past becomes a zero delay")
        void futurePublish_deliverAtInThePast() throws Exception {
            // given
            givenBrokerAcceptsEverything();

            // when
            scheduler.futurePublishAsync(new OrderCreated("42"), NOW.minusSeconds(10),
                    FuturePublishConfiguration.defaults()).get(5, TimeUnit.SECONDS);

            // then
            assertThat(publishedMessage().getMessageProperties().getExpiration()).isEqualTo("0");
        }
    }

    @Nested
    @DisplayName("invalid arguments")
    class InvalidArguments {

        @Test
        @DisplayName("null message is rejected before any broker call")
        void futurePublish_nullMessage() {
            assertThatThrownBy(() -> scheduler.futurePublishAsync(null, Duration.ofSeconds(1)))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("message");

            verifyNoInteractions(advancedBus, exchangeDeclareStrategy);
        }

        @Test
        @DisplayName("null configuration is rejected before any broker call")
        void futurePublish_nullConfiguration() {
            assertThatThrownBy(() -> scheduler.futurePublishAsync(
                    new OrderCreated("42"), Duration.ofSeconds(1), (FuturePublishConfiguration) null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("configuration");

            verifyNoInteractions(advancedBus, exchangeDeclareStrategy);
        }

        @Test
        @DisplayName("negative delay is rejected before any broker call")
        void futurePublish_negativeDelay() {
            assertThatThrownBy(() -> scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofMillis(-1)))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(advancedBus, exchangeDeclareStrategy);
        }
    }

    @Nested
    @DisplayName("broker failures")
    class BrokerFailures {

        @Test
        @DisplayName("exchange declaration failure is surfaced unchanged and stops the sequence")
        void futurePublish_exchangeDeclareFails() {
            // given
            AmqpException error = new AmqpException("PRECONDITION_FAILED - inequivalent arg 'type'");
            given(exchangeDeclareStrategy.declareExchangeAsync("orders.exchange", ExchangeTypes.TOPIC))
                    .willReturn(CompletableFuture.failedFuture(error));

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause().isSameAs(error);
            verifyNoInteractions(advancedBus);
            assertThat(counter("failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("binding failure is surfaced unchanged and nothing is published")
        void futurePublish_bindFails() {
            // given
            givenBrokerAcceptsEverything();
            AmqpException error = new AmqpException("NOT_FOUND - no queue");
            given(advancedBus.bindAsync(any(), any(), anyString())).willReturn(CompletableFuture.failedFuture(error));

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause().isSameAs(error);
            verify(advancedBus, never()).publishAsync(any(), anyString(), anyBoolean(), any());
        }

        @Test
        @DisplayName("publish failure is surfaced unchanged")
        void futurePublish_publishFails() {
            // given
            givenBrokerAcceptsEverything();
            AmqpException error = new AmqpException("channel closed");
            given(advancedBus.publishAsync(any(), anyString(), anyBoolean(), any()))
                    .willReturn(CompletableFuture.failedFuture(error));

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause().isSameAs(error);
            assertThat(counter("failure")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a collaborator throwing instead of failing its future still fails the call")
        void futurePublish_collaboratorThrows() {
            // given
            givenBrokerAcceptsEverything();
            AmqpException error = new AmqpException("connection refused");
            given(advancedBus.queueDeclareAsync(anyString(), any())).willThrow(error);

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause().isSameAs(error);
        }

        @Test
        @DisplayName("blocking variant rethrows the broker error itself")
        void futurePublish_blockingRethrows() {
            // given
            givenBrokerAcceptsEverything();
            AmqpException error = new AmqpException("channel closed");
            given(advancedBus.publishAsync(any(), anyString(), anyBoolean(), any()))
                    .willReturn(CompletableFuture.failedFuture(error));

            // when / then
            assertThatThrownBy(() -> scheduler.futurePublish(new OrderCreated("42"), Duration.ofSeconds(1)))
                    .isSameAs(error);
        }
    }

    @Nested
    @DisplayName("timeout and cancellation")
    class TimeoutAndCancellation {

        @Test
        @DisplayName("hanging exchange declaration fails with a timeout within the budget")
        void futurePublish_timesOut() {
            // given
            scheduler = newScheduler(Duration.ofMillis(200));
            CompletableFuture<Exchange> hanging = new CompletableFuture<>();
            given(exchangeDeclareStrategy.declareExchangeAsync(anyString(), anyString())).willReturn(hanging);

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(FuturePublishTimeoutException.class)
                    .hasMessageContaining("DECLARING_DESTINATION");
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
                assertThat(hanging).isCancelled();
                assertThat(counter("timeout")).isEqualTo(1.0);
            });
            verifyNoInteractions(advancedBus);
        }

        @Test
        @DisplayName("timeout during publish reports the publishing stage")
        void futurePublish_timesOutWhilePublishing() {
            // given
            scheduler = newScheduler(Duration.ofMillis(200));
            givenBrokerAcceptsEverything();
            CompletableFuture<Void> hanging = new CompletableFuture<>();
            given(advancedBus.publishAsync(any(), anyString(), anyBoolean(), any())).willReturn(hanging);

            // when
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // then
            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOfSatisfying(FuturePublishTimeoutException.class,
                            timeout -> assertThat(timeout.getStage()).isEqualTo("PUBLISHING"));
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(hanging).isCancelled());
        }

        @Test
        @DisplayName("caller cancellation aborts the pending step and skips the rest")
        void futurePublish_cancelled() {
            // given
            givenBrokerAcceptsEverything();
            CompletableFuture<Void> hanging = new CompletableFuture<>();
            given(advancedBus.bindAsync(any(), any(), anyString())).willReturn(hanging);
            CompletableFuture<Void> result = scheduler.futurePublishAsync(new OrderCreated("42"), Duration.ofSeconds(1));

            // when
            result.cancel(true);

            // then
            assertThat(result).isCancelled();
            assertThat(hanging).isCancelled();
            assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
            verify(advancedBus, never()).publishAsync(any(), anyString(), anyBoolean(), any());
            assertThat(counter("cancelled")).isEqualTo(1.0);
        }
    }
}
