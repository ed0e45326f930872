package com.intteq.message.scheduler;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the message scheduler.
 *
 * <p>Prefix: {@code messaging.scheduler.*}
 *
 * <p>Examples:
 * <pre>
 * messaging.scheduler.enabled=true
 * messaging.scheduler.timeout=10s
 * messaging.scheduler.persistent-messages=true
 * messaging.scheduler.publisher-confirms=true
 * messaging.scheduler.broker-io-threads=4
 * </pre>
 *
 * <p>Connection settings are not configured here; they come from the standard
 * {@code spring.rabbitmq.*} properties.
 *
 * <p>These properties are validated at startup. Invalid configurations will cause
 * the application to fail fast.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "messaging.scheduler")
public class SchedulerProperties {

    /** Whether the scheduler auto-configuration is active. */
    private boolean enabled = true;

    /**
     * Budget for one whole scheduling call: every declaration, the binding and the
     * relay publish must complete within it.
     */
    @NotNull(message = "messaging.scheduler.timeout must not be null")
    @DurationMin(millis = 1, message = "messaging.scheduler.timeout must be positive")
    private Duration timeout = Duration.ofSeconds(10);

    /** Default delivery mode for types without {@code @DeliveryMode}. */
    private boolean persistentMessages = true;

    /** Put channels in confirm mode and wait for the broker ack on every relay publish. */
    private boolean publisherConfirms = true;

    /** Worker threads that run blocking broker calls off the caller thread. */
    @Min(value = 1, message = "messaging.scheduler.broker-io-threads must be at least 1")
    private int brokerIoThreads = 4;
}
