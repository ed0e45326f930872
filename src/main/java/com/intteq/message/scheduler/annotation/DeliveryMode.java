package com.intteq.message.scheduler.annotation;

import java.lang.annotation.*;

/**
 * Pins the delivery mode of a message type, overriding
 * {@code messaging.scheduler.persistent-messages}.
 *
 * <pre>
 * {@code
 * @DeliveryMode(persistent = false)
 * public record CacheInvalidated(String key) {
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface DeliveryMode {

    /**
     * {@code true} for persistent messages, {@code false} for transient ones.
     */
    boolean persistent() default true;
}
