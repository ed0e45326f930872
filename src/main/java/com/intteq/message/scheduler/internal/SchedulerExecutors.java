package com.intteq.message.scheduler.internal;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Threads owned by the scheduler: a pool for blocking broker calls and a single timer
 * thread enforcing the per-call timeout.
 *
 * <p>Kept behind this holder rather than exposed as {@code Executor} beans, which would
 * displace the application's default task executor.
 */
@Slf4j
@Getter
public class SchedulerExecutors implements DisposableBean {

    private final ExecutorService brokerExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    public SchedulerExecutors(int brokerThreads) {
        CustomizableThreadFactory brokerThreadFactory = new CustomizableThreadFactory("scheduler-broker-");
        brokerThreadFactory.setDaemon(true);
        CustomizableThreadFactory timerThreadFactory = new CustomizableThreadFactory("scheduler-timeout-");
        timerThreadFactory.setDaemon(true);

        this.brokerExecutor = Executors.newFixedThreadPool(brokerThreads, brokerThreadFactory);
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(timerThreadFactory);
        log.info("Scheduler executors initialized: brokerThreads={}", brokerThreads);
    }

    @Override
    public void destroy() {
        log.info("Shutting down scheduler executors");
        brokerExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
    }
}
