package com.phillippitts.providerrouter.config;

import com.phillippitts.providerrouter.config.properties.ThreadPoolProperties;
import com.phillippitts.providerrouter.service.health.HealthMonitor;
import com.phillippitts.providerrouter.service.recovery.RecoverySweeper;
import com.phillippitts.providerrouter.testutil.MutableClock;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateSchedulerWithConfiguredNaming() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        ThreadPoolConfig config = new ThreadPoolConfig(properties);

        ThreadPoolTaskScheduler scheduler = config.recoveryTaskScheduler();
        try {
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("recovery-sweeper-");
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(scheduler.getScheduledThreadPoolExecutor().getRemoveOnCancelPolicy()).isTrue();
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void decoratorPropagatesSchedulingThreadContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("requestId", "req-2");
        Runnable decorated = ThreadPoolConfig.threadContextPropagatingDecorator()
                .decorate(() -> seen.set(ThreadContext.get("requestId")));
        ThreadContext.put("requestId", "caller");

        decorated.run();

        assertThat(seen.get()).isEqualTo("req-2");
        assertThat(ThreadContext.get("requestId")).isEqualTo("caller");
    }

    @Test
    void sweepOnSchedulerThreadSeesContextOfStartingThread() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).recoveryTaskScheduler();
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();
        HealthMonitor health = mock(HealthMonitor.class);
        when(health.sweepLongRecovery(any())).thenAnswer(inv -> {
            seen.compareAndSet(null, ThreadContext.get("requestId"));
            thread.compareAndSet(null, Thread.currentThread().getName());
            return 0;
        });
        RecoverySweeper sweeper = new RecoverySweeper(health, scheduler,
                MutableClock.startingAt("2025-01-01T00:00:00Z"), Duration.ofMillis(20),
                ThreadPoolConfig.threadContextPropagatingDecorator());
        ThreadContext.put("requestId", "boot-1");
        try {
            sweeper.start();

            await().atMost(Duration.ofSeconds(5)).until(() -> seen.get() != null);

            assertThat(seen.get()).isEqualTo("boot-1");
            assertThat(thread.get()).startsWith("recovery-sweeper-");
        } finally {
            sweeper.stop();
            scheduler.shutdown();
        }
    }
}
