package com.phillippitts.providerrouter.config;

import com.phillippitts.providerrouter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Configuration for the scheduler that drives background recovery sweeps.
 *
 * <p>Pool size and thread naming come from {@link ThreadPoolProperties}
 * ({@code threadpool.sweeper.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler for the recovery sweeper.
     *
     * <p>Shutdown waits for an in-flight sweep to finish (bounded by
     * {@code threadpool.sweeper.await-termination-seconds}); queued ticks are discarded.
     *
     * @return initialized scheduler
     */
    @Bean(name = "recoveryTaskScheduler")
    public ThreadPoolTaskScheduler recoveryTaskScheduler() {
        ThreadPoolProperties.SweeperPoolProperties props = threadPoolProperties.getSweeper();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the Log4j2 ThreadContext of the thread that schedules a task into the thread that runs
     * it, so sweep logs keep the same correlation values. Applied to the sweep task by
     * {@link RoutingEngineConfig}.
     */
    static TaskDecorator threadContextPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
