package com.phillippitts.providerrouter.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>The routing engine itself is synchronous; the only pooled work is the recovery sweeper,
 * which runs on a small dedicated scheduler.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SweeperPoolProperties sweeper = new SweeperPoolProperties();

    public SweeperPoolProperties getSweeper() {
        return sweeper;
    }

    public void setSweeper(SweeperPoolProperties sweeper) {
        this.sweeper = sweeper;
    }

    /**
     * Recovery sweeper scheduler configuration.
     */
    public static class SweeperPoolProperties {
        private int poolSize = 1;
        private int awaitTerminationSeconds = 30;
        private String threadNamePrefix = "recovery-sweeper-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
