package com.phillippitts.providerrouter.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the executor that runs blocking provider SDK calls and schedules retry backoff.
 * Adapter calls are I/O bound, so the pool is wider than the CPU count by default.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private AdapterPoolProperties adapter = new AdapterPoolProperties();

    public AdapterPoolProperties getAdapter() {
        return adapter;
    }

    public void setAdapter(AdapterPoolProperties adapter) {
        this.adapter = adapter;
    }

    /**
     * Adapter executor pool configuration.
     */
    public static class AdapterPoolProperties {
        @Positive
        private int corePoolSize = 8;
        @Positive
        private int maxPoolSize = 32;
        @PositiveOrZero
        private int queueCapacity = 200;
        @Positive
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "adapter-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
