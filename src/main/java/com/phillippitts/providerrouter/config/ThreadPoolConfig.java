package com.phillippitts.providerrouter.config;

import com.phillippitts.providerrouter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used by provider call adapters.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected request concurrency.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor for blocking provider calls and retry backoff scheduling.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.adapter.*} properties:
     * <ul>
     *   <li>Core pool: default 8 - typical number of in-flight provider calls</li>
     *   <li>Max pool: default 32 - bursts of concurrent dispatches</li>
     *   <li>Queue: default 200 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>A saturated pool runs the task on the submitting thread
     * ({@link ThreadPoolExecutor.CallerRunsPolicy}), which slows dispatching down rather than
     * rejecting calls. The submitter's ThreadContext is copied onto the worker so request IDs
     * and the capability stay on provider-call log lines.
     *
     * @return Configured executor for provider adapters
     */
    @Bean(name = "adapterExecutor")
    public Executor adapterExecutor() {
        ThreadPoolProperties.AdapterPoolProperties props = threadPoolProperties.getAdapter();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /** Copies the submitter's ThreadContext into the worker and restores the worker's afterwards. */
    static TaskDecorator threadContextPropagator() {
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
