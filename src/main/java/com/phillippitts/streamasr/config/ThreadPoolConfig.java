package com.phillippitts.streamasr.config;

import com.phillippitts.streamasr.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs background recognition sessions.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrency.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor used by {@code StreamingRecognizer.recognizeAsync}.
     *
     * <p>Pool sizing configured via {@code threadpool.asr.*} properties:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 16</li>
     *   <li>Queue: default 100 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}.
     * When the pool and queue are full the submitting thread runs the session itself.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the
     * worker thread so async session logs keep the request id.
     *
     * @return Configured executor for recognition sessions
     */
    @Bean(name = "asrExecutor")
    public ThreadPoolTaskExecutor asrExecutor() {
        ThreadPoolProperties.AsrPoolProperties asrProps = threadPoolProperties.getAsr();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(asrProps.getCorePoolSize());
        executor.setMaxPoolSize(asrProps.getMaxPoolSize());
        executor.setQueueCapacity(asrProps.getQueueCapacity());
        executor.setThreadNamePrefix(asrProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(asrProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
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
