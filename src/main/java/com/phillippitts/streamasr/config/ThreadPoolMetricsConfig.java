package com.phillippitts.streamasr.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the recognition executor's pool state via Micrometer.
 *
 * <ul>
 *   <li>asr.pool.size - Current number of threads in the pool</li>
 *   <li>asr.pool.active - Number of sessions running</li>
 *   <li>asr.pool.queued - Number of sessions waiting in the queue</li>
 *   <li>asr.pool.completed - Cumulative count of completed sessions</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> asrExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("asrExecutor") ObjectProvider<ThreadPoolTaskExecutor> asrExecutorProvider) {
        this.asrExecutorProvider = asrExecutorProvider;
    }

    @Bean
    public MeterBinder asrExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = asrExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("asr.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the ASR pool")
                    .register(registry);

            Gauge.builder("asr.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of recognition sessions running on the ASR pool")
                    .register(registry);

            Gauge.builder("asr.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of recognition sessions waiting in the queue")
                    .register(registry);

            Gauge.builder("asr.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed recognition sessions")
                    .register(registry);

            LOG.info("ASR thread pool metrics registered: asr.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = asrExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("ASR Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
