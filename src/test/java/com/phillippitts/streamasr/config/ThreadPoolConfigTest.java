package com.phillippitts.streamasr.config;

import com.phillippitts.streamasr.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).asrExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(16);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("asr-pool-");
    }

    @Test
    void shouldApplyConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getAsr().setCorePoolSize(1);
        properties.getAsr().setMaxPoolSize(2);
        properties.getAsr().setThreadNamePrefix("test-asr-");

        executor = new ThreadPoolConfig(properties).asrExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("test-asr-");
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).asrExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completedTasks.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).asrExecutor();
        ThreadContext.put("requestId", "req-42");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        TaskDecorator decorator = ThreadPoolConfig.threadContextPropagation();
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = decorator.decorate(() -> assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }
}
