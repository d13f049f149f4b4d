package com.phillippitts.speaktoavatar.config;

import com.phillippitts.speaktoavatar.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
    void pipelineExecutorUsesDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).pipelineExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(16);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("pipeline-");
    }

    @Test
    void joinExecutorUsesDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).joinExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("join-");
    }

    @Test
    void rejectsWorkWhenSaturated() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getJoin().setCorePoolSize(1);
        props.getJoin().setMaxPoolSize(1);
        props.getJoin().setQueueCapacity(0);
        executor = new ThreadPoolConfig(props).joinExecutor();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            assertThatThrownBy(() -> executor.execute(() -> { })).isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void propagatesThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).pipelineExecutor();
        ThreadContext.put("requestId", "req-77");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-77");
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.threadContextPropagation().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }
}
