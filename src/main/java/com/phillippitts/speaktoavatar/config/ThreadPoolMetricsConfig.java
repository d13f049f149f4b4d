package com.phillippitts.speaktoavatar.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Exposes the pipeline and join pools through Micrometer.
 *
 * <p>For each pool ({@code pipeline}, {@code join}):
 * <ul>
 *   <li>{@code <pool>.pool.size} - current number of threads</li>
 *   <li>{@code <pool>.pool.active} - threads executing a task</li>
 *   <li>{@code <pool>.pool.queued} - tasks waiting in the queue</li>
 *   <li>{@code <pool>.pool.completed} - cumulative completed tasks</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> joinExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("joinExecutor") ObjectProvider<ThreadPoolTaskExecutor> joinExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.joinExecutorProvider = joinExecutorProvider;
    }

    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            bind(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "join", joinExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: pipeline.pool.* and join.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);
        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing " + pool + " tasks")
                .register(registry);
        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Number of " + pool + " tasks waiting in the queue")
                .register(registry);
        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("Pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
        log("Join", joinExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
