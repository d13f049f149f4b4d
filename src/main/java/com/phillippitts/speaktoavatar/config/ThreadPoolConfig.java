package com.phillippitts.speaktoavatar.config;

import com.phillippitts.speaktoavatar.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools that run streamed queries and room joins.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrency.
 *
 * <p>Both pools reject work when saturated ({@link ThreadPoolExecutor.AbortPolicy}). Running a
 * query or a join on the request thread would bypass the join timeout and tie up the servlet
 * thread for the whole stream.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for streamed queries. One thread per in-flight query, blocked on LLM, TTS and
     * avatar I/O most of the time.
     *
     * <p>Thread naming: configured via {@code threadpool.pipeline.thread-name-prefix}.
     *
     * @return configured executor for the query pipeline
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        return build(threadPoolProperties.getPipeline());
    }

    /**
     * Executor for room joins, so the caller can bound the whole join with a wall-clock timeout
     * and interrupt it when exceeded.
     *
     * @return configured executor for room joins
     */
    @Bean(name = "joinExecutor")
    public ThreadPoolTaskExecutor joinExecutor() {
        return build(threadPoolProperties.getJoin());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties pool) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread to the worker thread, so
     * requestId and roomId survive the hop, and restores the worker's own context afterwards.
     */
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
