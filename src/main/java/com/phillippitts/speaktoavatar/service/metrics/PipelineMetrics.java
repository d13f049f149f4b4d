package com.phillippitts.speaktoavatar.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for room joins, speech synthesis and streamed queries.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Join latency and join outcomes (joined, failed, rejected) by reason</li>
 *   <li>Synthesis latency and synthesis failures by reason</li>
 *   <li>Streamed query outcomes (complete, cancelled, error)</li>
 *   <li>Error notifications pushed by the avatar service</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "speaktoavatar";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a successful join and its latency.
     *
     * @param durationMs wall-clock time from request to live acknowledgment
     */
    public void recordJoinSuccess(long durationMs) {
        Timer.builder(METRIC_PREFIX + ".join.latency")
                .description("Time taken to bind a room to the avatar")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder(METRIC_PREFIX + ".join.success")
                .description("Number of successful room joins")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (timeout, connection, session, error)
     */
    public void incrementJoinFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".join.failure")
                .description("Number of room joins that failed after an attempt")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason rejection reason (pending, cooldown, cancelled)
     */
    public void incrementJoinRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".join.rejected")
                .description("Number of room joins refused without an attempt")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the latency of one synthesis attempt.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordSynthesisLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken to synthesize one sentence")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason failure reason (connection, timeout, session, protocol, empty, error)
     */
    public void incrementSynthesisFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".synthesis.failure")
                .description("Number of failed synthesis attempts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome how the stream ended (complete, cancelled, error)
     */
    public void incrementStreamOutcome(String outcome) {
        Counter.builder(METRIC_PREFIX + ".stream")
                .description("Number of streamed queries by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param code error code pushed by the avatar service
     */
    public void incrementAvatarError(int code) {
        Counter.builder(METRIC_PREFIX + ".avatar.error")
                .description("Number of error notifications from the avatar service")
                .tag("code", String.valueOf(code))
                .register(registry)
                .increment();
    }
}
