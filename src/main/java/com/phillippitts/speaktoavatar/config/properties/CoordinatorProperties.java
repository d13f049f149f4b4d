package com.phillippitts.speaktoavatar.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits for joining an avatar to a room: retry budget, per-step and overall timeouts, and the
 * cooldown that throttles retries after a failure.
 */
@ConfigurationProperties(prefix = "coordinator")
@Validated
public class CoordinatorProperties {

    @Positive(message = "Cooldown seconds must be positive")
    private int cooldownSeconds = 10;

    @Positive
    private long healthTimeoutMs = 10_000;

    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    @Positive
    private long retryDelayMs = 3_000;

    @Positive
    private long startLiveTimeoutMs = 30_000;

    /** Hard wall-clock bound for the whole join, independent of the per-step bounds. */
    @Positive
    private long joinTimeoutMs = 90_000;

    @Positive
    private long sweepIntervalMs = 30_000;

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(int cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public long getHealthTimeoutMs() {
        return healthTimeoutMs;
    }

    public void setHealthTimeoutMs(long healthTimeoutMs) {
        this.healthTimeoutMs = healthTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public long getStartLiveTimeoutMs() {
        return startLiveTimeoutMs;
    }

    public void setStartLiveTimeoutMs(long startLiveTimeoutMs) {
        this.startLiveTimeoutMs = startLiveTimeoutMs;
    }

    public long getJoinTimeoutMs() {
        return joinTimeoutMs;
    }

    public void setJoinTimeoutMs(long joinTimeoutMs) {
        this.joinTimeoutMs = joinTimeoutMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }
}
