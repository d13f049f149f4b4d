package com.phillippitts.speaktoavatar.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry and timeout settings for the LLM to TTS to avatar pipeline.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @Positive(message = "TTS attempts must be positive")
    private int ttsMaxAttempts = 3;

    @Min(0)
    private long ttsRetryDelayMs = 2_000;

    /** Pause after a fresh TTS connect before the first request on it. */
    @Min(0)
    private long ttsReconnectSettleMs = 1_500;

    /** SSE emitter lifetime for one streamed query. */
    @Positive
    private long emitterTimeoutMs = 300_000;

    public int getTtsMaxAttempts() {
        return ttsMaxAttempts;
    }

    public void setTtsMaxAttempts(int ttsMaxAttempts) {
        this.ttsMaxAttempts = ttsMaxAttempts;
    }

    public long getTtsRetryDelayMs() {
        return ttsRetryDelayMs;
    }

    public void setTtsRetryDelayMs(long ttsRetryDelayMs) {
        this.ttsRetryDelayMs = ttsRetryDelayMs;
    }

    public long getTtsReconnectSettleMs() {
        return ttsReconnectSettleMs;
    }

    public void setTtsReconnectSettleMs(long ttsReconnectSettleMs) {
        this.ttsReconnectSettleMs = ttsReconnectSettleMs;
    }

    public long getEmitterTimeoutMs() {
        return emitterTimeoutMs;
    }

    public void setEmitterTimeoutMs(long emitterTimeoutMs) {
        this.emitterTimeoutMs = emitterTimeoutMs;
    }
}
