package com.phillippitts.speaktoavatar.service.pipeline;

import com.phillippitts.speaktoavatar.config.properties.PipelineProperties;
import com.phillippitts.speaktoavatar.domain.Outcome;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.exception.SpeakToAvatarException;
import com.phillippitts.speaktoavatar.service.client.tts.AudioChunkListener;
import com.phillippitts.speaktoavatar.service.client.tts.SynthesisResult;
import com.phillippitts.speaktoavatar.service.client.tts.TtsClient;
import com.phillippitts.speaktoavatar.service.metrics.PipelineMetrics;
import com.phillippitts.speaktoavatar.service.session.CancellationToken;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * Synthesizes one sentence with bounded retries.
 *
 * <p>Each attempt makes sure the TTS connection is up (connecting and letting a fresh connection
 * settle first), then runs one TTS session. An attempt fails when the session raises or returns no
 * audio. A failed attempt is retried only if it delivered nothing, so the avatar never hears the
 * same audio twice. Cancellation ends the loop with {@link Outcome.Status#CANCELLED} and is never
 * retried.
 *
 * <p>An exception thrown by the chunk listener is not a TTS failure: it is neither retried nor
 * turned into an outcome, and reaches the caller unchanged.
 */
@Service
public class SynthesisService {

    private static final Logger LOG = LogManager.getLogger(SynthesisService.class);

    private final TtsClient tts;
    private final PipelineProperties props;
    private final PipelineMetrics metrics;

    public SynthesisService(TtsClient tts, PipelineProperties props, PipelineMetrics metrics) {
        this.tts = Objects.requireNonNull(tts, "tts must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * @param sentence text to speak
     * @param speaker  voice id
     * @param token    cancellation flag of the owning stream
     * @param listener receives audio chunks in order
     * @return the synthesis result, the last failure, or cancelled
     * @throws RuntimeException whatever the listener threw
     */
    public Outcome<SynthesisResult> synthesize(String sentence, String speaker, CancellationToken token,
                                               AudioChunkListener listener) {
        Objects.requireNonNull(sentence, "sentence must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        int maxAttempts = Math.max(1, props.getTtsMaxAttempts());
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (token.isCancelled()) {
                return Outcome.cancelled();
            }
            int[] delivered = {0};
            RuntimeException[] listenerFailure = {null};
            AudioChunkListener counting = (chunk, index) -> {
                delivered[0]++;
                try {
                    listener.onAudioChunk(chunk, index);
                } catch (RuntimeException e) {
                    listenerFailure[0] = e;
                    throw e;
                }
            };
            long start = System.nanoTime();
            try {
                ensureConnected();
                if (token.isCancelled()) {
                    return Outcome.cancelled();
                }
                SynthesisResult result = tts.synthesizeText(sentence, speaker, UUID.randomUUID().toString(),
                        token, counting);
                metrics.recordSynthesisLatency(System.nanoTime() - start);
                if (result.cancelled()) {
                    return Outcome.cancelled();
                }
                if (result.chunks() > 0) {
                    if (attempt > 1) {
                        LOG.info("TTS succeeded on attempt {}/{} for '{}'", attempt, maxAttempts,
                                LogSanitizer.preview(sentence));
                    }
                    return Outcome.succeeded(result);
                }
                last = new ProtocolException("TTS returned no audio for '" + LogSanitizer.preview(sentence) + "'");
                metrics.incrementSynthesisFailure("empty");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.cancelled();
            } catch (RuntimeException e) {
                if (listenerFailure[0] != null) {
                    throw listenerFailure[0];
                }
                if (!(e instanceof SpeakToAvatarException)) {
                    throw e;
                }
                last = e;
                metrics.incrementSynthesisFailure(failureReason(e));
            }

            LOG.warn("TTS attempt {}/{} failed for '{}': {}", attempt, maxAttempts,
                    LogSanitizer.preview(sentence), last.getMessage());
            if (delivered[0] > 0) {
                LOG.warn("Not retrying, {} chunks were already delivered", delivered[0]);
                return Outcome.failed(last);
            }
            if (attempt < maxAttempts && !pause(props.getTtsRetryDelayMs())) {
                return Outcome.cancelled();
            }
        }
        return Outcome.failed(last);
    }

    private void ensureConnected() throws InterruptedException {
        if (tts.isConnected()) {
            return;
        }
        LOG.info("TTS not connected, connecting");
        tts.connect();
        Thread.sleep(props.getTtsReconnectSettleMs());
    }

    static String failureReason(RuntimeException e) {
        if (e instanceof OperationTimeoutException) {
            return "timeout";
        }
        if (e instanceof ConnectionException ce) {
            return ce.isTimeout() ? "timeout" : "connection";
        }
        if (e instanceof SessionException) {
            return "session";
        }
        if (e instanceof ProtocolException) {
            return "protocol";
        }
        return "error";
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
