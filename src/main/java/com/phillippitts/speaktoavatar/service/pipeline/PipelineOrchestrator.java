package com.phillippitts.speaktoavatar.service.pipeline;

import com.phillippitts.speaktoavatar.domain.Outcome;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.SpeakToAvatarException;
import com.phillippitts.speaktoavatar.service.client.avatar.AvatarClient;
import com.phillippitts.speaktoavatar.service.client.tts.SynthesisResult;
import com.phillippitts.speaktoavatar.service.llm.LlmClient;
import com.phillippitts.speaktoavatar.service.metrics.PipelineMetrics;
import com.phillippitts.speaktoavatar.service.session.StreamSession;
import com.phillippitts.speaktoavatar.service.session.StreamSessionRegistry;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Answers a query and speaks the answer, sentence by sentence, through the room's avatar.
 *
 * <p>For one query: the LLM answer is read delta by delta into a {@link SentenceBuffer}; each
 * completed sentence is synthesized before the next delta is read, and each audio chunk is
 * forwarded to the avatar before the next chunk is read. Sentences and chunks are therefore
 * strictly ordered. Text left in the buffer when the answer ends is spoken last.
 *
 * <p>The session's cancellation token is polled at entry, between deltas, before every TTS call
 * and (inside the TTS client) between audio chunks. Once it trips no further remote call is
 * issued and a single {@code cancelled} event ends the stream. A failure to drive the avatar
 * ends the stream with an {@code error} event. The session is released in every case.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);

    private final LlmClient llm;
    private final SynthesisService synthesis;
    private final AvatarClient avatar;
    private final StreamSessionRegistry sessions;
    private final PipelineMetrics metrics;
    private final AsyncTaskExecutor executor;

    public PipelineOrchestrator(LlmClient llm,
                                SynthesisService synthesis,
                                AvatarClient avatar,
                                StreamSessionRegistry sessions,
                                PipelineMetrics metrics,
                                @Qualifier("pipelineExecutor") AsyncTaskExecutor executor) {
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis must not be null");
        this.avatar = Objects.requireNonNull(avatar, "avatar must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Registers the query's session and runs it on the pipeline executor. The session is
     * cancellable as soon as this returns.
     *
     * @return the registered session
     * @throws TaskRejectedException if the pipeline executor is saturated
     */
    public StreamSession submit(QueryRequest request, StreamEventSink sink) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        StreamSession session = sessions.register(request.sessionId(), request.liveId());
        try {
            executor.execute(() -> process(session, request, sink));
        } catch (TaskRejectedException e) {
            sessions.release(session);
            metrics.incrementStreamOutcome("error");
            throw e;
        }
        return session;
    }

    /**
     * Registers the query's session and runs it on the calling thread.
     *
     * @return the session, already released
     */
    public StreamSession execute(QueryRequest request, StreamEventSink sink) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        StreamSession session = sessions.register(request.sessionId(), request.liveId());
        process(session, request, sink);
        return session;
    }

    /**
     * Cancels a streamed query.
     *
     * @return 1 if this call cancelled it, 0 if it is unknown or already cancelled
     */
    public int cancel(String sessionId) {
        int cancelled = sessions.cancelBySession(sessionId);
        LOG.info("Cancel requested for stream {}: cancelled={}", sessionId, cancelled);
        return cancelled;
    }

    private void process(StreamSession session, QueryRequest request, StreamEventSink sink) {
        Map<String, String> context = new HashMap<>();
        context.put("sessionId", session.sessionId());
        if (session.hasRoom()) {
            context.put("roomId", session.roomId());
        }
        long start = System.nanoTime();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(context)) {
            String outcome = new Run(session, request, sink).execute();
            metrics.incrementStreamOutcome(outcome);
            LOG.info("Stream {} ended: {} in {}ms", session.sessionId(), outcome, TimeUtils.elapsedMillis(start));
        } finally {
            sessions.release(session);
        }
    }

    /**
     * State of one streamed query. Lives on one thread.
     */
    private final class Run {

        private final StreamSession session;
        private final QueryRequest request;
        private final StreamEventSink sink;
        private final SentenceBuffer buffer = new SentenceBuffer();
        private final StringBuilder fullText = new StringBuilder();
        private boolean drivingAvatar;
        private boolean warnedNotLive;

        Run(StreamSession session, QueryRequest request, StreamEventSink sink) {
            this.session = session;
            this.request = request;
            this.sink = sink;
        }

        /**
         * @return stream outcome: complete, cancelled or error
         */
        String execute() {
            try {
                if (session.isCancelled()) {
                    return cancelled();
                }
                emit(StreamEvent.start(session.sessionId(), request.query()));
                LOG.info("Stream {} started: query='{}', room={}", session.sessionId(),
                        LogSanitizer.preview(request.query()), session.roomId());

                String conversationId = llm.createConversation(request.userId());
                if (session.isCancelled()) {
                    return cancelled();
                }
                llm.chatStream(request.userId(), conversationId, request.query(), this::onDelta);
                if (session.isCancelled()) {
                    return cancelled();
                }

                String leftover = buffer.flush();
                if (!leftover.isEmpty()) {
                    speak(leftover, true);
                    if (session.isCancelled()) {
                        return cancelled();
                    }
                }
                finishAudio();
                emit(StreamEvent.complete(fullText.toString(), session.sessionId()));
                return "complete";
            } catch (RuntimeException e) {
                if (session.isCancelled()) {
                    return cancelled();
                }
                if (e instanceof SpeakToAvatarException) {
                    LOG.warn("Stream {} failed: {}", session.sessionId(), e.getMessage());
                } else {
                    LOG.error("Unexpected error in stream {}", session.sessionId(), e);
                }
                return error(e);
            }
        }

        private boolean onDelta(String delta) {
            if (session.isCancelled()) {
                return false;
            }
            fullText.append(delta);
            emit(StreamEvent.textChunk(delta, fullText.toString()));
            for (String sentence : buffer.append(delta)) {
                if (session.isCancelled()) {
                    return false;
                }
                speak(sentence, false);
            }
            return !session.isCancelled();
        }

        private void speak(String sentence, boolean leftover) {
            if (!SentenceBuffer.isSpeakable(sentence)) {
                LOG.debug("Skipping sentence with nothing to speak: '{}'", sentence);
                return;
            }
            emit(StreamEvent.sentence(sentence, leftover));
            if (session.isCancelled()) {
                return;
            }
            Outcome<SynthesisResult> outcome = synthesis.synthesize(sentence, request.speaker(), session.token(),
                    (chunk, index) -> {
                        forwardToAvatar(chunk);
                        emit(StreamEvent.audioChunk(sentence, chunk.length, leftover));
                    });
            if (outcome.isSucceeded()) {
                if (!leftover) {
                    emit(StreamEvent.sentenceProcessed(sentence));
                }
            } else if (outcome.isFailed()) {
                LOG.error("TTS gave up on '{}': {}", LogSanitizer.preview(sentence), outcome.error().getMessage());
                emit(StreamEvent.ttsError(sentence, outcome.error().getMessage(), leftover));
            }
        }

        private void forwardToAvatar(byte[] chunk) {
            if (avatarReady()) {
                avatar.driveWithAudio(chunk);
            }
        }

        private void finishAudio() {
            if (avatarReady()) {
                avatar.finishAudio();
            }
        }

        /**
         * Whether audio goes to the avatar. A room that is not live when the first audio is ready
         * is skipped with a warning; a room that stops being live after audio went to it fails the
         * stream.
         *
         * @throws ConnectionException if the avatar lost the room mid-stream
         */
        private boolean avatarReady() {
            if (!session.hasRoom()) {
                return false;
            }
            boolean bound = avatar.isBoundTo(session.roomId());
            if (drivingAvatar) {
                if (!bound) {
                    throw new ConnectionException("Avatar is no longer live in room " + session.roomId(),
                            AvatarClient.SERVICE, ConnectionException.Reason.CLOSED);
                }
                return true;
            }
            if (!bound) {
                if (!warnedNotLive) {
                    warnedNotLive = true;
                    LOG.warn("Stream {} asked for room {} but the avatar is not live there, audio stays local",
                            session.sessionId(), session.roomId());
                }
                return false;
            }
            drivingAvatar = true;
            return true;
        }

        /**
         * Hands an event to the sink. A sink that fails (the caller went away) cancels the stream.
         */
        private void emit(StreamEvent event) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                if (session.token().cancel()) {
                    LOG.warn("Stream {} lost its receiver ({}), cancelling", session.sessionId(), e.getMessage());
                }
            }
        }

        private String cancelled() {
            LOG.info("Stream {} cancelled", session.sessionId());
            emit(StreamEvent.cancelled(session.sessionId()));
            return "cancelled";
        }

        private String error(RuntimeException e) {
            emit(StreamEvent.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    session.sessionId()));
            return "error";
        }
    }
}
