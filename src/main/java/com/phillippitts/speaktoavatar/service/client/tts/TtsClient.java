package com.phillippitts.speaktoavatar.service.client.tts;

import com.phillippitts.speaktoavatar.config.properties.TtsProperties;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.service.client.AbstractProtocolClient;
import com.phillippitts.speaktoavatar.service.client.InboundMessage;
import com.phillippitts.speaktoavatar.service.client.transport.TransportFactory;
import com.phillippitts.speaktoavatar.service.client.transport.TransportRequest;
import com.phillippitts.speaktoavatar.service.protocol.Compression;
import com.phillippitts.speaktoavatar.service.protocol.Frame;
import com.phillippitts.speaktoavatar.service.protocol.FrameCodec;
import com.phillippitts.speaktoavatar.service.protocol.FrameHeader;
import com.phillippitts.speaktoavatar.service.protocol.MessageFlags;
import com.phillippitts.speaktoavatar.service.protocol.MessageType;
import com.phillippitts.speaktoavatar.service.protocol.ProtocolEvents;
import com.phillippitts.speaktoavatar.service.protocol.Serialization;
import com.phillippitts.speaktoavatar.service.session.CancellationToken;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client for the bidirectional TTS WebSocket.
 *
 * <p>Connection handshake: StartConnection, then wait for ConnectionStarted. Each synthesis runs
 * one session on the shared connection:
 * <pre>
 * StartSession  -> SessionStarted
 * TaskRequest(text)
 * FinishSession
 * TTSSentenceStart / TTSResponse(audio)* / TTSSentenceEnd ... -> SessionFinished
 * </pre>
 * Sessions on one connection run one at a time.
 */
@Component
public class TtsClient extends AbstractProtocolClient {

    private static final Logger LOG = LogManager.getLogger(TtsClient.class);

    public static final String SERVICE = "tts";
    private static final String NAMESPACE = "BidirectionalTTS";
    private static final Duration FINISH_CONNECTION_WAIT = Duration.ofSeconds(1);

    private final TtsProperties props;
    private final ReentrantLock sessionLock = new ReentrantLock();

    public TtsClient(TransportFactory transportFactory, TtsProperties props) {
        super(transportFactory);
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public String serviceName() {
        return SERVICE;
    }

    @Override
    protected TransportRequest transportRequest() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Api-App-Key", props.getAppKey());
        headers.put("X-Api-Access-Key", props.getAccessKey());
        headers.put("X-Api-Resource-Id", props.getResourceId());
        headers.put("X-Api-Connect-Id", UUID.randomUUID().toString());
        LOG.debug("TTS connect: url={}, appKey={}, resourceId={}", props.getUrl(),
                LogSanitizer.mask(props.getAppKey()), props.getResourceId());
        return new TransportRequest(URI.create(props.getUrl()), headers, props.isVerifySsl(),
                Duration.ofMillis(props.getConnectTimeoutMs()));
    }

    @Override
    protected void doHandshake() {
        Duration bound = Duration.ofMillis(props.getConnectTimeoutMs());
        sendBinary(FrameCodec.encode(eventFrame(ProtocolEvents.START_CONNECTION, null, new JSONObject())));
        Frame reply = awaitFrame(TimeUtils.deadlineAfter(bound), "ConnectionStarted", bound);

        if (reply.hasEvent(ProtocolEvents.CONNECTION_STARTED)) {
            LOG.info("TTS connection started: connectionId={}", reply.connectionId());
            return;
        }
        if (reply.hasEvent(ProtocolEvents.CONNECTION_FAILED)) {
            throw RemoteServiceExceptionBuilder.create("TTS connection refused")
                    .service(SERVICE)
                    .event(reply.event())
                    .metadata("meta", reply.responseMeta())
                    .buildConnection(ConnectionException.Reason.HANDSHAKE);
        }
        if (reply.messageType() == MessageType.ERROR) {
            throw RemoteServiceExceptionBuilder.create("TTS connection refused")
                    .service(SERVICE)
                    .errorCode(reply.errorCode())
                    .metadata("error", TtsErrorCode.describe(reply.errorCode()))
                    .metadata("payload", LogSanitizer.truncate(reply.payloadAsString(), 200))
                    .buildConnection(ConnectionException.Reason.HANDSHAKE);
        }
        throw RemoteServiceExceptionBuilder.create("Unexpected reply to StartConnection")
                .service(SERVICE)
                .event(reply.event())
                .messageType(reply.messageType())
                .buildProtocol();
    }

    @Override
    protected void beforeClose() {
        drainInbox();
        sendBinary(FrameCodec.encode(eventFrame(ProtocolEvents.FINISH_CONNECTION, null, new JSONObject())));
        try {
            Frame reply = awaitFrame(TimeUtils.deadlineAfter(FINISH_CONNECTION_WAIT), "ConnectionFinished",
                    FINISH_CONNECTION_WAIT);
            LOG.debug("TTS finish connection acknowledged: {}", reply);
        } catch (OperationTimeoutException e) {
            LOG.debug("TTS did not acknowledge FinishConnection, closing anyway");
        }
    }

    @Override
    protected Duration healthTimeout() {
        return Duration.ofMillis(props.getHealthTimeoutMs());
    }

    @Override
    protected Duration closeTimeout() {
        return Duration.ofMillis(props.getCloseTimeoutMs());
    }

    /**
     * Synthesizes one piece of text and hands each audio chunk to the listener in arrival order.
     *
     * <p>The token is polled before the session starts and before every chunk. Once it trips,
     * chunks are no longer delivered but the session is still read to SessionFinished (bounded by
     * the drain timeout) so the connection stays usable for the next synthesis.
     *
     * @param text      text to speak
     * @param speaker   voice id
     * @param sessionId id of this TTS session
     * @param token     cancellation flag of the owning stream
     * @param listener  receives audio chunks
     * @return counts of delivered audio and whether delivery stopped on cancellation
     * @throws ConnectionException if not connected or the socket drops
     * @throws SessionException if the service rejects or fails the session
     * @throws OperationTimeoutException if an acknowledgment or the next frame does not arrive in time
     * @throws ProtocolException if the service sends something out of place
     */
    public SynthesisResult synthesizeText(String text, String speaker, String sessionId,
                                          CancellationToken token, AudioChunkListener listener) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        String voice = (speaker == null || speaker.isBlank()) ? props.getDefaultSpeaker() : speaker;

        sessionLock.lock();
        try {
            if (token.isCancelled()) {
                return SynthesisResult.cancelledBeforeStart();
            }
            if (!isConnected()) {
                throw new ConnectionException("TTS client not connected", SERVICE, ConnectionException.Reason.CLOSED);
            }
            drainInbox();
            bind(sessionId);
            long start = System.nanoTime();
            try {
                startSession(sessionId, voice);
                sendBinary(FrameCodec.encode(eventFrame(ProtocolEvents.TASK_REQUEST, sessionId,
                        requestPayload(ProtocolEvents.TASK_REQUEST, text, voice))));
                sendBinary(FrameCodec.encode(eventFrame(ProtocolEvents.FINISH_SESSION, sessionId, new JSONObject())));
                SynthesisResult result = readAudio(sessionId, token, listener);
                LOG.info("TTS session {} done: chunks={}, bytes={}, cancelled={}, {}ms, text='{}'",
                        sessionId, result.chunks(), result.audioBytes(), result.cancelled(),
                        TimeUtils.elapsedMillis(start), LogSanitizer.preview(text));
                return result;
            } catch (RuntimeException e) {
                // late frames of an abandoned session would be read by the next one; start over on a fresh socket
                LOG.warn("TTS session {} abandoned ({}), dropping connection", sessionId, e.getClass().getSimpleName());
                discardTransport();
                throw e;
            }
        } finally {
            unbind();
            sessionLock.unlock();
        }
    }

    private void startSession(String sessionId, String voice) {
        Duration bound = Duration.ofMillis(props.getSessionTimeoutMs());
        long deadline = TimeUtils.deadlineAfter(bound);
        sendBinary(FrameCodec.encode(eventFrame(ProtocolEvents.START_SESSION, sessionId,
                requestPayload(ProtocolEvents.START_SESSION, "", voice))));
        while (true) {
            Frame reply = awaitFrame(deadline, "SessionStarted", bound);
            throwIfError(reply, sessionId);
            if (reply.hasEvent(ProtocolEvents.SESSION_STARTED)) {
                return;
            }
            LOG.debug("TTS skipping {} while waiting for SessionStarted", reply);
        }
    }

    private SynthesisResult readAudio(String sessionId, CancellationToken token, AudioChunkListener listener) {
        Duration receiveBound = Duration.ofMillis(props.getReceiveTimeoutMs());
        Duration drainBound = Duration.ofMillis(props.getDrainTimeoutMs());
        int chunks = 0;
        long bytes = 0;
        boolean cancelled = false;
        long drainDeadline = 0;

        while (true) {
            Frame frame;
            try {
                frame = cancelled
                        ? awaitFrame(drainDeadline, "SessionFinished after cancel", drainBound)
                        : awaitFrame(TimeUtils.deadlineAfter(receiveBound), "TTS audio", receiveBound);
            } catch (OperationTimeoutException e) {
                if (!cancelled) {
                    throw e;
                }
                LOG.warn("TTS session {} did not finish within {}ms after cancel, dropping connection",
                        sessionId, drainBound.toMillis());
                discardTransport();
                return new SynthesisResult(chunks, bytes, true);
            }
            throwIfError(frame, sessionId);

            if (frame.hasEvent(ProtocolEvents.TTS_RESPONSE) && frame.messageType() == MessageType.AUDIO_ONLY_RESPONSE) {
                if (!cancelled && token.isCancelled()) {
                    cancelled = true;
                    drainDeadline = TimeUtils.deadlineAfter(drainBound);
                    LOG.info("TTS session {} cancelled after {} chunks, draining", sessionId, chunks);
                }
                if (!cancelled && frame.payloadSize() > 0) {
                    listener.onAudioChunk(frame.payload(), chunks);
                    chunks++;
                    bytes += frame.payloadSize();
                }
            } else if (frame.hasEvent(ProtocolEvents.TTS_SENTENCE_START)
                    || frame.hasEvent(ProtocolEvents.TTS_SENTENCE_END)) {
                LOG.trace("TTS {} for session {}", ProtocolEvents.name(frame.event()), sessionId);
            } else if (frame.hasEvent(ProtocolEvents.SESSION_FINISHED)) {
                return new SynthesisResult(chunks, bytes, cancelled || token.isCancelled());
            } else {
                LOG.debug("TTS ignoring {} during session {}", frame, sessionId);
            }
        }
    }

    private void throwIfError(Frame frame, String sessionId) {
        if (frame.messageType() == MessageType.ERROR) {
            int code = frame.errorCode() == null ? -1 : frame.errorCode();
            throw new SessionException("TTS error during session " + sessionId + ": "
                    + TtsErrorCode.describe(code) + " " + LogSanitizer.truncate(frame.payloadAsString(), 200),
                    SERVICE, code);
        }
        if (frame.hasEvent(ProtocolEvents.SESSION_FAILED)) {
            JSONObject meta = frame.responseMeta() == null ? new JSONObject() : parseMeta(frame.responseMeta());
            int code = meta.optInt("status_code", TtsErrorCode.SESSION_ERROR.code());
            throw new SessionException("TTS session " + sessionId + " failed: " + meta.optString("message", "no details"),
                    SERVICE, code);
        }
        if (frame.isPayloadCorrupt()) {
            throw RemoteServiceExceptionBuilder.create("Undecodable TTS payload")
                    .service(SERVICE)
                    .event(frame.event())
                    .buildProtocol();
        }
    }

    private Frame awaitFrame(long deadline, String operation, Duration bound) {
        InboundMessage message = awaitInbound(deadline, operation, bound);
        if (message.isBinary()) {
            return FrameCodec.decode(message.binary());
        }
        // the TTS service only talks binary; a text frame is an error report
        throw RemoteServiceExceptionBuilder.create("Unexpected text frame from TTS service")
                .service(SERVICE)
                .metadata("text", LogSanitizer.truncate(message.text(), 200))
                .buildProtocol();
    }

    private Frame eventFrame(int event, String sessionId, JSONObject payload) {
        return Frame.builder(FrameHeader.of(MessageType.FULL_CLIENT_REQUEST, MessageFlags.WITH_EVENT,
                        Serialization.JSON, Compression.NONE))
                .event(event)
                .sessionId(sessionId)
                .jsonPayload(payload)
                .build();
    }

    private JSONObject requestPayload(int event, String text, String speaker) {
        return new JSONObject()
                .put("user", new JSONObject().put("uid", props.getUid()))
                .put("event", event)
                .put("namespace", NAMESPACE)
                .put("req_params", new JSONObject()
                        .put("text", text)
                        .put("speaker", speaker)
                        .put("audio_params", new JSONObject()
                                .put("format", props.getAudioFormat())
                                .put("sample_rate", props.getSampleRate())));
    }

    private static JSONObject parseMeta(String meta) {
        try {
            return new JSONObject(meta);
        } catch (RuntimeException e) {
            return new JSONObject().put("message", meta);
        }
    }
}
