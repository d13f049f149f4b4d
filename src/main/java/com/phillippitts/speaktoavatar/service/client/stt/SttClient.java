package com.phillippitts.speaktoavatar.service.client.stt;

import com.phillippitts.speaktoavatar.config.properties.SttProperties;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
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
import com.phillippitts.speaktoavatar.service.protocol.Serialization;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client for the streaming speech-recognition WebSocket.
 *
 * <p>The handshake is a full client request describing the audio format and recognition options,
 * answered by one server response. Audio then follows as sequenced audio-only requests, the
 * last one carrying a negated sequence number. Every recognition uses its own connection, since
 * the audio format is fixed by the handshake.
 */
@Component
public class SttClient extends AbstractProtocolClient {

    private static final Logger LOG = LogManager.getLogger(SttClient.class);

    public static final String SERVICE = "stt";
    static final int CHANNELS = 1;
    static final int BITS_PER_SAMPLE = 16;
    private static final String MODEL_NAME = "bigmodel";

    private final SttProperties props;
    private final ReentrantLock recognitionLock = new ReentrantLock();

    private volatile int sampleRate;

    public SttClient(TransportFactory transportFactory, SttProperties props) {
        super(transportFactory);
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.sampleRate = props.getSampleRate();
    }

    @Override
    public String serviceName() {
        return SERVICE;
    }

    @Override
    protected TransportRequest transportRequest() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Api-Resource-Id", props.getResourceId());
        headers.put("X-Api-Request-Id", UUID.randomUUID().toString());
        headers.put("X-Api-Access-Key", props.getAccessKey());
        headers.put("X-Api-App-Key", props.getAppKey());
        LOG.debug("STT connect: url={}, appKey={}, resourceId={}", props.getUrl(),
                LogSanitizer.mask(props.getAppKey()), props.getResourceId());
        return new TransportRequest(URI.create(props.getUrl()), headers, props.isVerifySsl(),
                Duration.ofMillis(props.getConnectTimeoutMs()));
    }

    @Override
    protected void doHandshake() {
        Duration bound = Duration.ofMillis(props.getConnectTimeoutMs());
        JSONObject config = requestConfig(sampleRate);
        sendSequenced(seq -> FrameCodec.encode(Frame.builder(FrameHeader.of(MessageType.FULL_CLIENT_REQUEST,
                        MessageFlags.POS_SEQUENCE, Serialization.JSON, Compression.GZIP))
                .sequence(seq)
                .jsonPayload(config)
                .build()));

        Frame reply = awaitFrame(TimeUtils.deadlineAfter(bound), "recognition config response", bound);
        if (reply.messageType() == MessageType.ERROR) {
            throw RemoteServiceExceptionBuilder.create("STT rejected recognition config")
                    .service(SERVICE)
                    .errorCode(reply.errorCode())
                    .metadata("payload", LogSanitizer.truncate(reply.payloadAsString(), 200))
                    .buildConnection(ConnectionException.Reason.HANDSHAKE);
        }
        if (reply.messageType() != MessageType.FULL_SERVER_RESPONSE) {
            throw RemoteServiceExceptionBuilder.create("Unexpected reply to recognition config")
                    .service(SERVICE)
                    .messageType(reply.messageType())
                    .buildProtocol();
        }
        LOG.debug("STT config accepted: {}", LogSanitizer.truncate(reply.payloadAsString(), 200));
    }

    @Override
    protected void beforeClose() {
        // the service has no goodbye message; closing the socket ends the request
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
     * Recognizes one utterance of 16-bit mono PCM.
     *
     * <p>Opens a connection configured for {@code sampleRate}, streams the audio as WAV in
     * segments of the configured duration and reads results until one is final. The connection
     * is closed afterwards.
     *
     * @param pcm        little-endian 16-bit mono samples
     * @param sampleRate samples per second
     * @return the recognized text, empty if nothing was recognized
     * @throws ConnectionException if the connection fails or drops before any text arrived
     * @throws SessionException if the service reports an error
     * @throws com.phillippitts.speaktoavatar.exception.OperationTimeoutException if no final result arrives in time
     */
    public String recognize(byte[] pcm, int sampleRate) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (pcm.length == 0) {
            throw new IllegalArgumentException("pcm must not be empty");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got " + sampleRate);
        }
        recognitionLock.lock();
        try {
            this.sampleRate = sampleRate;
            long start = System.nanoTime();
            connect();
            String requestId = UUID.randomUUID().toString();
            bind(requestId);

            byte[] wav = WavEncoder.pcmToWav(pcm, sampleRate, CHANNELS, BITS_PER_SAMPLE);
            int segmentSize = Math.max(1, WavEncoder.segmentSize(sampleRate, CHANNELS, BITS_PER_SAMPLE,
                    props.getSegmentDurationMs()));
            int segments = 0;
            for (int offset = 0; offset < wav.length; offset += segmentSize) {
                int end = Math.min(wav.length, offset + segmentSize);
                sendAudio(Arrays.copyOfRange(wav, offset, end), end == wav.length);
                segments++;
            }

            String text = collectFinalText(requestId);
            LOG.info("STT request {} done: segments={}, {}ms, text='{}'", requestId, segments,
                    TimeUtils.elapsedMillis(start), LogSanitizer.preview(text));
            return text;
        } finally {
            disconnect();
            this.sampleRate = props.getSampleRate();
            recognitionLock.unlock();
        }
    }

    /**
     * Sends one audio segment stamped with the next sequence number.
     *
     * @param audio  segment bytes, compressed on the wire
     * @param isLast whether this segment ends the stream
     * @return the sequence number used, before negation
     */
    public int sendAudio(byte[] audio, boolean isLast) {
        Objects.requireNonNull(audio, "audio must not be null");
        return sendSequenced(seq -> FrameCodec.encodeAudioChunk(seq, isLast, audio));
    }

    /**
     * Blocks for the next recognition update.
     *
     * @throws SessionException if the service answered with an error frame
     */
    public RecognitionResult awaitResult(Duration timeout) {
        Frame frame = awaitFrame(TimeUtils.deadlineAfter(timeout), "recognition result", timeout);
        if (frame.messageType() == MessageType.ERROR) {
            int code = frame.errorCode() == null ? -1 : frame.errorCode();
            throw new SessionException("STT error " + code + ": "
                    + LogSanitizer.truncate(frame.payloadAsString(), 200), SERVICE, code);
        }
        if (frame.isPayloadCorrupt()) {
            throw RemoteServiceExceptionBuilder.create("Undecodable STT payload")
                    .service(SERVICE)
                    .messageType(frame.messageType())
                    .buildProtocol();
        }
        return RecognitionResultDecoder.decode(frame);
    }

    private String collectFinalText(String requestId) {
        Duration bound = Duration.ofMillis(props.getResultTimeoutMs());
        String latest = "";
        while (true) {
            RecognitionResult result;
            try {
                result = awaitResult(bound);
            } catch (ConnectionException e) {
                if (latest.isEmpty()) {
                    throw e;
                }
                LOG.warn("STT request {} closed before a final result, using last partial text", requestId);
                return latest;
            }
            if (result.hasText()) {
                latest = result.text();
            }
            LOG.debug("STT request {} update: seq={}, final={}, text='{}'", requestId, result.sequence(),
                    result.isFinal(), LogSanitizer.preview(result.text()));
            if (result.isFinal()) {
                return latest;
            }
        }
    }

    private Frame awaitFrame(long deadline, String operation, Duration bound) {
        InboundMessage message = awaitInbound(deadline, operation, bound);
        if (message.isBinary()) {
            return FrameCodec.decode(message.binary());
        }
        throw RemoteServiceExceptionBuilder.create("Unexpected text frame from STT service")
                .service(SERVICE)
                .metadata("text", LogSanitizer.truncate(message.text(), 200))
                .buildProtocol();
    }

    JSONObject requestConfig(int rate) {
        return new JSONObject()
                .put("user", new JSONObject().put("uid", props.getUid()))
                .put("audio", new JSONObject()
                        .put("format", "wav")
                        .put("codec", "raw")
                        .put("rate", rate)
                        .put("bits", BITS_PER_SAMPLE)
                        .put("channel", CHANNELS))
                .put("request", new JSONObject()
                        .put("model_name", MODEL_NAME)
                        .put("enable_itn", props.isEnableItn())
                        .put("enable_punc", props.isEnablePunc())
                        .put("enable_ddc", props.isEnableDdc())
                        .put("show_utterances", props.isShowUtterances())
                        .put("enable_nonstream", props.isEnableNonstream()));
    }
}
