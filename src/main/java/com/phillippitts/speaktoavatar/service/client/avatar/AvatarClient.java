package com.phillippitts.speaktoavatar.service.client.avatar;

import com.phillippitts.speaktoavatar.config.properties.AvatarProperties;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.service.client.AbstractProtocolClient;
import com.phillippitts.speaktoavatar.service.client.InboundMessage;
import com.phillippitts.speaktoavatar.service.client.transport.TransportFactory;
import com.phillippitts.speaktoavatar.service.client.transport.TransportRequest;
import com.phillippitts.speaktoavatar.service.protocol.AvatarMessage;
import com.phillippitts.speaktoavatar.service.protocol.AvatarTag;
import com.phillippitts.speaktoavatar.util.LogSanitizer;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the avatar live-control WebSocket.
 *
 * <p>Unlike the TTS and STT sockets this channel uses 8-byte text tags instead of the binary
 * frame header. Control and JSON messages travel as text; streaming audio travels as a binary
 * message made of the {@code |DAT|02|} tag and the raw audio bytes.
 *
 * <p>The service has no hello message, so a connection is ready as soon as the socket opens.
 * Connecting tries each configured {@link AvatarProperties.ConnectStrategy} in turn.
 *
 * <p>Heartbeats are consumed as they arrive. Status events and error notifications go to the
 * registered {@link AvatarStatusListener}s; error notifications are also queued so a waiting
 * {@link #startLive} sees them.
 */
@Component
public class AvatarClient extends AbstractProtocolClient {

    private static final Logger LOG = LogManager.getLogger(AvatarClient.class);

    public static final String SERVICE = "avatar";

    private final AvatarProperties props;
    private final List<AvatarStatusListener> listeners;

    @Autowired
    public AvatarClient(TransportFactory transportFactory, AvatarProperties props,
                        ObjectProvider<AvatarStatusListener> listeners) {
        this(transportFactory, props, listeners.orderedStream().toList());
    }

    public AvatarClient(TransportFactory transportFactory, AvatarProperties props,
                        List<AvatarStatusListener> listeners) {
        super(transportFactory);
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public String serviceName() {
        return SERVICE;
    }

    @Override
    protected TransportRequest transportRequest() {
        AvatarProperties.ConnectStrategy first = props.getStrategies().get(0);
        return new TransportRequest(URI.create(props.getUrl()), Map.of(), first.isVerifySsl(),
                Duration.ofMillis(first.getTimeoutMs()));
    }

    /**
     * Tries each strategy in order and keeps the first socket that opens.
     *
     * @throws ConnectionException from the last strategy when every one fails
     */
    @Override
    protected void openTransport() {
        TransportRequest base = transportRequest();
        List<AvatarProperties.ConnectStrategy> strategies = props.getStrategies();
        ConnectionException last = null;
        for (int i = 0; i < strategies.size(); i++) {
            AvatarProperties.ConnectStrategy strategy = strategies.get(i);
            try {
                openWith(base.withTls(strategy.isVerifySsl(), Duration.ofMillis(strategy.getTimeoutMs())));
                LOG.info("Avatar socket opened with strategy {}/{} (verifySsl={}, timeout={}ms)",
                        i + 1, strategies.size(), strategy.isVerifySsl(), strategy.getTimeoutMs());
                return;
            } catch (ConnectionException e) {
                last = e;
                LOG.warn("Avatar connect strategy {}/{} failed (verifySsl={}, reason={}): {}",
                        i + 1, strategies.size(), strategy.isVerifySsl(), e.getReason(), e.getMessage());
                discardTransport();
                if (i < strategies.size() - 1) {
                    pause(Duration.ofMillis(props.getStrategyDelayMs()));
                }
            }
        }
        throw last;
    }

    @Override
    protected void doHandshake() {
        // ready once the socket is open
    }

    @Override
    protected void beforeClose() {
        if (boundId() == null) {
            return;
        }
        stopLive();
        pause(Duration.ofMillis(props.getStopGraceMs()));
    }

    @Override
    protected Duration healthTimeout() {
        return Duration.ofMillis(props.getHealthTimeoutMs());
    }

    @Override
    protected Duration closeTimeout() {
        return Duration.ofMillis(props.getCloseTimeoutMs());
    }

    @Override
    protected boolean handleUnsolicited(InboundMessage message) {
        if (!message.isText()) {
            return false;
        }
        AvatarMessage parsed = AvatarMessage.parse(message.text());
        if (parsed == null) {
            return false;
        }
        switch (parsed.tag()) {
            case HEARTBEAT:
                LOG.trace("Avatar heartbeat");
                return true;
            case STREAMING_AUDIO:
                JSONObject status = parsed.bodyAsJson();
                String type = status.optString("type", "unknown");
                JSONObject data = status.optJSONObject("data");
                LOG.debug("Avatar status event '{}' for live {}", type, boundId());
                for (AvatarStatusListener l : listeners) {
                    l.onStatus(boundId(), type, data == null ? new JSONObject() : data);
                }
                return true;
            case ERROR:
                JSONObject error = parsed.bodyAsJson();
                int code = error.optInt("code", -1);
                String text = error.optString("message", "");
                for (AvatarStatusListener l : listeners) {
                    l.onError(boundId(), code, text);
                }
                return false;
            default:
                return false;
        }
    }

    /**
     * Starts live streaming using the configured start-live timeout.
     *
     * @see #startLive(LiveRequest, Duration)
     */
    public JSONObject startLive(LiveRequest request) {
        return startLive(request, Duration.ofMillis(props.getStartLiveTimeoutMs()));
    }

    /**
     * Sends the start-live message and waits for its acknowledgment. On success the client is
     * bound to the request's live id.
     *
     * @return the acknowledgment body
     * @throws ConnectionException if not connected or the socket drops while waiting
     * @throws SessionException if the service answers with a non-success code or an error message
     * @throws OperationTimeoutException if no answer arrives within {@code timeout}
     */
    public JSONObject startLive(LiveRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request must not be null");
        requireConnected();
        drainInbox();
        long deadline = TimeUtils.deadlineAfter(timeout);
        sendText(AvatarMessage.json(AvatarTag.START_LIVE, request.toInitJson(props.getAppid(), props.getToken()))
                .encode());
        LOG.info("Avatar start-live sent: liveId={}, avatarType={}, role={}, target={}",
                request.liveId(), request.avatarType().wireName(), request.role(), request.target());

        while (true) {
            InboundMessage message = awaitInbound(deadline, "start-live acknowledgment", timeout);
            if (!message.isText()) {
                LOG.debug("Avatar ignoring binary message while waiting for start-live acknowledgment");
                continue;
            }
            AvatarMessage reply = AvatarMessage.parse(message.text());
            if (reply == null) {
                LOG.debug("Avatar ignoring '{}' while waiting for start-live acknowledgment",
                        LogSanitizer.truncate(message.text(), 80));
                continue;
            }
            JSONObject body = reply.bodyAsJson();
            if (reply.tag() == AvatarTag.ACK) {
                int code = body.optInt("code", -1);
                if (code != AvatarErrorCode.SUCCESS.code()) {
                    throw new SessionException("Avatar refused live " + request.liveId() + ": "
                            + body.optString("message", AvatarErrorCode.describe(code)), SERVICE, code);
                }
                bind(request.liveId());
                LOG.info("Avatar live {} started", request.liveId());
                return body;
            }
            if (reply.tag() == AvatarTag.ERROR) {
                int code = body.optInt("code", -1);
                throw new SessionException("Avatar error while starting live " + request.liveId() + ": "
                        + body.optString("message", AvatarErrorCode.describe(code)), SERVICE, code);
            }
        }
    }

    /** Streams raw audio bytes to the live avatar. */
    public void driveWithAudio(byte[] audio) {
        Objects.requireNonNull(audio, "audio must not be null");
        requireConnected();
        sendBinary(AvatarMessage.streamingAudio(audio));
    }

    /** Sends audio as base64 JSON, with optional extra data passed through to status events. */
    public void driveWithStructuredAudio(byte[] audio, String extraData) {
        Objects.requireNonNull(audio, "audio must not be null");
        requireConnected();
        sendText(AvatarMessage.structuredAudio(audio, extraData).encode());
    }

    /** Has the avatar fetch and play audio from a URL. */
    public void driveWithAudioUrl(String url, String format) {
        Objects.requireNonNull(url, "url must not be null");
        requireConnected();
        sendText(AvatarMessage.audioUrl(url, format == null ? "wav" : format).encode());
    }

    /** Marks the end of the current streamed utterance. */
    public void finishAudio() {
        requireConnected();
        sendText(AvatarMessage.control(AvatarTag.FINISH_AUDIO).encode());
    }

    /** Stops the utterance currently playing. */
    public void interrupt() {
        requireConnected();
        sendText(AvatarMessage.control(AvatarTag.INTERRUPT).encode());
    }

    /**
     * Stops the bound live stream. Best effort: send failures are logged and the binding is
     * always cleared.
     */
    public void stopLive() {
        String liveId = boundId();
        if (liveId == null) {
            LOG.debug("Avatar stop-live skipped, no live bound");
            return;
        }
        try {
            sendText(AvatarMessage.control(AvatarTag.STOP_LIVE).encode());
            LOG.info("Avatar stop-live sent for {}", liveId);
        } catch (ConnectionException e) {
            LOG.warn("Avatar stop-live for {} not sent: {}", liveId, e.getMessage());
        } finally {
            unbind();
        }
    }

    /** Whether the socket is up and bound to the given live id. */
    public boolean isBoundTo(String liveId) {
        return liveId != null && isConnected() && liveId.equals(boundId());
    }

    private void requireConnected() {
        if (!isConnected()) {
            throw new ConnectionException("Avatar client not connected", SERVICE, ConnectionException.Reason.CLOSED);
        }
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while connecting", SERVICE,
                    ConnectionException.Reason.TRANSPORT, e);
        }
    }
}
