package com.phillippitts.speaktoavatar.service.pipeline;

import com.phillippitts.speaktoavatar.config.properties.PipelineProperties;
import com.phillippitts.speaktoavatar.config.properties.TtsProperties;
import com.phillippitts.speaktoavatar.domain.Outcome;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.service.client.tts.SynthesisResult;
import com.phillippitts.speaktoavatar.service.client.tts.TtsClient;
import com.phillippitts.speaktoavatar.service.metrics.PipelineMetrics;
import com.phillippitts.speaktoavatar.service.protocol.Frame;
import com.phillippitts.speaktoavatar.service.protocol.FrameCodec;
import com.phillippitts.speaktoavatar.service.protocol.ProtocolEvents;
import com.phillippitts.speaktoavatar.service.session.CancellationToken;
import com.phillippitts.speaktoavatar.testutil.FakeTtsServer;
import com.phillippitts.speaktoavatar.testutil.InMemoryTransport;
import com.phillippitts.speaktoavatar.testutil.ScriptedTransportFactory;
import com.phillippitts.speaktoavatar.testutil.ServerFrames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisServiceTest {

    private TtsProperties ttsProps;
    private PipelineProperties props;
    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        ttsProps = new TtsProperties();
        ttsProps.setConnectTimeoutMs(500);
        ttsProps.setSessionTimeoutMs(200);
        ttsProps.setReceiveTimeoutMs(200);
        ttsProps.setCloseTimeoutMs(200);
        props = new PipelineProperties();
        props.setTtsMaxAttempts(3);
        props.setTtsRetryDelayMs(0);
        props.setTtsReconnectSettleMs(0);
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void connectsLazilyAndDeliversAudio() {
        ScriptedTransportFactory factory = new ScriptedTransportFactory(new FakeTtsServer(2));
        TtsClient tts = new TtsClient(factory, ttsProps);
        SynthesisService service = new SynthesisService(tts, props, metrics);
        List<Integer> chunks = new ArrayList<>();

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, new CancellationToken(),
                (chunk, index) -> chunks.add(index));

        assertThat(outcome.isSucceeded()).isTrue();
        assertThat(outcome.value().chunks()).isEqualTo(2);
        assertThat(chunks).containsExactly(0, 1);
        assertThat(tts.isConnected()).isTrue();
        assertThat(registry.get("speaktoavatar.synthesis.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void retriesUpToMaxAttemptsThenFails() {
        FakeTtsServer server = new FakeTtsServer(1).failSessions();
        ScriptedTransportFactory factory = new ScriptedTransportFactory(server);
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, new CancellationToken(),
                (chunk, index) -> { });

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isInstanceOf(SessionException.class);
        assertThat(startSessions(factory)).isEqualTo(3);
        assertThat(registry.get("speaktoavatar.synthesis.failure").tag("reason", "session").counter().count())
                .isEqualTo(3.0);
    }

    @Test
    void emptyAudioCountsAsFailure() {
        ScriptedTransportFactory factory = new ScriptedTransportFactory(new FakeTtsServer(0));
        props.setTtsMaxAttempts(2);
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, new CancellationToken(),
                (chunk, index) -> { });

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isInstanceOf(ProtocolException.class);
        assertThat(startSessions(factory)).isEqualTo(2);
    }

    @Test
    void doesNotRetryAfterAudioWasDelivered() {
        ScriptedTransportFactory factory = new ScriptedTransportFactory(new ScriptedTransportFactory.Responder() {
            @Override
            public void onBinary(InMemoryTransport transport, byte[] data) {
                Frame frame = FrameCodec.decode(data);
                if (frame.hasEvent(ProtocolEvents.START_CONNECTION)) {
                    transport.pushBinary(ServerFrames.connectionStarted("c"));
                } else if (frame.hasEvent(ProtocolEvents.START_SESSION)) {
                    transport.pushBinary(ServerFrames.sessionStarted(frame.sessionId()));
                } else if (frame.hasEvent(ProtocolEvents.FINISH_SESSION)) {
                    transport.pushBinary(ServerFrames.audio(frame.sessionId(), new byte[]{1}));
                    transport.pushBinary(ServerFrames.error(55000000, "died"));
                }
            }
        });
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);
        List<Integer> chunks = new ArrayList<>();

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, new CancellationToken(),
                (chunk, index) -> chunks.add(index));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(chunks).containsExactly(0);
        assertThat(startSessions(factory)).isEqualTo(1);
    }

    @Test
    void reconnectsAfterTimeoutDroppedTheConnection() {
        FakeTtsServer server = new FakeTtsServer(1).goSilent();
        ScriptedTransportFactory factory = new ScriptedTransportFactory(server);
        props.setTtsMaxAttempts(2);
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, new CancellationToken(),
                (chunk, index) -> { });

        assertThat(outcome.error()).isInstanceOf(OperationTimeoutException.class);
        assertThat(factory.created()).hasSize(2);
        assertThat(registry.get("speaktoavatar.synthesis.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void cancelledTokenSkipsEverything() {
        ScriptedTransportFactory factory = new ScriptedTransportFactory(new FakeTtsServer(1));
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);
        CancellationToken token = new CancellationToken();
        token.cancel();

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, token, (chunk, index) -> { });

        assertThat(outcome.isCancelled()).isTrue();
        assertThat(factory.created()).isEmpty();
    }

    @Test
    void cancellationDuringAudioIsReportedAsCancelled() {
        ScriptedTransportFactory factory = new ScriptedTransportFactory(new FakeTtsServer(3));
        SynthesisService service = new SynthesisService(new TtsClient(factory, ttsProps), props, metrics);
        CancellationToken token = new CancellationToken();

        Outcome<SynthesisResult> outcome = service.synthesize("Hello.", null, token, (chunk, index) -> token.cancel());

        assertThat(outcome.isCancelled()).isTrue();
    }

    @Test
    void classifiesFailureReasons() {
        assertThat(SynthesisService.failureReason(new ConnectionException("x", "tts",
                ConnectionException.Reason.TIMEOUT))).isEqualTo("timeout");
        assertThat(SynthesisService.failureReason(new ConnectionException("x", "tts",
                ConnectionException.Reason.CLOSED))).isEqualTo("connection");
        assertThat(SynthesisService.failureReason(new ProtocolException("x"))).isEqualTo("protocol");
        assertThat(SynthesisService.failureReason(new IllegalStateException("x"))).isEqualTo("error");
    }

    private static long startSessions(ScriptedTransportFactory factory) {
        return factory.created().stream()
                .flatMap(t -> t.sentBinary().stream())
                .map(FrameCodec::decode)
                .filter(f -> f.hasEvent(ProtocolEvents.START_SESSION))
                .count();
    }
}
