package com.phillippitts.speaktoavatar.service.protocol;

import com.phillippitts.speaktoavatar.exception.ProtocolException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecTest {

    @Test
    void encodesFourByteHeaderWithVersionAndSize() {
        byte[] bytes = FrameCodec.encode(Frame.builder(FrameHeader.of(MessageType.FULL_CLIENT_REQUEST,
                MessageFlags.WITH_EVENT, Serialization.JSON, Compression.NONE))
                .event(ProtocolEvents.START_CONNECTION)
                .jsonPayload(new JSONObject())
                .build());

        assertThat(bytes[0]).isEqualTo((byte) 0x11);
        assertThat(bytes[1]).isEqualTo((byte) 0x14);
        assertThat(bytes[2]).isEqualTo((byte) 0x10);
        assertThat(bytes[3]).isEqualTo((byte) 0x00);
        // event, then payload length and "{}"
        assertThat(Arrays.copyOfRange(bytes, 4, 8)).containsExactly(0, 0, 0, 1);
        assertThat(Arrays.copyOfRange(bytes, 8, 12)).containsExactly(0, 0, 0, 2);
        assertThat(new String(Arrays.copyOfRange(bytes, 12, 14), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void sessionEventCarriesSessionIdBeforePayload() {
        Frame frame = Frame.builder(FrameHeader.of(MessageType.FULL_CLIENT_REQUEST, MessageFlags.WITH_EVENT,
                        Serialization.JSON, Compression.NONE))
                .event(ProtocolEvents.TASK_REQUEST)
                .sessionId("s-1")
                .jsonPayload(new JSONObject().put("text", "hi"))
                .build();

        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.event()).isEqualTo(ProtocolEvents.TASK_REQUEST);
        assertThat(decoded.sessionId()).isEqualTo("s-1");
        assertThat(decoded.payloadAsJson().getString("text")).isEqualTo("hi");
    }

    @Test
    void connectionStartedCarriesConnectionIdOnly() {
        Frame frame = Frame.builder(FrameHeader.of(MessageType.FULL_SERVER_RESPONSE, MessageFlags.WITH_EVENT,
                        Serialization.JSON, Compression.NONE))
                .event(ProtocolEvents.CONNECTION_STARTED)
                .connectionId("conn-9")
                .build();

        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.connectionId()).isEqualTo("conn-9");
        assertThat(decoded.sessionId()).isNull();
    }

    @Test
    void sessionStatusCarriesSessionIdAndMetadata() {
        Frame frame = Frame.builder(FrameHeader.of(MessageType.FULL_SERVER_RESPONSE, MessageFlags.WITH_EVENT,
                        Serialization.JSON, Compression.NONE))
                .event(ProtocolEvents.SESSION_FAILED)
                .sessionId("s-2")
                .responseMeta("{\"status_code\":1}")
                .build();

        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.sessionId()).isEqualTo("s-2");
        assertThat(decoded.responseMeta()).isEqualTo("{\"status_code\":1}");
    }

    @Test
    void lastAudioChunkNegatesSequence() {
        byte[] audio = {1, 2, 3};

        Frame middle = FrameCodec.decode(FrameCodec.encodeAudioChunk(4, false, audio));
        Frame last = FrameCodec.decode(FrameCodec.encodeAudioChunk(5, true, audio));

        assertThat(middle.sequence()).isEqualTo(4);
        assertThat(middle.flags()).isEqualTo(MessageFlags.POS_SEQUENCE);
        assertThat(middle.isLastPacket()).isFalse();
        assertThat(last.sequence()).isEqualTo(-5);
        assertThat(last.flags()).isEqualTo(MessageFlags.NEG_SEQUENCE);
        assertThat(last.isLastPacket()).isTrue();
        assertThat(last.payload()).containsExactly(1, 2, 3);
    }

    @Test
    void rejectsNonPositiveSequence() {
        assertThatThrownBy(() -> FrameCodec.encodeAudioChunk(0, false, new byte[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void errorFrameCarriesCodeInsteadOfOptionalFields() {
        Frame frame = Frame.builder(FrameHeader.of(MessageType.ERROR, MessageFlags.NONE,
                        Serialization.JSON, Compression.NONE))
                .errorCode(45000000)
                .jsonPayload(new JSONObject().put("error", "quota"))
                .build();

        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.messageType()).isEqualTo(MessageType.ERROR);
        assertThat(decoded.errorCode()).isEqualTo(45000000);
        assertThat(decoded.payloadAsString()).contains("quota");
    }

    @Test
    void gzipPayloadIsTransparentlyDecompressed() {
        Frame frame = Frame.builder(FrameHeader.of(MessageType.FULL_SERVER_RESPONSE, MessageFlags.POS_SEQUENCE,
                        Serialization.JSON, Compression.GZIP))
                .sequence(1)
                .jsonPayload(new JSONObject().put("result", new JSONObject().put("text", "你好")))
                .build();

        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.payloadAsJson().getJSONObject("result").getString("text")).isEqualTo("你好");
    }

    @Test
    void corruptGzipPayloadIsFlaggedNotThrown() {
        byte[] header = FrameHeader.of(MessageType.FULL_SERVER_RESPONSE, MessageFlags.NONE,
                Serialization.JSON, Compression.GZIP).toBytes();
        byte[] bytes = new byte[header.length + 4 + 3];
        System.arraycopy(header, 0, bytes, 0, header.length);
        bytes[header.length + 3] = 3;
        bytes[header.length + 4] = 'b';
        bytes[header.length + 5] = 'a';
        bytes[header.length + 6] = 'd';

        Frame decoded = FrameCodec.decode(bytes);

        assertThat(decoded.isPayloadCorrupt()).isTrue();
        assertThat(decoded.payloadSize()).isZero();
    }

    @Test
    void audioResponsesAreNeverDecompressed() {
        byte[] raw = {9, 8, 7};
        Frame frame = Frame.builder(FrameHeader.of(MessageType.AUDIO_ONLY_RESPONSE, MessageFlags.WITH_EVENT,
                        Serialization.NONE, Compression.GZIP))
                .event(ProtocolEvents.TTS_RESPONSE)
                .sessionId("s")
                .payload(raw)
                .build();

        // the encoder compresses, so the decoder hands back the compressed bytes untouched
        Frame decoded = FrameCodec.decode(FrameCodec.encode(frame));

        assertThat(decoded.isPayloadCorrupt()).isFalse();
        assertThat(decoded.payload()).isEqualTo(GzipCodec.compress(raw));
    }

    @Test
    void rejectsFrameShorterThanHeader() {
        assertThatThrownBy(() -> FrameCodec.decode(new byte[]{0x11, 0x14}))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("shorter than header");
    }

    @Test
    void rejectsUnknownMessageType() {
        assertThatThrownBy(() -> FrameCodec.decode(new byte[]{0x11, 0x30, 0x10, 0x00}))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Invalid frame header");
    }

    @Test
    void rejectsPayloadLengthPastEndOfFrame() {
        byte[] bytes = {0x11, (byte) 0x90, 0x10, 0x00, 0, 0, 0, 50, 1, 2};

        assertThatThrownBy(() -> FrameCodec.decode(bytes))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void rejectsTruncatedOptionalFields() {
        byte[] bytes = {0x11, (byte) 0x94, 0x10, 0x00, 0, 0};

        assertThatThrownBy(() -> FrameCodec.decode(bytes))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void frameWithoutPayloadBlockDecodesToNullPayload() {
        Frame decoded = FrameCodec.decode(new byte[]{0x11, (byte) 0x90, 0x10, 0x00});

        assertThat(decoded.payload()).isNull();
        assertThat(decoded.payloadAsJson().isEmpty()).isTrue();
    }
}
