package com.phillippitts.speaktoavatar.service.protocol;

import com.phillippitts.speaktoavatar.exception.ProtocolException;
import com.phillippitts.speaktoavatar.exception.RemoteServiceExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes the binary frame format shared by the TTS and STT sockets.
 *
 * <p>Optional block order is fixed: event, session id, sequence. All integers are 4-byte
 * big-endian signed values; strings and payloads are prefixed with their 4-byte length.
 *
 * <p>Which optional fields follow an event depends on the event:
 * <ul>
 *   <li>ConnectionStarted: connection id</li>
 *   <li>ConnectionFailed, ConnectionFinished: metadata string</li>
 *   <li>other connection-level events: nothing</li>
 *   <li>SessionStarted/Finished/Failed: session id, then metadata string</li>
 *   <li>everything else: session id</li>
 * </ul>
 * An error frame carries an error code instead of the optional block.
 *
 * <p>Thread-safe; holds no state.
 */
public final class FrameCodec {

    private static final Logger LOG = LogManager.getLogger(FrameCodec.class);

    private FrameCodec() {
    }

    /**
     * Serializes a frame. The payload is gzip-compressed when the header says so.
     *
     * @param frame frame to encode
     * @return wire bytes
     */
    public static byte[] encode(Frame frame) {
        FrameHeader header = frame.header();
        ByteArrayOutputStream out = new ByteArrayOutputStream(64 + frame.payloadSize());
        out.writeBytes(header.toBytes());
        // extended header words are zero-filled
        for (int i = FrameHeader.HEADER_UNIT_BYTES; i < header.sizeInBytes(); i++) {
            out.write(0);
        }

        if (header.messageType() == MessageType.ERROR) {
            writeInt(out, frame.errorCode() == null ? 0 : frame.errorCode());
        } else {
            if (MessageFlags.hasEvent(header.flags())) {
                int event = frame.event() == null ? ProtocolEvents.NONE : frame.event();
                writeInt(out, event);
                writeEventFields(out, event, frame);
            }
            if (MessageFlags.hasSequence(header.flags())) {
                writeInt(out, frame.sequence() == null ? 0 : frame.sequence());
            }
        }

        byte[] payload = frame.payload();
        if (payload != null) {
            byte[] body = header.compression() == Compression.GZIP ? GzipCodec.compress(payload) : payload;
            writeInt(out, body.length);
            out.writeBytes(body);
        }
        return out.toByteArray();
    }

    /**
     * Builds and encodes one audio-only request.
     *
     * <p>The supplied sequence is written as-is for intermediate chunks and negated for the
     * last chunk, whose flags also mark it as the last packet.
     *
     * @param sequence positive per-connection sequence number
     * @param isLast whether this is the final chunk of the stream
     * @param audio chunk bytes, gzip-compressed on the wire
     */
    public static byte[] encodeAudioChunk(int sequence, boolean isLast, byte[] audio) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive, got " + sequence);
        }
        int flags = isLast ? MessageFlags.NEG_SEQUENCE : MessageFlags.POS_SEQUENCE;
        Frame frame = Frame.builder(FrameHeader.of(MessageType.AUDIO_ONLY_REQUEST, flags,
                        Serialization.JSON, Compression.GZIP))
                .sequence(isLast ? -sequence : sequence)
                .payload(audio)
                .build();
        return encode(frame);
    }

    /**
     * Parses wire bytes into a frame.
     *
     * <p>A payload that cannot be decompressed does not fail decoding: the frame is returned
     * with an empty payload and {@link Frame#isPayloadCorrupt()} set. Audio responses are never
     * decompressed.
     *
     * @throws ProtocolException if the header is invalid or a length prefix points past the data
     */
    public static Frame decode(byte[] data) {
        if (data == null || data.length < FrameHeader.HEADER_UNIT_BYTES) {
            throw new ProtocolException("Frame shorter than header: " + (data == null ? 0 : data.length) + " bytes");
        }
        FrameHeader header = parseHeader(data);
        if (data.length < header.sizeInBytes()) {
            throw RemoteServiceExceptionBuilder.create("Frame shorter than declared header size")
                    .metadata("headerBytes", header.sizeInBytes())
                    .metadata("frameBytes", data.length)
                    .buildProtocol();
        }

        ByteBuffer buf = ByteBuffer.wrap(data);
        buf.position(header.sizeInBytes());
        Frame.Builder builder = Frame.builder(header);
        try {
            if (header.messageType() == MessageType.ERROR) {
                builder.errorCode(buf.getInt());
            } else {
                if (MessageFlags.hasEvent(header.flags())) {
                    int event = buf.getInt();
                    builder.event(event);
                    readEventFields(buf, event, builder);
                }
                if (MessageFlags.hasSequence(header.flags())) {
                    builder.sequence(buf.getInt());
                }
            }
            readPayload(buf, header, builder);
        } catch (BufferUnderflowException e) {
            throw RemoteServiceExceptionBuilder.create("Truncated frame")
                    .messageType(header.messageType())
                    .metadata("frameBytes", data.length)
                    .cause(e)
                    .buildProtocol();
        }
        return builder.build();
    }

    private static FrameHeader parseHeader(byte[] data) {
        try {
            return new FrameHeader(
                    (data[0] >> 4) & 0x0F,
                    data[0] & 0x0F,
                    MessageType.fromCode((data[1] >> 4) & 0x0F),
                    data[1] & 0x0F,
                    Serialization.fromCode((data[2] >> 4) & 0x0F),
                    Compression.fromCode(data[2] & 0x0F),
                    data[3] & 0xFF);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid frame header: " + e.getMessage(), e);
        }
    }

    private static void writeEventFields(ByteArrayOutputStream out, int event, Frame frame) {
        if (event == ProtocolEvents.CONNECTION_STARTED) {
            writeString(out, frame.connectionId());
        } else if (event == ProtocolEvents.CONNECTION_FAILED || event == ProtocolEvents.CONNECTION_FINISHED) {
            writeString(out, frame.responseMeta());
        } else if (ProtocolEvents.isConnectionLevel(event) || event == ProtocolEvents.NONE) {
            // no identifiers
        } else if (ProtocolEvents.isSessionStatus(event)) {
            writeString(out, frame.sessionId());
            writeString(out, frame.responseMeta());
        } else {
            writeString(out, frame.sessionId());
        }
    }

    private static void readEventFields(ByteBuffer buf, int event, Frame.Builder builder) {
        if (event == ProtocolEvents.CONNECTION_STARTED) {
            builder.connectionId(readString(buf));
        } else if (event == ProtocolEvents.CONNECTION_FAILED || event == ProtocolEvents.CONNECTION_FINISHED) {
            builder.responseMeta(readString(buf));
        } else if (ProtocolEvents.isConnectionLevel(event) || event == ProtocolEvents.NONE) {
            // no identifiers
        } else if (ProtocolEvents.isSessionStatus(event)) {
            builder.sessionId(readString(buf));
            builder.responseMeta(readString(buf));
        } else {
            builder.sessionId(readString(buf));
        }
    }

    private static void readPayload(ByteBuffer buf, FrameHeader header, Frame.Builder builder) {
        if (buf.remaining() < Integer.BYTES) {
            return;
        }
        int size = buf.getInt();
        if (size < 0 || size > buf.remaining()) {
            throw RemoteServiceExceptionBuilder.create("Payload length prefix out of range")
                    .messageType(header.messageType())
                    .metadata("declared", size)
                    .metadata("available", buf.remaining())
                    .buildProtocol();
        }
        byte[] body = new byte[size];
        buf.get(body);

        boolean compressed = header.compression() == Compression.GZIP
                && header.messageType() != MessageType.AUDIO_ONLY_RESPONSE
                && size > 0;
        if (!compressed) {
            builder.payload(body);
            return;
        }
        try {
            builder.payload(GzipCodec.decompress(body));
        } catch (IOException e) {
            LOG.warn("Could not decompress {} payload of {} bytes: {}", header.messageType(), size, e.getMessage());
            builder.corruptPayload();
        }
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static void writeString(ByteArrayOutputStream out, String value) {
        byte[] bytes = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
        writeInt(out, bytes.length);
        out.writeBytes(bytes);
    }

    private static String readString(ByteBuffer buf) {
        int size = buf.getInt();
        if (size < 0 || size > buf.remaining()) {
            throw new ProtocolException("String length prefix out of range: " + size
                    + " (available " + buf.remaining() + ")");
        }
        byte[] bytes = new byte[size];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
