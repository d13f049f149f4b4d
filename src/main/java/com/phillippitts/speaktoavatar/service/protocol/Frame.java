package com.phillippitts.speaktoavatar.service.protocol;

import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One binary wire message: header, optional block and an uncompressed payload.
 *
 * <p>Compression is a property of the encoded form only; {@link #payload()} always holds the
 * plain bytes. When a received payload could not be decompressed the frame carries an empty
 * payload and {@link #isPayloadCorrupt()} returns true.
 */
public final class Frame {

    private static final byte[] EMPTY = new byte[0];

    private final FrameHeader header;
    private final Integer event;
    private final String sessionId;
    private final Integer sequence;
    private final String connectionId;
    private final Integer errorCode;
    private final String responseMeta;
    private final byte[] payload;
    private final boolean payloadCorrupt;

    private Frame(Builder b) {
        this.header = b.header;
        this.event = b.event;
        this.sessionId = b.sessionId;
        this.sequence = b.sequence;
        this.connectionId = b.connectionId;
        this.errorCode = b.errorCode;
        this.responseMeta = b.responseMeta;
        this.payload = b.payload;
        this.payloadCorrupt = b.payloadCorrupt;
    }

    public static Builder builder(FrameHeader header) {
        return new Builder(header);
    }

    public FrameHeader header() {
        return header;
    }

    public MessageType messageType() {
        return header.messageType();
    }

    public int flags() {
        return header.flags();
    }

    /** Event code, or null when the frame carries none. */
    public Integer event() {
        return event;
    }

    public boolean hasEvent(int code) {
        return event != null && event == code;
    }

    public String sessionId() {
        return sessionId;
    }

    public Integer sequence() {
        return sequence;
    }

    public String connectionId() {
        return connectionId;
    }

    public Integer errorCode() {
        return errorCode;
    }

    public String responseMeta() {
        return responseMeta;
    }

    /** Uncompressed payload bytes, or null when the frame had no payload block. */
    public byte[] payload() {
        return payload;
    }

    public int payloadSize() {
        return payload == null ? 0 : payload.length;
    }

    public boolean isPayloadCorrupt() {
        return payloadCorrupt;
    }

    /** True when the flags mark the last packet or the sequence is negative. */
    public boolean isLastPacket() {
        return MessageFlags.isLastPacket(header.flags()) || (sequence != null && sequence < 0);
    }

    public String payloadAsString() {
        return payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * Parses the payload as a JSON object.
     *
     * @return the object, or an empty object when the payload is absent or not a JSON object
     */
    public JSONObject payloadAsJson() {
        if (payload == null || payload.length == 0) {
            return new JSONObject();
        }
        try {
            return new JSONObject(payloadAsString());
        } catch (JSONException e) {
            return new JSONObject();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return payloadCorrupt == other.payloadCorrupt
                && header.equals(other.header)
                && Objects.equals(event, other.event)
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(sequence, other.sequence)
                && Objects.equals(connectionId, other.connectionId)
                && Objects.equals(errorCode, other.errorCode)
                && Objects.equals(responseMeta, other.responseMeta)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(header, event, sessionId, sequence, connectionId, errorCode, responseMeta,
                payloadCorrupt);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame{" + header.messageType()
                + ", flags=0b" + Integer.toBinaryString(header.flags())
                + (event != null ? ", event=" + ProtocolEvents.name(event) : "")
                + (sessionId != null ? ", sessionId=" + sessionId : "")
                + (sequence != null ? ", sequence=" + sequence : "")
                + (errorCode != null ? ", errorCode=" + errorCode : "")
                + ", payloadBytes=" + payloadSize()
                + (payloadCorrupt ? ", corrupt" : "")
                + "}";
    }

    /**
     * Builder for outbound and decoded frames.
     */
    public static final class Builder {
        private final FrameHeader header;
        private Integer event;
        private String sessionId;
        private Integer sequence;
        private String connectionId;
        private Integer errorCode;
        private String responseMeta;
        private byte[] payload;
        private boolean payloadCorrupt;

        private Builder(FrameHeader header) {
            this.header = Objects.requireNonNull(header, "header must not be null");
        }

        public Builder event(Integer event) {
            this.event = event;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sequence(Integer sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder connectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder errorCode(Integer errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder responseMeta(String responseMeta) {
            this.responseMeta = responseMeta;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder jsonPayload(JSONObject json) {
            this.payload = json == null ? null : json.toString().getBytes(StandardCharsets.UTF_8);
            return this;
        }

        Builder corruptPayload() {
            this.payload = EMPTY;
            this.payloadCorrupt = true;
            return this;
        }

        public Frame build() {
            return new Frame(this);
        }
    }
}
