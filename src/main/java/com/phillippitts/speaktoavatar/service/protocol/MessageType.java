package com.phillippitts.speaktoavatar.service.protocol;

/**
 * Four-bit message type carried in the high nibble of header byte 1.
 */
public enum MessageType {
    FULL_CLIENT_REQUEST(0b0001),
    AUDIO_ONLY_REQUEST(0b0010),
    FULL_SERVER_RESPONSE(0b1001),
    AUDIO_ONLY_RESPONSE(0b1011),
    ERROR(0b1111);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a wire value.
     *
     * @throws IllegalArgumentException if the nibble is not a known message type
     */
    public static MessageType fromCode(int code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: 0b" + Integer.toBinaryString(code));
    }
}
