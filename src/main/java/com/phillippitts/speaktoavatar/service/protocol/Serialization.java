package com.phillippitts.speaktoavatar.service.protocol;

/** Payload serialization method (high nibble of header byte 2). */
public enum Serialization {
    NONE(0),
    JSON(1);

    private final int code;

    Serialization(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Serialization fromCode(int code) {
        for (Serialization s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown serialization method: " + code);
    }
}
