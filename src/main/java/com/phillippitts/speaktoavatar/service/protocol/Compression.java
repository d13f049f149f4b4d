package com.phillippitts.speaktoavatar.service.protocol;

/** Payload compression method (low nibble of header byte 2). */
public enum Compression {
    NONE(0),
    GZIP(1);

    private final int code;

    Compression(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Compression fromCode(int code) {
        for (Compression c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown compression method: " + code);
    }
}
