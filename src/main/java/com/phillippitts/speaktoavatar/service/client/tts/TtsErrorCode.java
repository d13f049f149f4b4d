package com.phillippitts.speaktoavatar.service.client.tts;

/** Error codes reported by the TTS service in error frames and failure metadata. */
public enum TtsErrorCode {
    SUCCESS(20_000_000, "success"),
    CLIENT_ERROR(45_000_000, "client error"),
    INVALID_PARAMS(45_000_001, "invalid request parameters"),
    SERVER_ERROR(55_000_000, "server error"),
    SESSION_ERROR(55_000_001, "session error");

    private final int code;
    private final String description;

    TtsErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    /** Human-readable text for a code, including codes not listed here. */
    public static String describe(int code) {
        for (TtsErrorCode c : values()) {
            if (c.code == code) {
                return c.description;
            }
        }
        return "unknown error";
    }
}
