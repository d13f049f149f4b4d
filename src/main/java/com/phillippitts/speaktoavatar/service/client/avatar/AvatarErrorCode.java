package com.phillippitts.speaktoavatar.service.client.avatar;

/** Result codes carried in avatar acknowledgment and error messages. */
public enum AvatarErrorCode {
    SUCCESS(1000, "success"),
    REQUEST_ERROR(4000, "request error"),
    AUTH_ERROR(4001, "authentication error"),
    CONCURRENCY_LIMIT(4002, "concurrency limit exceeded"),
    TOO_MANY_CONNECTIONS(4003, "too many connections"),
    LIVE_ID_DUPLICATE(4004, "live id duplicate"),
    RTMP_ADDRESS_DUPLICATE(4005, "rtmp address duplicate"),
    LIVE_NOT_FOUND(4006, "live session not found"),
    INVALID_INTERRUPT(4007, "invalid interrupt"),
    LIVE_INTERNAL_ERROR(5000, "live service internal error"),
    AVATAR_INTERNAL_ERROR(5001, "avatar service internal error"),
    SERVER_BUSY(5002, "server busy");

    private final int code;
    private final String description;

    AvatarErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public static String describe(int code) {
        for (AvatarErrorCode c : values()) {
            if (c.code == code) {
                return c.description;
            }
        }
        return "unknown error";
    }
}
