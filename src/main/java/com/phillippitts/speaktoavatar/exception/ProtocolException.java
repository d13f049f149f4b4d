package com.phillippitts.speaktoavatar.exception;

/**
 * Thrown when a frame is malformed, cannot be decompressed, or arrives out of place
 * in the connection/session event sequence.
 */
public class ProtocolException extends SpeakToAvatarException {

    private final Integer errorCode;

    public ProtocolException(String message) {
        super(message);
        this.errorCode = null;
    }

    public ProtocolException(String message, Integer errorCode) {
        super(errorCode == null ? message : message + " (code: " + errorCode + ")");
        this.errorCode = errorCode;
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
    }

    /** Remote error code when the server sent one, otherwise null. */
    public Integer getErrorCode() {
        return errorCode;
    }
}
