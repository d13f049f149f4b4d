package com.phillippitts.speaktoavatar.exception;

/**
 * Base exception for all speakToAvatar application-specific errors.
 * All domain exceptions extend this class so the REST boundary can translate them in one place.
 */
public class SpeakToAvatarException extends RuntimeException {

    public SpeakToAvatarException(String message) {
        super(message);
    }

    public SpeakToAvatarException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakToAvatarException(Throwable cause) {
        super(cause);
    }
}
