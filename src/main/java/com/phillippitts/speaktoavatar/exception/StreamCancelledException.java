package com.phillippitts.speaktoavatar.exception;

/**
 * Thrown when a cooperative cancellation is observed. Never retried and never counted
 * as a failure that activates a cooldown.
 */
public class StreamCancelledException extends SpeakToAvatarException {

    private final String sessionId;

    public StreamCancelledException(String sessionId) {
        this("Stream cancelled (session: " + sessionId + ")", sessionId);
    }

    private StreamCancelledException(String message, String sessionId) {
        super(message);
        this.sessionId = sessionId;
    }

    /** A pending room join was called off by a leave or reset. */
    public static StreamCancelledException joinCancelled(String roomId) {
        return new StreamCancelledException("Join cancelled (room: " + roomId + ")", null);
    }

    public String getSessionId() {
        return sessionId;
    }
}
