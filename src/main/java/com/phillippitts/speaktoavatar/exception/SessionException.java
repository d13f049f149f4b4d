package com.phillippitts.speaktoavatar.exception;

/**
 * Thrown when a remote service rejects starting, driving or finishing a session
 * (a TTS session, a recognition stream or an avatar live).
 */
public class SessionException extends SpeakToAvatarException {

    private final String service;
    private final int remoteCode;

    public SessionException(String message, String service, int remoteCode) {
        super(message + " (service: " + service + ", code: " + remoteCode + ")");
        this.service = service;
        this.remoteCode = remoteCode;
    }

    public String getService() {
        return service;
    }

    public int getRemoteCode() {
        return remoteCode;
    }
}
