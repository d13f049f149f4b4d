package com.phillippitts.speaktoavatar.exception;

/**
 * Thrown when a remote service cannot be reached or its connection handshake fails.
 *
 * <p>The {@link Reason} separates timeouts and TLS failures from plain transport errors
 * so the coordinator can decide whether a retry is worthwhile.
 */
public class ConnectionException extends SpeakToAvatarException {

    /** What went wrong while establishing or using the connection. */
    public enum Reason {
        HANDSHAKE,
        TIMEOUT,
        TLS,
        CLOSED,
        TRANSPORT
    }

    private final String service;
    private final Reason reason;

    public ConnectionException(String message, String service, Reason reason) {
        super(message + " (service: " + service + ", reason: " + reason + ")");
        this.service = service;
        this.reason = reason;
    }

    public ConnectionException(String message, String service, Reason reason, Throwable cause) {
        super(message + " (service: " + service + ", reason: " + reason + ")", cause);
        this.service = service;
        this.reason = reason;
    }

    public String getService() {
        return service;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isTimeout() {
        return reason == Reason.TIMEOUT;
    }
}
