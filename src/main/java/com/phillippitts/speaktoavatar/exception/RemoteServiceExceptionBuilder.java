package com.phillippitts.speaktoavatar.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for connection and protocol failures raised by the WebSocket clients.
 *
 * <p>Keeps the message format identical across the TTS, STT and avatar clients:
 * <pre>
 * {message} (event={event}, messageType={type}, {key1}={val1}, ...)
 * </pre>
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw RemoteServiceExceptionBuilder.create("Unexpected handshake reply")
 *         .service("tts")
 *         .event(frame.event())
 *         .metadata("payloadSize", frame.payload().length)
 *         .buildProtocol();
 * </pre>
 */
public final class RemoteServiceExceptionBuilder {

    private final String message;
    private String service;
    private Throwable cause;
    private Integer event;
    private Integer errorCode;
    private String messageType;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RemoteServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RemoteServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RemoteServiceExceptionBuilder(message);
    }

    public RemoteServiceExceptionBuilder service(String service) {
        this.service = service;
        return this;
    }

    public RemoteServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Protocol event code carried by the offending frame, if any. */
    public RemoteServiceExceptionBuilder event(Integer event) {
        this.event = event;
        return this;
    }

    /** Error code sent by the remote service, if any. */
    public RemoteServiceExceptionBuilder errorCode(Integer errorCode) {
        this.errorCode = errorCode;
        return this;
    }

    public RemoteServiceExceptionBuilder messageType(Object messageType) {
        this.messageType = messageType == null ? null : String.valueOf(messageType);
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public RemoteServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds a {@link ProtocolException} carrying the remote error code when one was set.
     */
    public ProtocolException buildProtocol() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new ProtocolException(detailed, cause);
        }
        return new ProtocolException(detailed, errorCode);
    }

    /**
     * Builds a {@link ConnectionException} for the configured service.
     *
     * @param reason failure category
     */
    public ConnectionException buildConnection(ConnectionException.Reason reason) {
        String detailed = buildDetailedMessage();
        String svc = service != null ? service : "unknown";
        if (cause != null) {
            return new ConnectionException(detailed, svc, reason, cause);
        }
        return new ConnectionException(detailed, svc, reason);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (service != null) {
            details.put("service", service);
        }
        if (event != null) {
            details.put("event", String.valueOf(event));
        }
        if (messageType != null) {
            details.put("messageType", messageType);
        }
        if (errorCode != null && cause != null) {
            details.put("errorCode", String.valueOf(errorCode));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
