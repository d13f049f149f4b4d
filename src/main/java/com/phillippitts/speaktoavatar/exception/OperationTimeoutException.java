package com.phillippitts.speaktoavatar.exception;

import java.time.Duration;

/**
 * Thrown when a bounded wait (handshake ack, pong, start-live ack, overall join) runs out.
 */
public class OperationTimeoutException extends SpeakToAvatarException {

    private final String operation;
    private final Duration bound;

    public OperationTimeoutException(String operation, Duration bound) {
        super(operation + " timed out after " + bound.toMillis() + "ms");
        this.operation = operation;
        this.bound = bound;
    }

    public OperationTimeoutException(String operation, Duration bound, Throwable cause) {
        super(operation + " timed out after " + bound.toMillis() + "ms", cause);
        this.operation = operation;
        this.bound = bound;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getBound() {
        return bound;
    }
}
