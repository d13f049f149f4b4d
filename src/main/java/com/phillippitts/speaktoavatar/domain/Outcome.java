package com.phillippitts.speaktoavatar.domain;

import java.util.Objects;

/**
 * Result of one attempt at a remote operation, keeping cancellation apart from failure so
 * retry loops never retry a cancelled attempt.
 *
 * @param status what happened
 * @param value  result when {@link Status#SUCCEEDED}, otherwise null
 * @param error  cause when {@link Status#FAILED}, otherwise null
 * @param <T>    result type
 */
public record Outcome<T>(Status status, T value, RuntimeException error) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public Outcome {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("failed outcome requires an error");
        }
    }

    public static <T> Outcome<T> succeeded(T value) {
        return new Outcome<>(Status.SUCCEEDED, value, null);
    }

    public static <T> Outcome<T> failed(RuntimeException error) {
        return new Outcome<>(Status.FAILED, null, error);
    }

    public static <T> Outcome<T> cancelled() {
        return new Outcome<>(Status.CANCELLED, null, null);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
