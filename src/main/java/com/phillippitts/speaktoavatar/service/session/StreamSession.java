package com.phillippitts.speaktoavatar.service.session;

import java.time.Instant;
import java.util.Objects;

/**
 * One query's execution through the pipeline.
 *
 * @param sessionId unique id of the execution
 * @param roomId    room whose avatar the execution drives, or null
 * @param token     cancellation flag polled by every stage
 * @param createdAt registration time
 */
public record StreamSession(String sessionId, String roomId, CancellationToken token, Instant createdAt) {

    public StreamSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public boolean hasRoom() {
        return roomId != null;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    // identity equality: a replaced execution never equals its successor
    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
}
