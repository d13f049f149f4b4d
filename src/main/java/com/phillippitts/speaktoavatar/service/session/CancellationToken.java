package com.phillippitts.speaktoavatar.service.session;

import com.phillippitts.speaktoavatar.exception.StreamCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-writer, many-reader cancellation flag passed explicitly through every pipeline stage.
 * Stages poll it at their suspension points; nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Trips the flag.
     *
     * @return true if this call tripped it, false if it was already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws StreamCancelledException if the flag is set
     */
    public void throwIfCancelled(String sessionId) {
        if (cancelled.get()) {
            throw new StreamCancelledException(sessionId);
        }
    }
}
