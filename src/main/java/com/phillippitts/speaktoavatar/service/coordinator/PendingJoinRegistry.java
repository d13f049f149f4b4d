package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * At most one in-flight join per room. A caller reserves the room before doing any work and
 * completes the reservation in a finally block.
 */
@Component
public class PendingJoinRegistry {

    private final Map<String, PendingJoin> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    public PendingJoinRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Claims the room for one join.
     *
     * @throws ConcurrencyRejectedException if a join for the room is already in flight
     */
    public PendingJoin reserve(String roomId) {
        PendingJoin join = new PendingJoin(roomId, clock.instant());
        if (pending.putIfAbsent(roomId, join) != null) {
            throw ConcurrencyRejectedException.pending(roomId);
        }
        return join;
    }

    public boolean isPending(String roomId) {
        return pending.containsKey(roomId);
    }

    /** Releases the reservation if it is still the current one for its room. */
    public void complete(PendingJoin join) {
        pending.remove(join.roomId(), join);
    }

    /**
     * Cancels and removes the room's in-flight join.
     *
     * @return true if there was one
     */
    public boolean cancel(String roomId) {
        PendingJoin join = pending.remove(roomId);
        if (join == null) {
            return false;
        }
        join.cancel();
        return true;
    }

    /**
     * @return number of joins cancelled
     */
    public int cancelAll() {
        int count = 0;
        for (String roomId : Set.copyOf(pending.keySet())) {
            if (cancel(roomId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Drops reservations whose work has finished but whose owner never completed them.
     *
     * @return number dropped
     */
    public int sweepCompleted() {
        int before = pending.size();
        pending.values().removeIf(PendingJoin::isDone);
        return Math.max(0, before - pending.size());
    }

    public Set<String> rooms() {
        return new TreeSet<>(pending.keySet());
    }

    /** Handle of one in-flight join. */
    public static final class PendingJoin {

        private final String roomId;
        private final Instant startedAt;
        private volatile Future<?> work;
        private volatile boolean cancelled;

        PendingJoin(String roomId, Instant startedAt) {
            this.roomId = roomId;
            this.startedAt = startedAt;
        }

        public String roomId() {
            return roomId;
        }

        public Instant startedAt() {
            return startedAt;
        }

        /** Links the running work. Work attached after a cancel is cancelled at once. */
        public void attach(Future<?> future) {
            this.work = future;
            if (cancelled) {
                future.cancel(true);
            }
        }

        public boolean isCancelled() {
            return cancelled;
        }

        boolean isDone() {
            Future<?> f = work;
            return f != null && f.isDone();
        }

        void cancel() {
            cancelled = true;
            Future<?> f = work;
            if (f != null) {
                f.cancel(true);
            }
        }
    }
}
