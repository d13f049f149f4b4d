package com.phillippitts.speaktoavatar.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks in-flight pipeline executions by session id and by room id.
 *
 * <p>Both indices are mutated together under one lock, so a session id is in the room index
 * exactly when it is in the session table. Empty room entries are pruned.
 *
 * <p><b>Thread Safety:</b> all methods are safe to call from any thread.
 */
@Component
public class StreamSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(StreamSessionRegistry.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StreamSession> sessions = new HashMap<>();
    private final Map<String, Set<String>> sessionsByRoom = new HashMap<>();

    public StreamSessionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers a new execution. A blank session id gets a generated one. If an execution with
     * the same id is still registered it is cancelled and replaced.
     *
     * @param sessionId requested id, may be null
     * @param roomId    room to index under, may be null
     * @return the registered session; the caller must pass it to {@link #release(StreamSession)}
     */
    public StreamSession register(String sessionId, String roomId) {
        String id = (sessionId == null || sessionId.isBlank()) ? UUID.randomUUID().toString() : sessionId;
        String room = (roomId == null || roomId.isBlank()) ? null : roomId;
        StreamSession session = new StreamSession(id, room, new CancellationToken(), clock.instant());
        lock.lock();
        try {
            StreamSession previous = sessions.put(id, session);
            if (previous != null) {
                previous.token().cancel();
                unindex(previous);
                LOG.info("Session {} re-registered, cancelled the previous execution", id);
            }
            if (room != null) {
                sessionsByRoom.computeIfAbsent(room, k -> new LinkedHashSet<>()).add(id);
            }
        } finally {
            lock.unlock();
        }
        LOG.debug("Registered session {} (room={})", id, room);
        return session;
    }

    /**
     * Trips the cancellation flag of one session.
     *
     * @return 1 if this call cancelled it, 0 if it is unknown or was already cancelled
     */
    public int cancelBySession(String sessionId) {
        StreamSession session;
        lock.lock();
        try {
            session = sessions.get(sessionId);
        } finally {
            lock.unlock();
        }
        if (session == null || !session.token().cancel()) {
            return 0;
        }
        LOG.info("Cancelled session {}", sessionId);
        return 1;
    }

    /**
     * Trips the cancellation flag of every session indexed under a room.
     *
     * @return number of sessions this call cancelled
     */
    public int cancelByRoom(String roomId) {
        List<StreamSession> targets = new ArrayList<>();
        lock.lock();
        try {
            Set<String> ids = sessionsByRoom.get(roomId);
            if (ids != null) {
                for (String id : ids) {
                    targets.add(sessions.get(id));
                }
            }
        } finally {
            lock.unlock();
        }
        int count = 0;
        for (StreamSession s : targets) {
            if (s.token().cancel()) {
                count++;
            }
        }
        if (count > 0) {
            LOG.info("Cancelled {} session(s) in room {}", count, roomId);
        }
        return count;
    }

    /**
     * Trips every registered session's flag.
     *
     * @return number of sessions this call cancelled
     */
    public int cancelAll() {
        List<StreamSession> targets;
        lock.lock();
        try {
            targets = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        int count = 0;
        for (StreamSession s : targets) {
            if (s.token().cancel()) {
                count++;
            }
        }
        LOG.info("Cancelled {} of {} active session(s)", count, targets.size());
        return count;
    }

    /**
     * Removes a session from both indices. Does nothing if the id has since been taken over by
     * a newer registration.
     */
    public void release(StreamSession session) {
        Objects.requireNonNull(session, "session must not be null");
        lock.lock();
        try {
            if (sessions.get(session.sessionId()) == session) {
                sessions.remove(session.sessionId());
                unindex(session);
            }
        } finally {
            lock.unlock();
        }
        LOG.debug("Released session {}", session.sessionId());
    }

    /** Removes whatever session is registered under the id. */
    public void release(String sessionId) {
        lock.lock();
        try {
            StreamSession removed = sessions.remove(sessionId);
            if (removed != null) {
                unindex(removed);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String sessionId) {
        lock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public int sessionsInRoom(String roomId) {
        lock.lock();
        try {
            Set<String> ids = sessionsByRoom.get(roomId);
            return ids == null ? 0 : ids.size();
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the registered sessions. */
    public List<StreamSession> snapshot() {
        lock.lock();
        try {
            return List.copyOf(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds {@link #lock}. */
    private void unindex(StreamSession session) {
        if (session.roomId() == null) {
            return;
        }
        Set<String> ids = sessionsByRoom.get(session.roomId());
        if (ids == null) {
            return;
        }
        ids.remove(session.sessionId());
        if (ids.isEmpty()) {
            sessionsByRoom.remove(session.roomId());
        }
    }
}
