package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.config.properties.AvatarProperties;
import com.phillippitts.speaktoavatar.config.properties.CoordinatorProperties;
import com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.exception.SpeakToAvatarException;
import com.phillippitts.speaktoavatar.exception.StreamCancelledException;
import com.phillippitts.speaktoavatar.service.client.ProtocolClient;
import com.phillippitts.speaktoavatar.service.client.avatar.AvatarClient;
import com.phillippitts.speaktoavatar.service.client.avatar.AvatarType;
import com.phillippitts.speaktoavatar.service.client.avatar.LiveRequest;
import com.phillippitts.speaktoavatar.service.client.avatar.StreamingTarget;
import com.phillippitts.speaktoavatar.service.client.stt.SttClient;
import com.phillippitts.speaktoavatar.service.client.tts.TtsClient;
import com.phillippitts.speaktoavatar.service.coordinator.PendingJoinRegistry.PendingJoin;
import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinFailedEvent;
import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinedEvent;
import com.phillippitts.speaktoavatar.service.session.StreamSessionRegistry;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guards putting the avatar live in a room.
 *
 * <p>A join goes through these gates, in order:
 * <ol>
 *   <li>an active, still-bound room short-circuits to {@link JoinResult.Status#ALREADY_ACTIVE}</li>
 *   <li>a room with a join already in flight is rejected</li>
 *   <li>a room inside its failure cooldown is rejected without touching the network</li>
 *   <li>one process-wide connection lock serializes connect, health check and start-live
 *       across all rooms, since they share one control socket</li>
 * </ol>
 * Connect plus health check is retried a bounded number of times. The whole join runs on the
 * join executor under a hard wall-clock bound; when it is exceeded the work is interrupted and
 * the caller gets a timeout.
 *
 * <p>Any failure other than a rejection or cancellation starts the room's cooldown. A join that
 * does not succeed never leaves the room in the active set or the avatar live in it, even when
 * the worker finishes starting the live after the caller gave up. The pending reservation is
 * always released.
 *
 * <p><b>Thread Safety:</b> all public methods are safe to call concurrently.
 */
@Service
public class RoomCoordinator {

    private static final Logger LOG = LogManager.getLogger(RoomCoordinator.class);

    private final AvatarClient avatarClient;
    private final TtsClient ttsClient;
    private final SttClient sttClient;
    private final StreamSessionRegistry sessions;
    private final PendingJoinRegistry pendingJoins;
    private final FailureCooldownTracker cooldowns;
    private final CoordinatorProperties props;
    private final AvatarProperties avatarProps;
    private final AsyncTaskExecutor joinExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock connectionLock = new ReentrantLock();
    private final Map<String, ActiveRoom> activeRooms = new ConcurrentHashMap<>();

    public RoomCoordinator(AvatarClient avatarClient,
                           TtsClient ttsClient,
                           SttClient sttClient,
                           StreamSessionRegistry sessions,
                           PendingJoinRegistry pendingJoins,
                           FailureCooldownTracker cooldowns,
                           CoordinatorProperties props,
                           AvatarProperties avatarProps,
                           @Qualifier("joinExecutor") AsyncTaskExecutor joinExecutor,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.avatarClient = Objects.requireNonNull(avatarClient);
        this.ttsClient = Objects.requireNonNull(ttsClient);
        this.sttClient = Objects.requireNonNull(sttClient);
        this.sessions = Objects.requireNonNull(sessions);
        this.pendingJoins = Objects.requireNonNull(pendingJoins);
        this.cooldowns = Objects.requireNonNull(cooldowns);
        this.props = Objects.requireNonNull(props);
        this.avatarProps = Objects.requireNonNull(avatarProps);
        this.joinExecutor = Objects.requireNonNull(joinExecutor);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Puts the avatar live in a room.
     *
     * @throws ConcurrencyRejectedException if a join for the room is in flight or the room is cooling down
     * @throws OperationTimeoutException if the join exceeds its overall bound or a step times out
     * @throws ConnectionException if the avatar socket cannot be brought up
     * @throws SessionException if the avatar service refuses to start the live
     * @throws StreamCancelledException if a leave or reset calls the join off
     */
    public JoinResult join(JoinRoomRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String liveId = request.liveId();
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("roomId", liveId)) {
            long start = System.nanoTime();
            LOG.info("Join requested: {}", request);

            ActiveRoom existing = activeRooms.get(liveId);
            if (existing != null) {
                if (avatarClient.isBoundTo(liveId)) {
                    LOG.info("Room {} already active, nothing to do", liveId);
                    return JoinResult.alreadyActive(liveId);
                }
                LOG.warn("Room {} recorded active but avatar is not bound to it, dropping stale record", liveId);
                activeRooms.remove(liveId, existing);
            }

            PendingJoin pending;
            try {
                if (pendingJoins.isPending(liveId)) {
                    throw ConcurrencyRejectedException.pending(liveId);
                }
                throwIfCoolingDown(liveId);
                pending = pendingJoins.reserve(liveId);
            } catch (ConcurrencyRejectedException e) {
                LOG.warn("Join for {} rejected: {}", liveId, e.getMessage());
                publishFailure(liveId, e);
                throw e;
            }

            JoinHandOff handOff = new JoinHandOff();
            boolean joined = false;
            try {
                Future<ActiveRoom> work = submitJoin(request, handOff);
                pending.attach(work);
                awaitJoin(work, liveId);
                joined = true;
                long elapsed = TimeUtils.elapsedMillis(start);
                LOG.info("Avatar live in room {} after {}ms", liveId, elapsed);
                publisher.publishEvent(new RoomJoinedEvent(liveId, elapsed, clock.instant()));
                return JoinResult.joined(liveId, elapsed);
            } catch (ConcurrencyRejectedException | StreamCancelledException e) {
                LOG.warn("Join for {} did not run: {}", liveId, e.getMessage());
                publishFailure(liveId, e);
                throw e;
            } catch (RuntimeException e) {
                cooldowns.recordFailure(liveId);
                LOG.error("Join for {} failed after {}ms: {}", liveId, TimeUtils.elapsedMillis(start), e.getMessage());
                publishFailure(liveId, e);
                throw e;
            } finally {
                if (!joined) {
                    abandon(liveId, handOff);
                }
                pendingJoins.complete(pending);
            }
        }
    }

    /**
     * Tears a room down: cancels its streams and any in-flight join, and if the avatar is live
     * there, stops the live and closes every client so the next join starts clean. Teardown
     * problems are logged, not thrown.
     */
    public LeaveResult leave(String liveId) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("roomId", liveId)) {
            int cancelledStreams = sessions.cancelByRoom(liveId);
            boolean cancelledJoin = pendingJoins.cancel(liveId);
            ActiveRoom room = activeRooms.remove(liveId);
            if (room == null) {
                LOG.info("Leave for {}: room not active (streams cancelled={}, join cancelled={})",
                        liveId, cancelledStreams, cancelledJoin);
                return new LeaveResult(liveId, false, cancelledStreams, cancelledJoin);
            }
            if (avatarClient.isBoundTo(liveId)) {
                quietly("stop live", avatarClient::stopLive);
            }
            quietly("disconnect avatar", avatarClient::disconnect);
            quietly("disconnect tts", ttsClient::disconnect);
            quietly("disconnect stt", sttClient::disconnect);
            LOG.info("Left room {} (streams cancelled={})", liveId, cancelledStreams);
            return new LeaveResult(liveId, true, cancelledStreams, cancelledJoin);
        }
    }

    /**
     * Cancels every pending join and stream, disconnects every client and clears all
     * coordinator state. Best effort; never throws for an individual client.
     */
    public ResetResult reset() {
        int joins = pendingJoins.cancelAll();
        int streams = sessions.cancelAll();
        int rooms = activeRooms.size();
        activeRooms.clear();
        quietly("disconnect avatar", avatarClient::disconnect);
        quietly("disconnect tts", ttsClient::disconnect);
        quietly("disconnect stt", sttClient::disconnect);
        cooldowns.clearAll();
        LOG.info("Reset: cancelled {} join(s) and {} stream(s), cleared {} room(s)", joins, streams, rooms);
        return new ResetResult(joins, streams, rooms);
    }

    /** Snapshot of clients and bookkeeping. Pings the avatar socket when it is connected. */
    public ConnectionStatus status() {
        Map<String, ConnectionStatus.ClientStatus> clients = new LinkedHashMap<>();
        for (ProtocolClient c : List.of(avatarClient, ttsClient, sttClient)) {
            clients.put(c.serviceName(), new ConnectionStatus.ClientStatus(
                    c.state().name().toLowerCase(Locale.ROOT), c.isConnected(), c.boundId()));
        }
        boolean avatarHealthy = avatarClient.isConnected() && avatarClient.healthCheck();
        return new ConnectionStatus(clients, avatarHealthy, new ArrayList<>(activeRooms.values()),
                pendingJoins.rooms(), cooldowns.snapshot(), sessions.size());
    }

    public boolean isActive(String liveId) {
        return activeRooms.containsKey(liveId);
    }

    @Scheduled(fixedDelayString = "${coordinator.sweep-interval-ms:30000}")
    public void sweep() {
        int joins = pendingJoins.sweepCompleted();
        int expired = cooldowns.sweep();
        if (joins > 0 || expired > 0) {
            LOG.debug("Sweep dropped {} finished join(s) and {} expired cooldown(s)", joins, expired);
        }
    }

    private Future<ActiveRoom> submitJoin(JoinRoomRequest request, JoinHandOff handOff) {
        try {
            return joinExecutor.submit(() -> attemptJoin(request, handOff));
        } catch (TaskRejectedException e) {
            throw ConcurrencyRejectedException.busy(request.liveId(), e);
        }
    }

    private ActiveRoom attemptJoin(JoinRoomRequest request, JoinHandOff handOff) throws InterruptedException {
        String liveId = request.liveId();
        connectionLock.lockInterruptibly();
        try {
            // a failure may have been recorded while this join waited for the lock
            throwIfCoolingDown(liveId);
            ensureAvatarConnected(liveId);

            String bound = avatarClient.boundId();
            if (bound != null && !bound.equals(liveId)) {
                LOG.warn("Avatar still live in {}, stopping it before starting {}", bound, liveId);
                avatarClient.stopLive();
                activeRooms.remove(bound);
            }

            LiveRequest live = toLiveRequest(request);
            avatarClient.startLive(live, Duration.ofMillis(props.getStartLiveTimeoutMs()));
            ActiveRoom room = new ActiveRoom(liveId, live.avatarType().wireName(), live.role(),
                    live.target() instanceof StreamingTarget.Rtc rtc ? rtc.roomId() : null, clock.instant());
            if (!commit(room, handOff)) {
                LOG.warn("Join for {} was called off while the live started, stopping it", liveId);
                avatarClient.stopLive();
                throw new InterruptedException("join for " + liveId + " called off");
            }
            return room;
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Records the room as active unless the caller has already given up on this join.
     *
     * @return false if the join was abandoned or the worker interrupted
     */
    private boolean commit(ActiveRoom room, JoinHandOff handOff) {
        synchronized (handOff) {
            if (handOff.abandoned || Thread.currentThread().isInterrupted()) {
                return false;
            }
            activeRooms.put(room.liveId(), room);
            handOff.committed = room;
            return true;
        }
    }

    /**
     * Undoes whatever a join that did not succeed left behind. A worker that has not committed
     * yet will see the abandon flag and stop its own live.
     */
    private void abandon(String liveId, JoinHandOff handOff) {
        synchronized (handOff) {
            handOff.abandoned = true;
            if (handOff.committed != null) {
                activeRooms.remove(liveId, handOff.committed);
            } else {
                activeRooms.remove(liveId);
            }
        }
        if (avatarClient.isBoundTo(liveId)) {
            LOG.warn("Avatar left live in {} by a join that did not complete, stopping it", liveId);
            quietly("stop live", avatarClient::stopLive);
        }
    }

    private void ensureAvatarConnected(String liveId) throws InterruptedException {
        Duration healthTimeout = Duration.ofMillis(props.getHealthTimeoutMs());
        int maxAttempts = props.getMaxAttempts();
        SpeakToAvatarException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (!avatarClient.isConnected()) {
                    LOG.info("Connecting avatar for {} (attempt {}/{})", liveId, attempt, maxAttempts);
                    avatarClient.connect();
                }
                if (!avatarClient.healthCheck(healthTimeout)) {
                    throw new ConnectionException("Avatar connection failed its health check",
                            AvatarClient.SERVICE, ConnectionException.Reason.TRANSPORT);
                }
                return;
            } catch (ConnectionException | OperationTimeoutException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("join for " + liveId + " called off");
                }
                last = e;
                boolean timedOut = e instanceof OperationTimeoutException
                        || (e instanceof ConnectionException ce && ce.isTimeout());
                LOG.warn("Avatar connect attempt {}/{} for {} failed (timeout={}): {}",
                        attempt, maxAttempts, liveId, timedOut, e.getMessage());
                if (!timedOut) {
                    avatarClient.disconnect();
                }
                if (attempt < maxAttempts) {
                    Thread.sleep(props.getRetryDelayMs());
                }
            }
        }
        throw last;
    }

    private void awaitJoin(Future<ActiveRoom> work, String liveId) {
        Duration bound = Duration.ofMillis(props.getJoinTimeoutMs());
        try {
            work.get(bound.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            work.cancel(true);
            throw new OperationTimeoutException("join room " + liveId, bound, e);
        } catch (CancellationException e) {
            throw StreamCancelledException.joinCancelled(liveId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            work.cancel(true);
            throw StreamCancelledException.joinCancelled(liveId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw StreamCancelledException.joinCancelled(liveId);
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new SpeakToAvatarException("Join for " + liveId + " failed", cause);
        }
    }

    private void throwIfCoolingDown(String liveId) {
        long remaining = cooldowns.remainingSeconds(liveId);
        if (remaining > 0) {
            throw ConcurrencyRejectedException.coolingDown(liveId, remaining);
        }
    }

    private LiveRequest toLiveRequest(JoinRoomRequest r) {
        StreamingTarget target = StreamingTarget.rtc(
                orDefault(r.rtcAppId(), avatarProps.getRtcAppId()),
                orDefault(r.rtcRoomId(), avatarProps.getRtcRoomId()),
                orDefault(r.rtcUid(), avatarProps.getRtcUid()),
                orDefault(r.rtcToken(), avatarProps.getRtcToken()));
        return new LiveRequest(r.liveId(), AvatarType.fromWireName(r.avatarType()),
                orDefault(r.role(), avatarProps.getDefaultRole()), target, r.background(),
                r.videoConfig(), r.roleConfig());
    }

    /** Hand-off between a join worker and its caller. Guarded by its own monitor. */
    private static final class JoinHandOff {
        private boolean abandoned;
        private ActiveRoom committed;
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }

    private void publishFailure(String liveId, RuntimeException e) {
        publisher.publishEvent(new RoomJoinFailedEvent(liveId, failureReason(e), e.getMessage(), clock.instant()));
    }

    static String failureReason(RuntimeException e) {
        if (e instanceof ConcurrencyRejectedException cre) {
            return cre.getReason().name().toLowerCase(Locale.ROOT);
        }
        if (e instanceof OperationTimeoutException) {
            return "timeout";
        }
        if (e instanceof ConnectionException ce) {
            return ce.isTimeout() ? "timeout" : "connection";
        }
        if (e instanceof SessionException) {
            return "session";
        }
        if (e instanceof StreamCancelledException) {
            return "cancelled";
        }
        return "error";
    }

    private static void quietly(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("{} failed: {}", what, e.getMessage());
        }
    }
}
