package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.config.properties.AvatarProperties;
import com.phillippitts.speaktoavatar.config.properties.CoordinatorProperties;
import com.phillippitts.speaktoavatar.config.properties.SttProperties;
import com.phillippitts.speaktoavatar.config.properties.TtsProperties;
import com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException;
import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.SessionException;
import com.phillippitts.speaktoavatar.exception.StreamCancelledException;
import com.phillippitts.speaktoavatar.service.client.avatar.AvatarClient;
import com.phillippitts.speaktoavatar.service.client.stt.SttClient;
import com.phillippitts.speaktoavatar.service.client.tts.TtsClient;
import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinFailedEvent;
import com.phillippitts.speaktoavatar.service.coordinator.event.RoomJoinedEvent;
import com.phillippitts.speaktoavatar.service.session.StreamSession;
import com.phillippitts.speaktoavatar.service.session.StreamSessionRegistry;
import com.phillippitts.speaktoavatar.testutil.EventCapturingPublisher;
import com.phillippitts.speaktoavatar.testutil.FakeAvatarServer;
import com.phillippitts.speaktoavatar.testutil.MutableClock;
import com.phillippitts.speaktoavatar.testutil.ScriptedTransportFactory;
import com.phillippitts.speaktoavatar.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoomCoordinatorTest {

    private FakeAvatarServer server;
    private ScriptedTransportFactory avatarTransports;
    private AvatarClient avatar;
    private StreamSessionRegistry sessions;
    private PendingJoinRegistry pendingJoins;
    private FailureCooldownTracker cooldowns;
    private CoordinatorProperties props;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private ThreadPoolTaskExecutor pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        server = new FakeAvatarServer();
        avatarTransports = new ScriptedTransportFactory(server);
        avatar = new AvatarClient(avatarTransports, avatarProps(), List.of());
        sessions = new StreamSessionRegistry(clock);
        pendingJoins = new PendingJoinRegistry(clock);
        props = new CoordinatorProperties();
        props.setHealthTimeoutMs(500);
        props.setMaxAttempts(2);
        props.setRetryDelayMs(0);
        props.setStartLiveTimeoutMs(1_000);
        props.setJoinTimeoutMs(5_000);
        props.setCooldownSeconds(10);
        cooldowns = new FailureCooldownTracker(props, clock);
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void joinPutsAvatarLiveAndPublishesEvent() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        JoinResult result = coordinator.join(JoinRoomRequest.of("room-1"));

        assertThat(result.status()).isEqualTo(JoinResult.Status.JOINED);
        assertThat(coordinator.isActive("room-1")).isTrue();
        assertThat(avatar.isBoundTo("room-1")).isTrue();
        assertThat(publisher.eventsOf(RoomJoinedEvent.class)).extracting(RoomJoinedEvent::liveId)
                .containsExactly("room-1");
        assertThat(pendingJoins.rooms()).isEmpty();
    }

    @Test
    void joiningActiveRoomIsNoOp() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        coordinator.join(JoinRoomRequest.of("room-1"));

        JoinResult again = coordinator.join(JoinRoomRequest.of("room-1"));

        assertThat(again.status()).isEqualTo(JoinResult.Status.ALREADY_ACTIVE);
        assertThat(server.count("|CTL|00|")).isEqualTo(1);
    }

    @Test
    void joinFillsRtcTargetFromDefaults() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        coordinator.join(new JoinRoomRequest("room-1", "pic", null, null, "rtc-override", null, null, null,
                null, null));

        String init = server.controls().get(0);
        assertThat(init).contains("\"rtc_room_id\":\"rtc-override\"");
        assertThat(init).contains("\"rtc_app_id\":\"default-app\"");
        assertThat(init).contains("\"role\":\"default-role\"");
        assertThat(init).contains("\"avatar_type\":\"pic\"");
    }

    @Test
    void secondConcurrentJoinForSameRoomIsRejectedWithoutCooldown() throws Exception {
        server.silent();
        props.setStartLiveTimeoutMs(5_000);
        RoomCoordinator coordinator = coordinator(realExecutor());

        CompletableFuture<JoinResult> first =
                CompletableFuture.supplyAsync(() -> coordinator.join(JoinRoomRequest.of("room-1")));
        await().atMost(Duration.ofSeconds(2)).until(() -> pendingJoins.isPending("room-1"));

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(ConcurrencyRejectedException.class)
                .satisfies(e -> assertThat(((ConcurrencyRejectedException) e).getReason())
                        .isEqualTo(ConcurrencyRejectedException.Reason.PENDING));
        assertThat(cooldowns.isCoolingDown("room-1")).isFalse();

        LeaveResult left = coordinator.leave("room-1");
        assertThat(left.cancelledJoin()).isTrue();
        assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StreamCancelledException.class);
        assertThat(cooldowns.isCoolingDown("room-1")).isFalse();
        assertThat(publisher.eventsOf(RoomJoinFailedEvent.class)).extracting(RoomJoinFailedEvent::reason)
                .contains("pending", "cancelled");
    }

    @Test
    void failedJoinStartsCooldownAndLaterJoinIsRejectedWithoutNetwork() {
        server.ackWith(4002);
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(SessionException.class);
        assertThat(coordinator.isActive("room-1")).isFalse();
        assertThat(cooldowns.isCoolingDown("room-1")).isTrue();
        int sockets = avatarTransports.created().size();
        long startLives = server.count("|CTL|00|");

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(ConcurrencyRejectedException.class)
                .satisfies(e -> assertThat(((ConcurrencyRejectedException) e).getRemainingSeconds()).isEqualTo(10));
        assertThat(avatarTransports.created()).hasSize(sockets);
        assertThat(server.count("|CTL|00|")).isEqualTo(startLives);
        assertThat(publisher.eventsOf(RoomJoinFailedEvent.class)).extracting(RoomJoinFailedEvent::reason)
                .containsExactly("session", "cooldown");
    }

    @Test
    void cooldownEndsAfterPeriod() {
        server.ackWith(4002);
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(SessionException.class);

        server.ackWith(1000);
        clock.advance(Duration.ofSeconds(10));

        assertThat(coordinator.join(JoinRoomRequest.of("room-1")).status()).isEqualTo(JoinResult.Status.JOINED);
    }

    @Test
    void connectIsRetriedUpToMaxAttempts() {
        avatarTransports.failNextOpen(new ConnectionException("refused", "transport",
                ConnectionException.Reason.HANDSHAKE));
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        JoinResult result = coordinator.join(JoinRoomRequest.of("room-1"));

        assertThat(result.status()).isEqualTo(JoinResult.Status.JOINED);
        assertThat(avatarTransports.created()).hasSize(2);
    }

    @Test
    void connectFailureAfterAllAttemptsFailsJoin() {
        for (int i = 0; i < 2; i++) {
            avatarTransports.failNextOpen(new ConnectionException("refused", "transport",
                    ConnectionException.Reason.HANDSHAKE));
        }
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(ConnectionException.class);
        assertThat(cooldowns.isCoolingDown("room-1")).isTrue();
        assertThat(pendingJoins.isPending("room-1")).isFalse();
    }

    @Test
    void joinExceedingOverallBoundTimesOut() {
        server.silent();
        props.setJoinTimeoutMs(200);
        props.setStartLiveTimeoutMs(5_000);
        RoomCoordinator coordinator = coordinator(realExecutor());

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(OperationTimeoutException.class);
        assertThat(cooldowns.isCoolingDown("room-1")).isTrue();
        assertThat(coordinator.isActive("room-1")).isFalse();
        assertThat(avatar.isBoundTo("room-1")).isFalse();
    }

    @Test
    void liveAcknowledgedAfterJoinTimedOutIsStoppedAndNotRecorded() {
        server.holdAck();
        props.setJoinTimeoutMs(300);
        props.setStartLiveTimeoutMs(5_000);
        RoomCoordinator coordinator = coordinator(new UninterruptibleExecutor());

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(OperationTimeoutException.class);
        await().atMost(Duration.ofSeconds(2)).until(server::hasHeldAck);
        server.releaseAck();

        await().atMost(Duration.ofSeconds(2))
                .until(() -> server.count("|CTL|01|") >= 1 && avatar.boundId() == null);
        assertThat(coordinator.isActive("room-1")).isFalse();
        assertThat(avatar.isBoundTo("room-1")).isFalse();
        assertThat(coordinator.status().activeRooms()).isEmpty();
        assertThat(cooldowns.isCoolingDown("room-1")).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void saturatedJoinPoolRejectsWithoutCooldown() {
        AsyncTaskExecutor full = mock(AsyncTaskExecutor.class);
        when(full.submit(any(Callable.class))).thenThrow(new TaskRejectedException("join pool full"));
        RoomCoordinator coordinator = coordinator(full);

        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-1")))
                .isInstanceOf(ConcurrencyRejectedException.class)
                .hasCauseInstanceOf(TaskRejectedException.class)
                .satisfies(e -> assertThat(((ConcurrencyRejectedException) e).getReason())
                        .isEqualTo(ConcurrencyRejectedException.Reason.BUSY));
        assertThat(cooldowns.isCoolingDown("room-1")).isFalse();
        assertThat(pendingJoins.isPending("room-1")).isFalse();
        assertThat(server.controls()).isEmpty();
        assertThat(publisher.eventsOf(RoomJoinFailedEvent.class)).extracting(RoomJoinFailedEvent::reason)
                .containsExactly("busy");
    }

    @Test
    void joiningAnotherRoomStopsPreviousLive() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        coordinator.join(JoinRoomRequest.of("room-1"));

        coordinator.join(JoinRoomRequest.of("room-2"));

        assertThat(server.count("|CTL|01|")).isEqualTo(1);
        assertThat(coordinator.isActive("room-1")).isFalse();
        assertThat(avatar.isBoundTo("room-2")).isTrue();
    }

    @Test
    void leaveStopsLiveCancelsStreamsAndDisconnects() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        coordinator.join(JoinRoomRequest.of("room-1"));
        StreamSession stream = sessions.register("s-1", "room-1");

        LeaveResult result = coordinator.leave("room-1");

        assertThat(result.cleanedUp()).isTrue();
        assertThat(result.cancelledStreams()).isEqualTo(1);
        assertThat(stream.isCancelled()).isTrue();
        assertThat(server.count("|CTL|01|")).isEqualTo(1);
        assertThat(avatar.isConnected()).isFalse();
        assertThat(coordinator.isActive("room-1")).isFalse();
    }

    @Test
    void leaveUnknownRoomCleansNothing() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());

        LeaveResult result = coordinator.leave("nowhere");

        assertThat(result.cleanedUp()).isFalse();
        assertThat(result.cancelledJoin()).isFalse();
    }

    @Test
    void resetClearsAllState() {
        server.ackWith(4002);
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        assertThatThrownBy(() -> coordinator.join(JoinRoomRequest.of("room-x")))
                .isInstanceOf(SessionException.class);
        server.ackWith(1000);
        coordinator.join(JoinRoomRequest.of("room-1"));
        sessions.register("s-1", "room-1");

        ResetResult result = coordinator.reset();

        assertThat(result.clearedRooms()).isEqualTo(1);
        assertThat(result.cancelledStreams()).isEqualTo(1);
        assertThat(cooldowns.snapshot()).isEmpty();
        assertThat(avatar.isConnected()).isFalse();
    }

    @Test
    void statusReportsClientsAndRooms() {
        RoomCoordinator coordinator = coordinator(new SyncExecutor());
        coordinator.join(JoinRoomRequest.of("room-1"));

        ConnectionStatus status = coordinator.status();

        assertThat(status.clients()).containsOnlyKeys("avatar", "tts", "stt");
        assertThat(status.clients().get("avatar").connected()).isTrue();
        assertThat(status.clients().get("avatar").boundId()).isEqualTo("room-1");
        assertThat(status.clients().get("tts").state()).isEqualTo("disconnected");
        assertThat(status.avatarHealthy()).isTrue();
        assertThat(status.activeRooms()).extracting(ActiveRoom::liveId).containsExactly("room-1");
    }

    @Test
    void classifiesFailureReasons() {
        assertThat(RoomCoordinator.failureReason(ConcurrencyRejectedException.coolingDown("r", 3)))
                .isEqualTo("cooldown");
        assertThat(RoomCoordinator.failureReason(new ConnectionException("x", "avatar",
                ConnectionException.Reason.TIMEOUT))).isEqualTo("timeout");
        assertThat(RoomCoordinator.failureReason(new ConnectionException("x", "avatar",
                ConnectionException.Reason.CLOSED))).isEqualTo("connection");
        assertThat(RoomCoordinator.failureReason(new IllegalStateException("x"))).isEqualTo("error");
    }

    private RoomCoordinator coordinator(AsyncTaskExecutor executor) {
        TtsClient tts = new TtsClient(new ScriptedTransportFactory(), new TtsProperties());
        SttClient stt = new SttClient(new ScriptedTransportFactory(), new SttProperties());
        AvatarProperties avatarProps = avatarProps();
        return new RoomCoordinator(avatar, tts, stt, sessions, pendingJoins, cooldowns, props, avatarProps,
                executor, publisher, clock);
    }

    private AsyncTaskExecutor realExecutor() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(2);
        pool.setThreadNamePrefix("join-test-");
        pool.initialize();
        return pool;
    }

    /** Runs each task on its own thread and ignores interrupting cancels, like a worker stuck in I/O. */
    private static final class UninterruptibleExecutor implements AsyncTaskExecutor {
        @Override
        public void execute(Runnable task) {
            submit(task);
        }

        @Override
        public Future<?> submit(Runnable task) {
            return submit(Executors.callable(task));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            FutureTask<T> future = new FutureTask<>(task) {
                @Override
                public boolean cancel(boolean mayInterruptIfRunning) {
                    return super.cancel(false);
                }
            };
            Thread worker = new Thread(future, "join-uninterruptible");
            worker.setDaemon(true);
            worker.start();
            return future;
        }
    }

    private static AvatarProperties avatarProps() {
        AvatarProperties p = new AvatarProperties();
        p.setStrategies(List.of(new AvatarProperties.ConnectStrategy(true, 1_000)));
        p.setStrategyDelayMs(0);
        p.setStopGraceMs(0);
        p.setCloseTimeoutMs(200);
        p.setHealthTimeoutMs(500);
        p.setDefaultRole("default-role");
        p.setRtcAppId("default-app");
        p.setRtcRoomId("default-room");
        p.setRtcUid("default-uid");
        p.setRtcToken("default-token");
        return p;
    }
}
