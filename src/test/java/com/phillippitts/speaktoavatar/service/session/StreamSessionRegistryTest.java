package com.phillippitts.speaktoavatar.service.session;

import com.phillippitts.speaktoavatar.exception.StreamCancelledException;
import com.phillippitts.speaktoavatar.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamSessionRegistryTest {

    private StreamSessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StreamSessionRegistry(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void blankSessionIdGetsGeneratedId() {
        StreamSession session = registry.register(" ", null);

        assertThat(session.sessionId()).isNotBlank();
        assertThat(session.hasRoom()).isFalse();
        assertThat(registry.contains(session.sessionId())).isTrue();
    }

    @Test
    void cancelBySessionIsIdempotent() {
        StreamSession session = registry.register("s1", "room");

        assertThat(registry.cancelBySession("s1")).isEqualTo(1);
        assertThat(registry.cancelBySession("s1")).isZero();
        assertThat(session.isCancelled()).isTrue();
        assertThat(registry.cancelBySession("unknown")).isZero();
    }

    @Test
    void cancelByRoomOnlyTouchesThatRoom() {
        StreamSession a = registry.register("a", "room-1");
        StreamSession b = registry.register("b", "room-1");
        StreamSession c = registry.register("c", "room-2");

        assertThat(registry.cancelByRoom("room-1")).isEqualTo(2);
        assertThat(registry.cancelByRoom("room-1")).isZero();
        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isTrue();
        assertThat(c.isCancelled()).isFalse();
    }

    @Test
    void cancelAllCountsOnlyNewlyCancelled() {
        registry.register("a", null);
        registry.register("b", null);
        registry.cancelBySession("a");

        assertThat(registry.cancelAll()).isEqualTo(1);
    }

    @Test
    void reRegisteringCancelsPreviousExecution() {
        StreamSession first = registry.register("dup", "room-1");
        StreamSession second = registry.register("dup", "room-2");

        assertThat(first.isCancelled()).isTrue();
        assertThat(second.isCancelled()).isFalse();
        assertThat(registry.sessionsInRoom("room-1")).isZero();
        assertThat(registry.sessionsInRoom("room-2")).isEqualTo(1);

        // the superseded execution finishing must not remove its successor
        registry.release(first);
        assertThat(registry.contains("dup")).isTrue();
        registry.release(second);
        assertThat(registry.contains("dup")).isFalse();
    }

    @Test
    void releaseRemovesFromRoomIndex() {
        StreamSession session = registry.register("s", "room-1");

        registry.release(session);

        assertThat(registry.size()).isZero();
        assertThat(registry.sessionsInRoom("room-1")).isZero();
        assertThat(registry.cancelByRoom("room-1")).isZero();
    }

    @Test
    void tokenReportsWhichCallTrippedIt() {
        CancellationToken token = new CancellationToken();

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThatThrownBy(() -> token.throwIfCancelled("s"))
                .isInstanceOf(StreamCancelledException.class);
    }
}
