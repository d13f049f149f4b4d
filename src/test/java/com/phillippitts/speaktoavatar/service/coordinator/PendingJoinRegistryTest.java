package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.exception.ConcurrencyRejectedException;
import com.phillippitts.speaktoavatar.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingJoinRegistryTest {

    private PendingJoinRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PendingJoinRegistry(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void secondReservationForSameRoomIsRejected() {
        registry.reserve("room");

        assertThatThrownBy(() -> registry.reserve("room"))
                .isInstanceOf(ConcurrencyRejectedException.class)
                .satisfies(e -> assertThat(((ConcurrencyRejectedException) e).getReason())
                        .isEqualTo(ConcurrencyRejectedException.Reason.PENDING));
    }

    @Test
    void completeReleasesOnlyItsOwnReservation() {
        PendingJoinRegistry.PendingJoin first = registry.reserve("room");
        registry.cancel("room");
        PendingJoinRegistry.PendingJoin second = registry.reserve("room");

        registry.complete(first);

        assertThat(registry.isPending("room")).isTrue();
        registry.complete(second);
        assertThat(registry.isPending("room")).isFalse();
    }

    @Test
    void cancelInterruptsAttachedWork() {
        PendingJoinRegistry.PendingJoin join = registry.reserve("room");
        CompletableFuture<Void> work = new CompletableFuture<>();
        join.attach(work);

        assertThat(registry.cancel("room")).isTrue();

        assertThat(work.isCancelled()).isTrue();
        assertThat(join.isCancelled()).isTrue();
        assertThat(registry.cancel("room")).isFalse();
    }

    @Test
    void workAttachedAfterCancelIsCancelledImmediately() {
        PendingJoinRegistry.PendingJoin join = registry.reserve("room");
        registry.cancel("room");
        CompletableFuture<Void> work = new CompletableFuture<>();

        join.attach(work);

        assertThat(work.isCancelled()).isTrue();
    }

    @Test
    void cancelAllAndSweep() {
        registry.reserve("a");
        PendingJoinRegistry.PendingJoin b = registry.reserve("b");
        b.attach(CompletableFuture.completedFuture(null));

        assertThat(registry.sweepCompleted()).isEqualTo(1);
        assertThat(registry.rooms()).containsExactly("a");
        assertThat(registry.cancelAll()).isEqualTo(1);
        assertThat(registry.rooms()).isEmpty();
    }
}
