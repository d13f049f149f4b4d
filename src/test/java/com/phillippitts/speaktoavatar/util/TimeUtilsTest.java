package com.phillippitts.speaktoavatar.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0);
    }

    @Test
    void elapsedMillisConvertsFromNanos() {
        long start = System.nanoTime() - 250 * TimeUtils.NANOS_PER_MILLI;
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(250);
    }

    @Test
    void deadlineInFutureHasTimeRemaining() {
        long deadline = TimeUtils.deadlineAfter(Duration.ofSeconds(5));
        assertThat(TimeUtils.remainingNanos(deadline)).isPositive();
    }

    @Test
    void zeroTimeoutDeadlineHasPassed() {
        long deadline = TimeUtils.deadlineAfter(Duration.ZERO);
        assertThat(TimeUtils.remainingNanos(deadline)).isLessThanOrEqualTo(0);
    }
}
