package com.phillippitts.speaktoavatar.service.coordinator;

import com.phillippitts.speaktoavatar.config.properties.CoordinatorProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers when each room's last join failed. A room is cooling down until the configured
 * period has passed since that failure. Expired entries are dropped on lookup and by
 * {@link #sweep()}.
 */
@Component
public class FailureCooldownTracker {

    private static final Logger LOG = LogManager.getLogger(FailureCooldownTracker.class);

    private final Map<String, Instant> failures = new ConcurrentHashMap<>();
    private final Duration period;
    private final Clock clock;

    public FailureCooldownTracker(CoordinatorProperties props, Clock clock) {
        this.period = Duration.ofSeconds(props.getCooldownSeconds());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void recordFailure(String roomId) {
        failures.put(roomId, clock.instant());
        LOG.warn("Room {} cooling down for {}s after a failed join", roomId, period.toSeconds());
    }

    /**
     * Whole seconds left in the room's cooldown, rounded up.
     *
     * @return 0 when the room is not cooling down
     */
    public long remainingSeconds(String roomId) {
        Instant failedAt = failures.get(roomId);
        if (failedAt == null) {
            return 0;
        }
        Duration left = remaining(failedAt);
        if (left.isZero() || left.isNegative()) {
            failures.remove(roomId, failedAt);
            return 0;
        }
        long seconds = left.toSeconds();
        return left.toNanosPart() > 0 ? seconds + 1 : seconds;
    }

    public boolean isCoolingDown(String roomId) {
        return remainingSeconds(roomId) > 0;
    }

    /**
     * Drops expired entries.
     *
     * @return number of entries dropped
     */
    public int sweep() {
        int before = failures.size();
        failures.entrySet().removeIf(e -> remaining(e.getValue()).compareTo(Duration.ZERO) <= 0);
        return Math.max(0, before - failures.size());
    }

    /** Rooms still cooling down, with seconds remaining. */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String roomId : failures.keySet()) {
            long left = remainingSeconds(roomId);
            if (left > 0) {
                out.put(roomId, left);
            }
        }
        return out;
    }

    public void clearAll() {
        failures.clear();
    }

    private Duration remaining(Instant failedAt) {
        return period.minus(Duration.between(failedAt, clock.instant()));
    }
}
