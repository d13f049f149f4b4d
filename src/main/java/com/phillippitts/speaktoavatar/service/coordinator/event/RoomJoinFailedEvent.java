package com.phillippitts.speaktoavatar.service.coordinator.event;

import java.time.Instant;

/**
 * Published when a join did not make the avatar live.
 *
 * @param liveId  room of the join
 * @param reason  short category: pending, cooldown, timeout, connection, session, cancelled or error
 * @param message failure message
 * @param at      when the join gave up
 */
public record RoomJoinFailedEvent(String liveId, String reason, String message, Instant at) {

    /** True when the join was turned away before any work was done. */
    public boolean rejected() {
        return "pending".equals(reason) || "cooldown".equals(reason);
    }
}
