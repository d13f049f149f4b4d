package com.phillippitts.speaktoavatar.service.coordinator;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of every client and of the coordinator's bookkeeping.
 *
 * @param clients       per-service connection state, keyed by service name
 * @param avatarHealthy result of a ping against the avatar socket, false when disconnected
 * @param activeRooms   rooms the avatar is live in
 * @param pendingJoins  rooms with a join in flight
 * @param cooldowns     rooms cooling down, with seconds remaining
 * @param activeStreams streams currently registered
 */
public record ConnectionStatus(Map<String, ClientStatus> clients, boolean avatarHealthy,
                               List<ActiveRoom> activeRooms, Set<String> pendingJoins,
                               Map<String, Long> cooldowns, int activeStreams) {

    public record ClientStatus(String state, boolean connected, String boundId) {
    }
}
