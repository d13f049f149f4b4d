package com.phillippitts.speaktoavatar.service.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a successful join.
 *
 * @param liveId    room that is now live
 * @param status    whether this call started the live or found it running
 * @param elapsedMs time spent in the join call
 */
public record JoinResult(String liveId, Status status, long elapsedMs) {

    public enum Status {
        JOINED("joined"),
        ALREADY_ACTIVE("already_active");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    static JoinResult joined(String liveId, long elapsedMs) {
        return new JoinResult(liveId, Status.JOINED, elapsedMs);
    }

    static JoinResult alreadyActive(String liveId) {
        return new JoinResult(liveId, Status.ALREADY_ACTIVE, 0);
    }
}
