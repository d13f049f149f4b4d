package com.phillippitts.speaktoavatar.service.coordinator;

import java.time.Instant;

/** A room the avatar is live in. */
public record ActiveRoom(String liveId, String avatarType, String role, String rtcRoomId, Instant joinedAt) {
}
