package com.phillippitts.speaktoavatar.service.coordinator.event;

import java.time.Instant;

/** Published when the avatar went live in a room. */
public record RoomJoinedEvent(String liveId, long durationMs, Instant at) { }
