package com.phillippitts.speaktoavatar.service.coordinator;

/**
 * @param liveId           room that was left
 * @param cleanedUp        true if the room was active and has been torn down
 * @param cancelledStreams streams of the room cancelled by this call
 * @param cancelledJoin    true if a join for the room was still in flight
 */
public record LeaveResult(String liveId, boolean cleanedUp, int cancelledStreams, boolean cancelledJoin) {
}
