package com.phillippitts.speaktoavatar.service.coordinator;

/**
 * @param cancelledJoins   in-flight joins cancelled
 * @param cancelledStreams streams cancelled
 * @param clearedRooms     active room records dropped
 */
public record ResetResult(int cancelledJoins, int cancelledStreams, int clearedRooms) {
}
