package com.phillippitts.speaktoavatar.exception;

/**
 * Thrown when a room join is refused without contacting the remote service: another join for
 * the same room is still running, the room is cooling down after a failure, or the join pool
 * has no room for more work.
 */
public class ConcurrencyRejectedException extends SpeakToAvatarException {

    /** Why the request was refused. */
    public enum Reason {
        PENDING,
        COOLDOWN,
        BUSY
    }

    private final String roomId;
    private final Reason reason;
    private final long remainingSeconds;

    public ConcurrencyRejectedException(String roomId, Reason reason, long remainingSeconds) {
        super(buildMessage(roomId, reason, remainingSeconds));
        this.roomId = roomId;
        this.reason = reason;
        this.remainingSeconds = remainingSeconds;
    }

    public static ConcurrencyRejectedException pending(String roomId) {
        return new ConcurrencyRejectedException(roomId, Reason.PENDING, 0);
    }

    public static ConcurrencyRejectedException busy(String roomId, Throwable cause) {
        ConcurrencyRejectedException e = new ConcurrencyRejectedException(roomId, Reason.BUSY, 0);
        e.initCause(cause);
        return e;
    }

    public static ConcurrencyRejectedException coolingDown(String roomId, long remainingSeconds) {
        return new ConcurrencyRejectedException(roomId, Reason.COOLDOWN, remainingSeconds);
    }

    public String getRoomId() {
        return roomId;
    }

    public Reason getReason() {
        return reason;
    }

    /** Seconds until a new attempt is allowed; 0 unless {@link Reason#COOLDOWN}. */
    public long getRemainingSeconds() {
        return remainingSeconds;
    }

    private static String buildMessage(String roomId, Reason reason, long remainingSeconds) {
        if (reason == Reason.COOLDOWN) {
            return "Room " + roomId + " recently failed to join, retry in " + remainingSeconds + "s";
        }
        if (reason == Reason.BUSY) {
            return "No join worker free for room " + roomId;
        }
        return "A join for room " + roomId + " is already in progress";
    }
}
