package com.phillippitts.speaktoavatar.service.protocol;

/**
 * Message-type-specific flag bits (low nibble of header byte 1).
 *
 * <p>Bit 0 means a sequence number follows, bit 1 marks the last packet, bit 2 means an
 * event code follows. {@link #NEG_SEQUENCE} sets both bit 0 and bit 1: the sequence is present
 * and negated because the packet is the last one.
 */
public final class MessageFlags {

    public static final int NONE = 0b0000;
    public static final int POS_SEQUENCE = 0b0001;
    public static final int LAST_NO_SEQUENCE = 0b0010;
    public static final int NEG_SEQUENCE = 0b0011;
    public static final int WITH_EVENT = 0b0100;

    private MessageFlags() {
    }

    public static boolean hasSequence(int flags) {
        return (flags & POS_SEQUENCE) != 0;
    }

    public static boolean isLastPacket(int flags) {
        return (flags & LAST_NO_SEQUENCE) != 0;
    }

    public static boolean hasEvent(int flags) {
        return (flags & WITH_EVENT) != 0;
    }
}
