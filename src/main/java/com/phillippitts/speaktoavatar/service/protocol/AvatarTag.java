package com.phillippitts.speaktoavatar.service.protocol;

import java.nio.charset.StandardCharsets;

/**
 * Fixed 8-byte ASCII prefixes of the avatar control channel.
 *
 * <p>{@code |DAT|02|} is used in both directions: outbound it prefixes raw streaming audio
 * in a binary message, inbound it prefixes a JSON status event in a text message.
 */
public enum AvatarTag {
    START_LIVE("|CTL|00|"),
    STOP_LIVE("|CTL|01|"),
    INTERRUPT("|CTL|03|"),
    FINISH_AUDIO("|CTL|12|"),
    AUDIO_URL("|DAT|01|"),
    STREAMING_AUDIO("|DAT|02|"),
    STRUCTURED_AUDIO("|DAT|04|"),
    ACK("|MSG|00|"),
    ERROR("|MSG|01|"),
    HEARTBEAT("|MSG|02|");

    public static final int LENGTH = 8;

    private final String tag;

    AvatarTag(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public byte[] bytes() {
        return tag.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Looks up an inbound text message's tag. Outbound-only control tags are never returned.
     *
     * @return matching tag, or null when the message has none this client understands
     */
    public static AvatarTag ofInbound(String message) {
        if (message == null || message.length() < LENGTH) {
            return null;
        }
        String prefix = message.substring(0, LENGTH);
        if (ACK.tag.equals(prefix)) {
            return ACK;
        }
        if (ERROR.tag.equals(prefix)) {
            return ERROR;
        }
        if (HEARTBEAT.tag.equals(prefix)) {
            return HEARTBEAT;
        }
        if (STREAMING_AUDIO.tag.equals(prefix)) {
            return STREAMING_AUDIO;
        }
        return null;
    }
}
