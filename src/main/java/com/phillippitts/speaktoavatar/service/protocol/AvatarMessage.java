package com.phillippitts.speaktoavatar.service.protocol;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;

/**
 * A tagged avatar control-channel message.
 *
 * @param tag  8-byte prefix
 * @param body text after the prefix, possibly empty
 */
public record AvatarMessage(AvatarTag tag, String body) {

    public AvatarMessage {
        if (tag == null) {
            throw new IllegalArgumentException("tag must not be null");
        }
        body = body == null ? "" : body;
    }

    /** Tag-only control message such as stop-live or interrupt. */
    public static AvatarMessage control(AvatarTag tag) {
        return new AvatarMessage(tag, "");
    }

    public static AvatarMessage json(AvatarTag tag, JSONObject body) {
        return new AvatarMessage(tag, body.toString());
    }

    /** SSML audio-url drive message. */
    public static AvatarMessage audioUrl(String url, String format) {
        return new AvatarMessage(AvatarTag.AUDIO_URL,
                "<speak><audio url=\"" + url + "\" format=\"" + format + "\"/></speak>");
    }

    /** Base64 audio wrapped in JSON, with optional extra data passed through to the avatar. */
    public static AvatarMessage structuredAudio(byte[] audio, String extraData) {
        JSONObject body = new JSONObject().put("audio", Base64.getEncoder().encodeToString(audio));
        if (extraData != null) {
            body.put("extra_data", extraData);
        }
        return json(AvatarTag.STRUCTURED_AUDIO, body);
    }

    /**
     * Streaming audio frame: the tag followed directly by the raw bytes, with no length
     * prefix. The WebSocket message boundary delimits the frame.
     */
    public static byte[] streamingAudio(byte[] audio) {
        byte[] tag = AvatarTag.STREAMING_AUDIO.bytes();
        byte[] out = new byte[tag.length + audio.length];
        System.arraycopy(tag, 0, out, 0, tag.length);
        System.arraycopy(audio, 0, out, tag.length, audio.length);
        return out;
    }

    /**
     * Parses an inbound text message.
     *
     * @return parsed message, or null when the tag is not one this client understands
     */
    public static AvatarMessage parse(String text) {
        AvatarTag tag = AvatarTag.ofInbound(text);
        if (tag == null) {
            return null;
        }
        return new AvatarMessage(tag, text.substring(AvatarTag.LENGTH));
    }

    public String encode() {
        return tag.tag() + body;
    }

    /** Body as JSON, or an empty object when it is blank or not JSON. */
    public JSONObject bodyAsJson() {
        if (body.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            return new JSONObject();
        }
    }
}
