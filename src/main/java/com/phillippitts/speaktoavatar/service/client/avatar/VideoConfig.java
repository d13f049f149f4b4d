package com.phillippitts.speaktoavatar.service.client.avatar;

import org.json.JSONObject;

/**
 * Output video settings. Values outside the ranges the service accepts are clamped:
 * width and height to 240..1920 pixels, bitrate to 100..8000 kbps.
 */
public record VideoConfig(int width, int height, int bitrate) {

    static final int MIN_DIMENSION = 240;
    static final int MAX_DIMENSION = 1920;
    static final int MIN_BITRATE = 100;
    static final int MAX_BITRATE = 8000;

    public VideoConfig {
        width = clamp(width, MIN_DIMENSION, MAX_DIMENSION);
        height = clamp(height, MIN_DIMENSION, MAX_DIMENSION);
        bitrate = clamp(bitrate, MIN_BITRATE, MAX_BITRATE);
    }

    public static VideoConfig defaults() {
        return new VideoConfig(1280, 720, 2000);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("video_width", width)
                .put("video_height", height)
                .put("bitrate", bitrate);
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
