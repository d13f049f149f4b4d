package com.phillippitts.speaktoavatar.service.client.stt;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/** Wraps raw little-endian PCM in a canonical 44-byte RIFF/WAVE header. */
final class WavEncoder {

    static final int HEADER_BYTES = 44;

    private WavEncoder() {
    }

    static byte[] pcmToWav(byte[] pcm, int sampleRate, int channels, int bitsPerSample) {
        int blockAlign = channels * bitsPerSample / 8;
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(36 + pcm.length);
        buf.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        buf.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(16);
        buf.putShort((short) 1);
        buf.putShort((short) channels);
        buf.putInt(sampleRate);
        buf.putInt(sampleRate * blockAlign);
        buf.putShort((short) blockAlign);
        buf.putShort((short) bitsPerSample);
        buf.put("data".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(pcm.length);
        buf.put(pcm);
        return buf.array();
    }

    /** Bytes of audio covering {@code durationMs} at the given format. */
    static int segmentSize(int sampleRate, int channels, int bitsPerSample, int durationMs) {
        return sampleRate * channels * (bitsPerSample / 8) * durationMs / 1000;
    }
}
