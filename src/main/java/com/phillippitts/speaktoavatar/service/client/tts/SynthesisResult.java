package com.phillippitts.speaktoavatar.service.client.tts;

/**
 * What one synthesis delivered.
 *
 * @param chunks     audio chunks handed to the listener
 * @param audioBytes total bytes handed to the listener
 * @param cancelled  true if cancellation stopped delivery early
 */
public record SynthesisResult(int chunks, long audioBytes, boolean cancelled) {

    public static SynthesisResult cancelledBeforeStart() {
        return new SynthesisResult(0, 0, true);
    }
}
