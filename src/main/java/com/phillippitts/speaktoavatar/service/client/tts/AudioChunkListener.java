package com.phillippitts.speaktoavatar.service.client.tts;

/**
 * Receives synthesized audio chunks in arrival order. The next chunk is not read from the socket
 * until this call returns.
 */
@FunctionalInterface
public interface AudioChunkListener {

    /**
     * @param chunk raw PCM bytes
     * @param index zero-based position of the chunk within the synthesis
     */
    void onAudioChunk(byte[] chunk, int index);
}
