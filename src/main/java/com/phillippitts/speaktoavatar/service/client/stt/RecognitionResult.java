package com.phillippitts.speaktoavatar.service.client.stt;

/**
 * One decoded recognition update.
 *
 * @param text     recognized text so far, empty when the update carried none
 * @param isFinal  whether the service marked this text as final
 * @param sequence server sequence number, or null when absent
 */
public record RecognitionResult(String text, boolean isFinal, Integer sequence) {

    public RecognitionResult {
        text = text == null ? "" : text;
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
