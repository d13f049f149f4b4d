package com.phillippitts.speaktoavatar.service.pipeline;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One progress notification of a streamed query, sent to the caller as a JSON object whose
 * {@code type} field is the event's wire name.
 *
 * @param type   event kind
 * @param fields event payload, in insertion order
 */
public record StreamEvent(Type type, Map<String, Object> fields) {

    public enum Type {
        START("start"),
        TEXT_CHUNK("text_chunk"),
        SENTENCE_COMPLETE("sentence_complete"),
        AUDIO_CHUNK("audio_chunk"),
        SENTENCE_PROCESSED("sentence_processed"),
        TTS_ERROR("tts_error"),
        FINAL_SENTENCE("final_sentence"),
        FINAL_AUDIO_CHUNK("final_audio_chunk"),
        FINAL_TTS_ERROR("final_tts_error"),
        CANCELLED("cancelled"),
        COMPLETE("complete"),
        ERROR("error");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /** Whether this event ends the stream. */
        public boolean isTerminal() {
            return this == CANCELLED || this == COMPLETE || this == ERROR;
        }
    }

    public StreamEvent {
        Objects.requireNonNull(type, "type must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public static StreamEvent start(String sessionId, String query) {
        return of(Type.START, "session_id", sessionId, "query", query);
    }

    public static StreamEvent textChunk(String content, String accumulatedText) {
        return of(Type.TEXT_CHUNK, "content", content, "accumulated_text", accumulatedText);
    }

    /**
     * @param leftover true for the sentence flushed from the buffer after the text stream ended
     */
    public static StreamEvent sentence(String sentence, boolean leftover) {
        return of(leftover ? Type.FINAL_SENTENCE : Type.SENTENCE_COMPLETE,
                "sentence", sentence, "status", "processing_audio");
    }

    public static StreamEvent audioChunk(String sentence, int audioSize, boolean leftover) {
        return of(leftover ? Type.FINAL_AUDIO_CHUNK : Type.AUDIO_CHUNK,
                "sentence", sentence, "audio_size", audioSize, "status", "driving_avatar");
    }

    public static StreamEvent sentenceProcessed(String sentence) {
        return of(Type.SENTENCE_PROCESSED, "sentence", sentence, "status", "complete");
    }

    public static StreamEvent ttsError(String sentence, String error, boolean leftover) {
        return of(leftover ? Type.FINAL_TTS_ERROR : Type.TTS_ERROR, "sentence", sentence, "error", error);
    }

    public static StreamEvent cancelled(String sessionId) {
        return of(Type.CANCELLED, "session_id", sessionId);
    }

    public static StreamEvent complete(String fullText, String sessionId) {
        return of(Type.COMPLETE, "full_text", fullText, "session_id", sessionId, "status", "finished");
    }

    public static StreamEvent error(String message, String sessionId) {
        return of(Type.ERROR, "message", message, "session_id", sessionId);
    }

    /** Field value, or null when absent. */
    public Object get(String field) {
        return fields.get(field);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("type", type.wireName);
        fields.forEach(json::put);
        return json;
    }

    private static StreamEvent of(Type type, Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1] == null ? JSONObject.NULL : keyValues[i + 1]);
        }
        return new StreamEvent(type, map);
    }
}
