package com.phillippitts.speaktoavatar.service.pipeline;

import jakarta.validation.constraints.NotBlank;

/**
 * A query to answer, speak and optionally play through a live avatar.
 *
 * @param query     user question
 * @param userId    user id passed to the LLM; {@code "default_user"} when blank
 * @param sessionId stream id; generated when blank
 * @param speaker   TTS voice; {@code BV001_streaming} when blank
 * @param liveId    room whose avatar speaks the answer; none when blank
 */
public record QueryRequest(
        @NotBlank(message = "query must not be blank") String query,
        String userId,
        String sessionId,
        String speaker,
        String liveId) {

    public static final String DEFAULT_USER = "default_user";
    public static final String DEFAULT_SPEAKER = "BV001_streaming";

    public QueryRequest {
        userId = isBlank(userId) ? DEFAULT_USER : userId;
        sessionId = isBlank(sessionId) ? null : sessionId;
        speaker = isBlank(speaker) ? DEFAULT_SPEAKER : speaker;
        liveId = isBlank(liveId) ? null : liveId;
    }

    public static QueryRequest of(String query) {
        return new QueryRequest(query, null, null, null, null);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
