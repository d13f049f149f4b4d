package com.phillippitts.speaktoavatar.service.llm;

import java.util.function.Predicate;

/**
 * Conversational backend that answers a query as a stream of text deltas.
 */
public interface LlmClient {

    /**
     * Opens a conversation for a user.
     *
     * @return the conversation id to pass to {@link #chatStream}
     */
    String createConversation(String userId);

    /**
     * Sends a query and hands each non-empty text delta to {@code onDelta} in arrival order.
     * Returns when the answer ends or when {@code onDelta} returns false.
     *
     * @param onDelta receives each delta; returning false stops reading the answer
     * @return number of deltas delivered
     */
    int chatStream(String userId, String conversationId, String query, Predicate<String> onDelta);
}
