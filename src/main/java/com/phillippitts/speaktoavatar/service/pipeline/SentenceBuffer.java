package com.phillippitts.speaktoavatar.service.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates streamed text and cuts it into sentences at terminal punctuation.
 *
 * <p>A run of terminators ("?!", "...") stays with the sentence it ends. Text after the last
 * terminator is held until more text arrives or {@link #flush()} is called. Not thread-safe; one
 * buffer belongs to one stream.
 */
public final class SentenceBuffer {

    private static final String TERMINATORS = "。！？.!?";

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Appends a chunk and removes every sentence it completes.
     *
     * @return completed sentences, trimmed, in order; empty if none completed
     */
    public List<String> append(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return List.of();
        }
        buffer.append(chunk);

        List<String> sentences = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < buffer.length()) {
            if (isTerminator(buffer.charAt(i))) {
                int end = i + 1;
                while (end < buffer.length() && isTerminator(buffer.charAt(end))) {
                    end++;
                }
                String sentence = buffer.substring(start, end).trim();
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
                start = end;
                i = end;
            } else {
                i++;
            }
        }
        buffer.delete(0, start);
        return sentences;
    }

    /**
     * Removes and returns whatever text is still held.
     *
     * @return the trimmed remainder, possibly empty
     */
    public String flush() {
        String rest = buffer.toString().trim();
        buffer.setLength(0);
        return rest;
    }

    /** Text held since the last completed sentence. */
    public String pending() {
        return buffer.toString();
    }

    /**
     * Whether a sentence has anything to speak. Sentences made only of punctuation, whitespace
     * or symbols are skipped without a synthesis call.
     */
    public static boolean isSpeakable(String sentence) {
        if (sentence == null) {
            return false;
        }
        return sentence.codePoints().anyMatch(Character::isLetterOrDigit);
    }

    private static boolean isTerminator(char c) {
        return TERMINATORS.indexOf(c) >= 0;
    }
}
