package com.phillippitts.speaktoavatar.util;

/** Utility for privacy-safe logging of user text and credentials. */
public final class LogSanitizer {

    private static final int PREVIEW_LENGTH = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short preview of user text for INFO-level logs, with an ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= PREVIEW_LENGTH ? s : truncate(s, PREVIEW_LENGTH) + "...";
    }

    /**
     * Masks a credential so only its first four characters reach the log.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<unset>";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return secret.substring(0, 4) + "****";
    }
}
