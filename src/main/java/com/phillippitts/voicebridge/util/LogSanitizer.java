package com.phillippitts.voicebridge.util;

/** Utility for privacy-safe logging of transcript and reply previews. */
public final class LogSanitizer {
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
     * Single-line preview for DEBUG logs: newlines collapsed, then truncated with an ellipsis marker.
     */
    public static String preview(String s, int max) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= max ? flat : truncate(flat, max) + "...";
    }
}
