package com.purchasingpower.orchestrator.util;

/**
 * Helpers for keeping log lines readable.
 */
public final class LogText {

    private LogText() {
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "null";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... (" + text.length() + " chars total)";
    }

    /**
     * Substring from the first '{' to the last '}', or null when there is no JSON object.
     * Models like to wrap JSON in prose or code fences.
     */
    public static String extractJson(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
