package com.phillippitts.vani.util;

/**
 * Keeps utterance text out of logs beyond a short preview.
 */
public final class LogSanitizer {

    /** Default preview length for transcripts and replies. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Single-line preview: line breaks collapsed, cut at {@code max} characters with the full
     * length appended, e.g. {@code "what is the capital of…" (57 chars)}.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("\\s+", " ").trim();
        if (max <= 0) {
            return "(" + oneLine.length() + " chars)";
        }
        if (oneLine.length() <= max) {
            return oneLine;
        }
        return oneLine.substring(0, max) + "… (" + oneLine.length() + " chars)";
    }

    public static String preview(String s) {
        return preview(s, PREVIEW_CHARS);
    }
}
