package com.phillippitts.mathspeech.util;

/** Utility for bounded logging of expression text. */
public final class LogSanitizer {

    static final int DEFAULT_PREVIEW = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for log messages: control characters become spaces and text longer
     * than {@value #DEFAULT_PREVIEW} characters is cut with a length suffix.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ");
        if (flat.length() <= DEFAULT_PREVIEW) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW) + "...(" + s.length() + " chars)";
    }
}
