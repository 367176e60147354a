package com.phillippitts.sttserver.util;

/**
 * Privacy-safe rendering of transcripts for logs. INFO lines carry only lengths; previews are
 * reserved for DEBUG.
 */
public final class LogSanitizer {

    /** Characters of transcript shown in DEBUG previews. */
    public static final int PREVIEW_CHARS = 40;

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
     * Short DEBUG preview of a transcript, e.g. {@code "hello wor..." (42 chars)}.
     */
    public static String preview(String transcript) {
        if (transcript == null) {
            return "(null)";
        }
        String head = truncate(transcript, PREVIEW_CHARS).replace('\n', ' ');
        String ellipsis = transcript.length() > PREVIEW_CHARS ? "..." : "";
        return "\"" + head + ellipsis + "\" (" + transcript.length() + " chars)";
    }
}
