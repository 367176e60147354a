package com.phillippitts.sttserver.service.stt.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts the transcript from a Vosk final-result JSON document.
 *
 * <p>Handles both shapes the recognizer emits:
 * <ul>
 *   <li>{@code {"text": "..."}} when max-alternatives is 0</li>
 *   <li>{@code {"alternatives": [{"text": "...", "confidence": ...}, ...]}} otherwise; the first
 *       alternative is the best one</li>
 * </ul>
 *
 * <p>Output larger than {@link #MAX_JSON_SIZE} is truncated before parsing.
 *
 * @since 1.0
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    /** Cap on recognizer output accepted for parsing (1MB). */
    static final int MAX_JSON_SIZE = 1_048_576;

    private VoskJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @param json final result from {@code Recognizer.getFinalResult()}
     * @return trimmed transcript, empty for blank or unparseable input
     */
    static String parseText(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        String bounded = json;
        if (bounded.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            bounded = bounded.substring(0, MAX_JSON_SIZE);
        }
        try {
            JSONObject obj = new JSONObject(bounded);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                return alternatives.isEmpty() ? "" : alternatives.getJSONObject(0).optString("text", "").trim();
            }
            return obj.optString("text", "").trim();
        } catch (JSONException e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars)", bounded.length(), e);
            return "";
        }
    }
}
