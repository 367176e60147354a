package com.phillippitts.sttserver.presentation.controller;

/**
 * Success body of {@code POST /transcribe}.
 *
 * @param text transcript, possibly empty for silence
 */
public record TranscribeResponse(String text) {
}
