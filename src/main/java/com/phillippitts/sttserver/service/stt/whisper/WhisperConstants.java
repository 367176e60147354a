package com.phillippitts.sttserver.service.stt.whisper;

/**
 * Limits used by {@link WhisperProcessManager} when capturing whisper.cpp output.
 *
 * @see WhisperProcessManager
 * @since 1.0
 */
final class WhisperConstants {

    /** Cap on captured stderr per run (256KB); typical whisper.cpp stderr is under 10KB. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Characters of stderr copied into a failure message. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /** Prefix for per-job temporary WAV files. */
    static final String TEMP_WAV_PREFIX = "stt-job-";

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
