package com.phillippitts.sttserver.service.stt;

/**
 * Engine identifiers used in configuration, logs, metric tags and the health payload.
 *
 * @since 1.0
 */
public final class SttEngineNames {

    /** Vosk JNI engine; loads a model directory. */
    public static final String VOSK = "vosk";

    /** whisper.cpp engine; runs an external binary against a single GGML model file. */
    public static final String WHISPER = "whisper";

    private SttEngineNames() {
        // Utility class - prevent instantiation
    }
}
