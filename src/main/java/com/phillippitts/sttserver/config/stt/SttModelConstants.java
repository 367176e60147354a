package com.phillippitts.sttserver.config.stt;

/**
 * Constants related to Speech-to-Text models and binaries.
 */
public final class SttModelConstants {

    /**
     * Smallest plausible GGML model file. ggml-tiny is about 75MB; anything under 1MB is a
     * placeholder or a truncated download.
     */
    public static final long MIN_WHISPER_MODEL_SIZE_BYTES = 1024L * 1024; // 1 MB

    /** Subdirectories every Vosk model ships with. */
    public static final String[] VOSK_REQUIRED_SUBDIRS = {"am", "conf"};

    private SttModelConstants() {}
}
