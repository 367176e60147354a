package com.phillippitts.sttserver.service.audio;

/**
 * Single source of truth for the audio format accepted at the HTTP boundary.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /**
     * Divisor mapping a signed 16-bit sample to a float. Note that -32768 maps slightly below -1.0.
     */
    public static final float NORMALIZATION_DIVISOR = 32767.0f;

    /** Length of the warm-up chunk in seconds. */
    public static final int CHUNK_SECONDS = 10;
    /** Samples in one warm-up chunk. */
    public static final int SAMPLES_PER_CHUNK = REQUIRED_SAMPLE_RATE * CHUNK_SECONDS;   // 160,000

    /** Size of the canonical PCM WAV header written for whisper.cpp. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}
}
