package com.phillippitts.sttserver.service.stt;

import com.phillippitts.sttserver.exception.ModelNotFoundException;
import com.phillippitts.sttserver.exception.TranscriptionException;

/**
 * Contract for Speech-to-Text (STT) engine implementations.
 * Adapts different STT libraries (Vosk JNI, whisper.cpp process) behind a single synchronous call.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with its model path and configuration</li>
 *   <li>{@link #initialize()} loads the model (may throw {@link ModelNotFoundException})</li>
 *   <li>{@link #transcribe(float[])} processes one chunk of audio (may throw {@link TranscriptionException})</li>
 *   <li>{@link #close()} releases resources when engine is no longer needed</li>
 * </ol>
 *
 * <p>Thread Safety: Implementations are NOT required to support concurrent transcriptions.
 * The transcription worker is the only caller of {@link #transcribe(float[])}.
 *
 * @see ModelNotFoundException
 * @see TranscriptionException
 */
public interface SttEngine extends AutoCloseable {

    /**
     * Loads the model and prepares resources. Called once before the worker starts.
     *
     * @throws ModelNotFoundException if the model cannot be found or loaded
     * @throws TranscriptionException if engine initialization fails for other reasons
     */
    void initialize();

    /**
     * Transcribes normalized mono 16 kHz samples to text.
     *
     * @param samples audio normalized to roughly [-1.0, 1.0]
     * @return transcript, possibly empty for silence
     * @throws TranscriptionException if transcription fails (timeout, engine error, etc.)
     * @throws IllegalArgumentException if samples is null
     */
    String transcribe(float[] samples);

    /**
     * Returns the name of this STT engine for logging and monitoring.
     *
     * @return Engine name (e.g., "vosk", "whisper")
     */
    String getEngineName();

    /**
     * @return true if the engine is initialized and not closed
     */
    boolean isHealthy();

    /**
     * Releases all resources held by this engine. Safe to call even if initialization failed.
     */
    @Override
    void close();
}
