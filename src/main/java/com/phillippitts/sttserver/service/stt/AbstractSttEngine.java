package com.phillippitts.sttserver.service.stt;

import com.phillippitts.sttserver.exception.TranscriptionException;
import com.phillippitts.sttserver.service.stt.util.EngineEventPublisher;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Base class for STT engines providing lifecycle and state management.
 *
 * <p>Template Method: subclasses implement {@link #doInitialize()}, {@link #doClose()},
 * {@link #transcribe(float[])} and {@link #getEngineName()}; this class makes
 * {@link #initialize()} and {@link #close()} idempotent and guards state with {@link #lock}.
 *
 * <p>Lifecycle: uninitialized, then initialized, then closed. A closed engine can only be
 * re-initialized if the subclass resets {@code closed} in {@link #doInitialize()}.
 *
 * @since 1.1
 * @see com.phillippitts.sttserver.service.stt.vosk.VoskSttEngine
 * @see com.phillippitts.sttserver.service.stt.whisper.WhisperSttEngine
 */
public abstract class AbstractSttEngine implements SttEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    // @GuardedBy("lock")
    protected boolean initialized = false;

    // @GuardedBy("lock")
    protected boolean closed = false;

    /**
     * Loads the engine once. Repeated calls on an initialized engine are no-ops.
     *
     * @throws TranscriptionException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return; // Already initialized and not closed
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Engine-specific initialization, called with {@link #lock} held.
     *
     * @throws com.phillippitts.sttserver.exception.ModelNotFoundException if the model is missing
     * @throws TranscriptionException if loading fails for other reasons
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Releases engine resources once. Called by the worker after the queue drains.
     */
    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return; // Already closed
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called with {@link #lock} held. Must not throw; log instead.
     */
    protected abstract void doClose();

    /**
     * Call at the start of {@link #transcribe(float[])}.
     *
     * @throws TranscriptionException if engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new TranscriptionException(
                    getEngineName() + " engine not initialized or closed",
                    getEngineName()
                );
            }
        }
    }

    /**
     * Publishes a failure event and converts the exception to a {@link TranscriptionException}.
     *
     * <pre>{@code
     * try {
     *     return runInference(samples);
     * } catch (Exception e) {
     *     throw handleTranscriptionError(e, publisher, context);
     * }
     * }</pre>
     *
     * @param exception the exception that occurred during transcription
     * @param publisher Spring event publisher for failure events (may be null)
     * @param context additional context to include in failure event (may be null)
     * @return never returns normally
     * @throws TranscriptionException always; an existing one is rethrown without wrapping
     */
    protected final TranscriptionException handleTranscriptionError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(publisher, getEngineName(), "transcription failure", exception, context);

        if (exception instanceof TranscriptionException te) {
            throw te;
        }
        throw new TranscriptionException(
            getEngineName() + " transcription failed: " + exception.getMessage(),
            getEngineName(),
            exception
        );
    }
}
