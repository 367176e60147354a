package com.phillippitts.sttserver.service.stt.vosk;

import com.phillippitts.sttserver.config.stt.VoskConfig;
import com.phillippitts.sttserver.exception.ModelNotFoundException;
import com.phillippitts.sttserver.exception.TranscriptionExceptionBuilder;
import com.phillippitts.sttserver.service.audio.PcmCodec;
import com.phillippitts.sttserver.service.stt.AbstractSttEngine;
import com.phillippitts.sttserver.service.stt.SttEngineNames;
import com.phillippitts.sttserver.service.stt.util.EngineEventPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.vosk.Model;
import org.vosk.Recognizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Vosk-based implementation of the SttEngine interface.
 *
 * <p>The model directory is loaded once in {@link #initialize()}. A fresh recognizer is created for
 * every call so no decoder state leaks from one job into the next.
 *
 * <p>Samples are re-encoded to PCM16LE because the JNI recognizer consumes bytes.
 */
public class VoskSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(VoskSttEngine.class);

    private final String modelPath;
    private final VoskConfig config;
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private Model model;           // JNI resource

    public VoskSttEngine(String modelPath, VoskConfig config) {
        this(modelPath, config, null);
    }

    public VoskSttEngine(String modelPath, VoskConfig config, ApplicationEventPublisher publisher) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
    }

    @Override
    protected void doInitialize() {
        LOG.info("Initializing Vosk engine: modelPath={}, sampleRate={}, maxAlternatives={}",
                modelPath, config.sampleRate(), config.maxAlternatives());
        Path modelDir = Path.of(modelPath);
        if (!Files.isDirectory(modelDir)) {
            throw new ModelNotFoundException(modelPath, Files.exists(modelDir)
                    ? "Vosk expects a model directory but got a file"
                    : "Vosk model directory not found");
        }
        try {
            this.model = new Model(modelPath);
            closed = false; // Support reinitialization after close
            LOG.info("Vosk engine initialized");
        } catch (Throwable t) {
            safeCloseUnlocked();
            EngineEventPublisher.publishFailure(publisher, SttEngineNames.VOSK, "initialize failure", t,
                    Map.of("modelPath", modelPath, "sampleRate", String.valueOf(config.sampleRate())));
            throw TranscriptionExceptionBuilder.create("Failed to initialize Vosk")
                    .engine(SttEngineNames.VOSK)
                    .cause(t)
                    .metadata("modelPath", modelPath)
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
    }

    @Override
    public String transcribe(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ensureInitialized();
        Model localModel;
        synchronized (lock) {
            localModel = this.model;
        }
        byte[] pcm = PcmCodec.encode(samples);
        LOG.debug("Vosk: feeding {} samples ({} bytes) to recognizer", samples.length, pcm.length);
        try (Recognizer recognizer = new Recognizer(localModel, config.sampleRate())) {
            recognizer.setMaxAlternatives(config.maxAlternatives());
            recognizer.acceptWaveForm(pcm, pcm.length);
            String json = recognizer.getFinalResult();
            LOG.debug("Vosk: final result JSON length={} chars", json == null ? 0 : json.length());
            return VoskJsonParser.parseText(json);
        } catch (Exception e) {
            throw handleTranscriptionError(e, publisher, Map.of("samples", String.valueOf(samples.length)));
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.VOSK;
    }

    @Override
    protected void doClose() {
        safeCloseUnlocked();
        LOG.info("Vosk engine closed");
    }

    // GuardedBy: lock (caller must hold lock)
    private void safeCloseUnlocked() {
        if (model != null) {
            try {
                model.close();
            } catch (Throwable t) {
                LOG.warn("Error closing model", t);
            }
            model = null;
        }
    }
}
