package com.phillippitts.sttserver.service.stt.whisper;

import com.phillippitts.sttserver.config.stt.WhisperConfig;
import com.phillippitts.sttserver.exception.ModelNotFoundException;
import com.phillippitts.sttserver.service.audio.WavWriter;
import com.phillippitts.sttserver.service.stt.AbstractSttEngine;
import com.phillippitts.sttserver.service.stt.SttEngine;
import com.phillippitts.sttserver.service.stt.SttEngineNames;
import com.phillippitts.sttserver.service.stt.util.EngineEventPublisher;
import com.phillippitts.sttserver.util.LogSanitizer;
import com.phillippitts.sttserver.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link SttEngine} backed by the external whisper.cpp binary and a single GGML model file.
 *
 * <p>Each call writes the samples to a temporary WAV file with {@link WavWriter}, runs
 * whisper.cpp through {@link WhisperProcessManager} and deletes the file afterwards.
 *
 * <p><b>Privacy:</b> Never logs transcript text at INFO level; only duration and character count.
 *
 * @see WhisperProcessManager
 * @see WhisperConfig
 * @since 1.0
 */
public final class WhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);

    private final String modelPath;
    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private final ApplicationEventPublisher publisher;

    public WhisperSttEngine(String modelPath, WhisperConfig cfg, ApplicationEventPublisher publisher) {
        this(modelPath, cfg, new WhisperProcessManager(cfg), publisher);
    }

    WhisperSttEngine(String modelPath, WhisperConfig cfg, WhisperProcessManager manager,
                     ApplicationEventPublisher publisher) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.publisher = publisher;
    }

    /**
     * whisper.cpp loads the model per process, so initialization only checks that the model is a
     * single regular file and the binary exists.
     */
    @Override
    protected void doInitialize() {
        Path model = Path.of(modelPath);
        if (!Files.isRegularFile(model)) {
            EngineEventPublisher.publishFailure(publisher, SttEngineNames.WHISPER, "initialize failure", null,
                    Map.of("modelPath", modelPath));
            throw new ModelNotFoundException(modelPath, Files.isDirectory(model)
                    ? "Whisper expects a single model file but got a directory"
                    : "Whisper model file not found");
        }
        if (!Files.isRegularFile(Path.of(cfg.binaryPath()))) {
            throw new ModelNotFoundException(cfg.binaryPath(), "whisper.cpp binary not found");
        }
        closed = false; // Support reinitialization after close
        LOG.info("Whisper engine initialized: bin={}, model={}, timeout={}s, lang={}, threads={}",
                cfg.binaryPath(), modelPath, cfg.timeoutSeconds(), cfg.language(), cfg.threads());
    }

    @Override
    public String transcribe(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ensureInitialized();
        long startNanos = System.nanoTime();
        Path wav = null;
        try {
            wav = Files.createTempFile(WhisperConstants.TEMP_WAV_PREFIX, ".wav");
            WavWriter.writeSamples(samples, wav);
            String text = normalizeOutput(manager.transcribe(wav, modelPath));
            LOG.debug("Whisper transcribed {} samples in {} ms: {}",
                    samples.length, TimeUtils.elapsedMillis(startNanos), LogSanitizer.preview(text));
            return text;
        } catch (Exception e) {
            throw handleTranscriptionError(e, publisher,
                    Map.of("binaryPath", cfg.binaryPath(), "modelPath", modelPath));
        } finally {
            deleteQuietly(wav);
        }
    }

    /**
     * Joins whisper.cpp's per-segment lines into one space-separated transcript.
     */
    static String normalizeOutput(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        return stdout.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.WHISPER;
    }

    @Override
    protected void doClose() {
        manager.close();
        LOG.info("Whisper engine closed");
    }
}
