package com.phillippitts.sttserver.config.stt;

import com.phillippitts.sttserver.exception.ModelNotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validates the configured model path and, for whisper, the binary at startup.
 *
 * <p>Fail-fast: a missing artifact or a path of the wrong shape for the selected engine
 * (file vs. directory) aborts startup with an actionable {@link ModelNotFoundException}
 * before the worker tries to load anything.
 */
@Component
@ConditionalOnProperty(name = "stt.validation.enabled", havingValue = "true", matchIfMissing = true)
class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private static final long BYTES_PER_MB = 1024 * 1024;

    private final SttServerProperties properties;
    private final WhisperConfig whisper;

    ModelValidationService(SttServerProperties properties, WhisperConfig whisper) {
        this.properties = properties;
        this.whisper = whisper;
    }

    @PostConstruct
    void validateOnStartup() {
        EngineKind engine = properties.engine();
        LOG.info("Validating STT model for engine={}... os={}, arch={}",
                engine.engineName(), System.getProperty("os.name"), System.getProperty("os.arch"));

        Path model = resolvePath(properties.modelPath(), "Model path");
        validateModelShape(engine, model);
        if (engine == EngineKind.WHISPER) {
            validateWhisperModelSize(model);
            validateWhisperBinary(resolvePath(whisper.binaryPath(), "Whisper binary"));
        } else {
            validateVoskDirectoryStructure(model);
        }
        LOG.info("STT validation complete: engine={}, model='{}'", engine.engineName(), model);
    }

    // Package-private for hermetic tests
    void validateModelShape(EngineKind engine, Path model) {
        if (!Files.exists(model)) {
            throw new ModelNotFoundException(model.toString(), engine.engineName() + " model not found");
        }
        if (engine.requiresDirectoryModel() && !Files.isDirectory(model)) {
            throw new ModelNotFoundException(model.toString(),
                    engine.engineName() + " expects a model directory but got a file");
        }
        if (!engine.requiresDirectoryModel() && !Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toString(),
                    engine.engineName() + " expects a single model file but got a directory");
        }
    }

    void validateVoskDirectoryStructure(Path modelDir) {
        for (String subdir : SttModelConstants.VOSK_REQUIRED_SUBDIRS) {
            if (!Files.isDirectory(modelDir.resolve(subdir))) {
                throw new ModelNotFoundException(modelDir.toString(),
                        "Missing expected Vosk model subdirectory '" + subdir + "'");
            }
        }
    }

    void validateWhisperModelSize(Path model) {
        try {
            long sizeBytes = Files.size(model);
            if (sizeBytes < SttModelConstants.MIN_WHISPER_MODEL_SIZE_BYTES) {
                throw new ModelNotFoundException(model.toString(),
                        "Whisper model too small (" + sizeBytes + " bytes)");
            }
            LOG.info("Whisper model size: {} MB", sizeBytes / BYTES_PER_MB);
        } catch (IOException e) {
            throw new ModelNotFoundException(model.toString(), "Failed to read Whisper model metadata", e);
        }
    }

    void validateWhisperBinary(Path binary) {
        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException(binary.toString(), "Whisper binary not found");
        }
        if (!Files.isExecutable(binary)) {
            String os = System.getProperty("os.name", "").toLowerCase();
            String hint = os.contains("mac")
                ? " (try: chmod +x '" + binary + "' && xattr -dr com.apple.quarantine '" + binary + "')"
                : " (try: chmod +x '" + binary + "')";
            throw new ModelNotFoundException(binary.toString(), "Whisper binary not executable" + hint);
        }
    }

    /**
     * Resolves a relative path against the working directory, warning so production configs use
     * absolute paths.
     */
    private Path resolvePath(String pathString, String description) {
        Path path = Paths.get(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        Path resolved = path.toAbsolutePath().normalize();
        LOG.warn("{} uses relative path '{}' - resolved to '{}'. "
                + "Consider using absolute paths in production to avoid ambiguity.",
                description, pathString, resolved);
        return resolved;
    }
}
