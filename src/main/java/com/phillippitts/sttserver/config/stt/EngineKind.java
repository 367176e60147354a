package com.phillippitts.sttserver.config.stt;

import com.phillippitts.sttserver.service.stt.SttEngine;
import com.phillippitts.sttserver.service.stt.SttEngineNames;
import com.phillippitts.sttserver.service.stt.vosk.VoskSttEngine;
import com.phillippitts.sttserver.service.stt.whisper.WhisperSttEngine;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Selectable transcription engines ({@code stt.engine}). Each constant knows the shape its model
 * path must have and how to build its engine, so adding an engine leaves the dispatcher untouched.
 */
public enum EngineKind {

    /** whisper.cpp; the model path names a single GGML file. */
    WHISPER(SttEngineNames.WHISPER, false) {
        @Override
        public SttEngine createEngine(String modelPath, EngineSettings settings) {
            return new WhisperSttEngine(modelPath, settings.whisper(), settings.publisher());
        }
    },

    /** Vosk JNI; the model path names a model directory. */
    VOSK(SttEngineNames.VOSK, true) {
        @Override
        public SttEngine createEngine(String modelPath, EngineSettings settings) {
            return new VoskSttEngine(modelPath, settings.vosk(), settings.publisher());
        }
    };

    private final String engineName;
    private final boolean directoryModel;

    EngineKind(String engineName, boolean directoryModel) {
        this.engineName = engineName;
        this.directoryModel = directoryModel;
    }

    /**
     * Builds an uninitialized engine. Loading happens when the worker starts.
     *
     * @param modelPath configured model path
     * @param settings engine-specific configuration
     * @return new engine
     */
    public abstract SttEngine createEngine(String modelPath, EngineSettings settings);

    public String engineName() {
        return engineName;
    }

    /**
     * @return true if the model path must be a directory, false if it must be a regular file
     */
    public boolean requiresDirectoryModel() {
        return directoryModel;
    }

    /**
     * Engine-specific configuration bundle.
     */
    public record EngineSettings(WhisperConfig whisper, VoskConfig vosk, ApplicationEventPublisher publisher) {
    }
}
