package com.phillippitts.sttserver.config.stt;

import com.phillippitts.sttserver.service.stt.SttEngine;
import com.phillippitts.sttserver.service.stt.vosk.VoskSttEngine;
import com.phillippitts.sttserver.service.stt.whisper.WhisperSttEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EngineKindTest {

    private final EngineKind.EngineSettings settings = new EngineKind.EngineSettings(
            new WhisperConfig("/bin/echo", 10, "en", 2, 1048576),
            new VoskConfig(16_000, 0),
            null);

    @Test
    void whisperBuildsUninitializedWhisperEngine() {
        SttEngine engine = EngineKind.WHISPER.createEngine("/models/ggml-base.en.bin", settings);

        assertThat(engine).isInstanceOf(WhisperSttEngine.class);
        assertThat(engine.getEngineName()).isEqualTo("whisper");
        assertThat(engine.isHealthy()).isFalse();
    }

    @Test
    void voskBuildsUninitializedVoskEngine() {
        SttEngine engine = EngineKind.VOSK.createEngine("/models/vosk-model-small-en-us-0.15", settings);

        assertThat(engine).isInstanceOf(VoskSttEngine.class);
        assertThat(engine.getEngineName()).isEqualTo("vosk");
        assertThat(engine.isHealthy()).isFalse();
    }

    @Test
    void modelShapeDiffersPerEngine() {
        assertThat(EngineKind.WHISPER.requiresDirectoryModel()).isFalse();
        assertThat(EngineKind.VOSK.requiresDirectoryModel()).isTrue();
    }

    @Test
    void engineNamesMatchConfigurationValues() {
        assertThat(EngineKind.WHISPER.engineName()).isEqualTo("whisper");
        assertThat(EngineKind.VOSK.engineName()).isEqualTo("vosk");
    }
}
