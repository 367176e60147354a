package com.phillippitts.sttserver.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SttConfigurationBindingTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private static Binder binder(Map<String, String> properties) {
        return new Binder(new MapConfigurationPropertySource(properties));
    }

    @Test
    void serverPropertiesFallBackToDefaults() {
        SttServerProperties props = binder(Map.of("stt.model-path", "/models/ggml-base.en.bin"))
                .bind("stt", SttServerProperties.class)
                .get();

        assertThat(props.engine()).isEqualTo(EngineKind.WHISPER);
        assertThat(props.modelPath()).isEqualTo("/models/ggml-base.en.bin");
        assertThat(props.server().queueCapacity()).isEqualTo(8);
        assertThat(props.server().maxBytes()).isEqualTo(50_000_000L);
        assertThat(props.server().warmUpEnabled()).isTrue();
    }

    @Test
    void serverPropertiesBindEngineCaseInsensitively() {
        SttServerProperties props = binder(Map.of(
                "stt.engine", "vosk",
                "stt.model-path", "/models/vosk",
                "stt.server.queue-capacity", "2",
                "stt.server.max-bytes", "1000",
                "stt.server.warm-up-enabled", "false"))
                .bind("stt", SttServerProperties.class)
                .get();

        assertThat(props.engine()).isEqualTo(EngineKind.VOSK);
        assertThat(props.server().queueCapacity()).isEqualTo(2);
        assertThat(props.server().maxBytes()).isEqualTo(1000L);
        assertThat(props.server().warmUpEnabled()).isFalse();
    }

    @Test
    void whisperConfigDefaults() {
        WhisperConfig cfg = binder(Map.of("stt.whisper.language", "de"))
                .bind("stt.whisper", WhisperConfig.class)
                .get();

        assertThat(cfg.binaryPath()).isEqualTo("tools/whisper.cpp/whisper-cli");
        assertThat(cfg.timeoutSeconds()).isEqualTo(300);
        assertThat(cfg.language()).isEqualTo("de");
        assertThat(cfg.threads()).isEqualTo(4);
        assertThat(cfg.maxStdoutBytes()).isEqualTo(1048576);
    }

    @Test
    void voskConfigDefaults() {
        VoskConfig cfg = binder(Map.of("stt.vosk.sample-rate", "16000"))
                .bind("stt.vosk", VoskConfig.class)
                .get();

        assertThat(cfg.sampleRate()).isEqualTo(16_000);
        assertThat(cfg.maxAlternatives()).isZero();
    }

    @Test
    void rejectsBlankModelPath() {
        SttServerProperties props = new SttServerProperties(EngineKind.WHISPER, " ",
                new SttServerProperties.Server(8, 50_000_000L, true));

        Set<ConstraintViolation<SttServerProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("stt.model-path (--model-path) is required");
    }

    @Test
    void rejectsNonPositiveQueueCapacity() {
        SttServerProperties props = new SttServerProperties(EngineKind.VOSK, "/models/vosk",
                new SttServerProperties.Server(0, 50_000_000L, true));

        Set<ConstraintViolation<SttServerProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Queue capacity must be positive");
    }

    @Test
    void rejectsMaxBytesBeyondSingleBuffer() {
        SttServerProperties props = new SttServerProperties(EngineKind.WHISPER, "/models/ggml.bin",
                new SttServerProperties.Server(8, 3_000_000_000L, true));

        Set<ConstraintViolation<SttServerProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Max bytes must fit in a single request buffer");
    }

    @Test
    void acceptsLargestSingleBufferMaxBytes() {
        SttServerProperties props = new SttServerProperties(EngineKind.WHISPER, "/models/ggml.bin",
                new SttServerProperties.Server(8, SttServerProperties.Server.MAX_BODY_BYTES, true));

        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    void rejectsInvalidWhisperSettings() {
        WhisperConfig cfg = new WhisperConfig("", 0, "en", 2, 1048576);

        Set<ConstraintViolation<WhisperConfig>> violations = validator.validate(cfg);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("Whisper binary path must not be blank", "Timeout must be positive");
    }

    @Test
    void rejectsNegativeMaxAlternatives() {
        Set<ConstraintViolation<VoskConfig>> violations = validator.validate(new VoskConfig(16_000, -1));

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Max alternatives must not be negative");
    }
}
