package com.phillippitts.sttserver.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Vosk STT engine.
 * Binds to properties prefixed with "stt.vosk". The model directory comes from {@code stt.model-path}.
 *
 * @param sampleRate Audio sample rate in Hz handed to the recognizer (16000 for this server)
 * @param maxAlternatives Alternatives requested from the recognizer; 0 yields the plain result format
 */
@ConfigurationProperties(prefix = "stt.vosk")
@Validated
public record VoskConfig(
        @Positive(message = "Sample rate must be positive")
        @DefaultValue("16000")
        int sampleRate,

        @PositiveOrZero(message = "Max alternatives must not be negative")
        @DefaultValue("0")
        int maxAlternatives
) {
}
