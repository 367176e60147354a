package com.phillippitts.sttserver.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Whisper STT engine.
 * Binds to properties prefixed with "stt.whisper". The model file itself comes from
 * {@code stt.model-path}.
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/whisper-cli
 * stt.whisper.timeout-seconds=300
 * stt.whisper.language=en
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param timeoutSeconds Maximum time one transcription may run (in seconds)
 * @param language Language code for transcription (e.g., "en", "es", "fr")
 * @param threads Number of CPU threads whisper.cpp uses
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/whisper-cli")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("300")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("en")
        String language,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {
}
