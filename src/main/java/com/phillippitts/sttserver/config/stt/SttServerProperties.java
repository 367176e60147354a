package com.phillippitts.sttserver.config.stt;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Top-level server configuration. Binds to properties prefixed with "stt".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.engine=whisper
 * stt.model-path=models/ggml-base.en.bin
 * stt.server.queue-capacity=8
 * stt.server.max-bytes=50000000
 * stt.server.warm-up-enabled=true
 * </pre>
 *
 * @param engine which engine to load
 * @param modelPath model file (whisper) or model directory (vosk)
 * @param server dispatcher and HTTP limits
 */
@ConfigurationProperties(prefix = "stt")
@Validated
public record SttServerProperties(
        @NotNull
        @DefaultValue("whisper")
        EngineKind engine,

        @NotBlank(message = "stt.model-path (--model-path) is required")
        String modelPath,

        @Valid
        @DefaultValue
        Server server
) {

    /**
     * @param queueCapacity jobs that may wait for the worker; excess submissions are rejected
     * @param maxBytes largest accepted request body
     * @param warmUpEnabled run one inference on silence before serving
     */
    public record Server(
            @Positive(message = "Queue capacity must be positive")
            @DefaultValue("8")
            int queueCapacity,

            @Positive(message = "Max bytes must be positive")
            @Max(value = Server.MAX_BODY_BYTES, message = "Max bytes must fit in a single request buffer")
            @DefaultValue("50000000")
            long maxBytes,

            @DefaultValue("true")
            boolean warmUpEnabled
    ) {

        /** Largest body a single byte array can hold. */
        public static final long MAX_BODY_BYTES = Integer.MAX_VALUE - 8;
    }
}
