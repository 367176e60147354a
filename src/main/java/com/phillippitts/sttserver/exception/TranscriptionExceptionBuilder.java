package com.phillippitts.sttserver.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link TranscriptionException} carrying diagnostic context.
 *
 * <p>Engines use it so that every failure message has the same shape:
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("modelPath", modelPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 * renders as {@code Non-zero exit: 1 (exitCode=1, durationMs=1500, modelPath=..., stderr=...) (engine: whisper)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private final Map<String, String> details = new LinkedHashMap<>();
    private String engineName;
    private Throwable cause;

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Process exit code, for engines backed by an external binary. */
    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        return metadata("exitCode", exitCode);
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        return metadata("durationMs", durationMs);
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     *
     * @param key metadata key (e.g. modelPath, sampleRate, stderr)
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String engine = engineName != null ? engineName : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new TranscriptionException(detailed, engine, cause)
                : new TranscriptionException(detailed, engine);
    }

    private String detailedMessage() {
        if (details.isEmpty()) {
            return message;
        }
        StringJoiner joiner = new StringJoiner(", ", message + " (", ")");
        details.forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }
}
