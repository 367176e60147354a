package com.phillippitts.sttserver.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an STT engine fails to load a model or to transcribe a job
 * (timeout, non-zero exit, JNI error).
 *
 * <p>PII note: Do not include transcript text in context. Restrict to technical diagnostics.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
