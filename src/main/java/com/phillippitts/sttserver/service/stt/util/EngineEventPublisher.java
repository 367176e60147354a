package com.phillippitts.sttserver.service.stt.util;

import com.phillippitts.sttserver.service.events.EngineFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Publishes {@link EngineFailureEvent}s on behalf of engines.
 *
 * <p>A null publisher is accepted so engines can be constructed without a Spring context in tests.
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes an engine failure event if a publisher is available.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param engineName the name of the engine experiencing the failure
     * @param message a human-readable description of the failure
     * @param cause the exception that caused the failure (may be null)
     * @param context additional diagnostics (may be null or empty)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher == null) {
            return;
        }
        publisher.publishEvent(new EngineFailureEvent(engineName, Instant.now(), message, cause, context));
    }
}
