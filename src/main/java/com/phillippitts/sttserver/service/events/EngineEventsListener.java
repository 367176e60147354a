package com.phillippitts.sttserver.service.events;

import com.phillippitts.sttserver.service.metrics.TranscriptionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs engine failure events. Every event is counted; log lines are throttled per engine and
 * message so a misbehaving model cannot flood the log.
 */
@Component
class EngineEventsListener {
    private static final Logger LOG = LogManager.getLogger(EngineEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final TranscriptionMetrics metrics;

    EngineEventsListener(TranscriptionMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        metrics.incrementEngineFailure(e.engine());
        String key = e.engine() + '-' + e.message();
        if (shouldLog(key)) {
            String cause = e.cause() == null ? "n/a" : e.cause().getClass().getSimpleName();
            LOG.warn("Engine failure: engine={}, message={}, cause={}, context={}",
                    e.engine(), e.message(), cause, e.context());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
