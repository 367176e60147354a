package com.phillippitts.sttserver.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the transcription pipeline.
 *
 * <ul>
 *   <li>Admission: admitted and rejected (by reason) submissions, current queue depth</li>
 *   <li>Worker: queue wait, inference latency per engine, completed jobs by outcome</li>
 *   <li>Engines: failure events per engine</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionMetrics {

    private static final String METRIC_PREFIX = "sttserver.transcription";

    /** Outcome tags for {@link #incrementCompleted(String)}. */
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_SKIPPED = "skipped";
    public static final String OUTCOME_WORKER_UNAVAILABLE = "worker-unavailable";

    private final MeterRegistry registry;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the queue-depth gauge. The supplier is polled on scrape.
     *
     * @param depth current number of waiting jobs
     */
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(METRIC_PREFIX + ".queue.depth", depth)
                .description("Jobs waiting for the transcription worker")
                .register(registry);
    }

    public void incrementAdmitted() {
        Counter.builder(METRIC_PREFIX + ".admitted")
                .description("Jobs accepted into the queue")
                .register(registry)
                .increment();
    }

    /**
     * @param reason rejection reason (queue-full, worker-unavailable)
     */
    public void incrementRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Submissions rejected at admission")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome one of the {@code OUTCOME_*} constants
     */
    public void incrementCompleted(String outcome) {
        Counter.builder(METRIC_PREFIX + ".completed")
                .description("Jobs finished by the worker")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordQueueWait(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".queue.wait")
                .description("Time a job spent queued before the worker took it")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param engineName name of the engine (vosk, whisper)
     * @param durationNanos inference duration in nanoseconds
     */
    public void recordInference(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".inference")
                .description("Time taken by the engine to transcribe one job")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementEngineFailure(String engineName) {
        Counter.builder(METRIC_PREFIX + ".engine.failure")
                .description("Engine failure events")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }
}
