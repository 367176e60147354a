package com.phillippitts.sttserver.util;

import java.time.Duration;

/**
 * Timeouts for subprocess and worker-thread lifecycle management.
 *
 * @see com.phillippitts.sttserver.service.stt.whisper.WhisperProcessManager
 * @see com.phillippitts.sttserver.service.dispatch.TranscriptionWorker
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Wait for stdout/stderr gobbler threads to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemons. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Grace period after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Deadline after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long the worker blocks on an empty queue before re-checking whether the dispatcher closed.
     * Bounds shutdown latency when idle.
     */
    public static final Duration WORKER_POLL_INTERVAL = Duration.ofMillis(200);

    /**
     * How long application shutdown waits for the worker to drain queued jobs before interrupting
     * it. Jobs cut off by the interrupt fail with {@code WorkerUnavailableException}.
     */
    public static final Duration WORKER_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
