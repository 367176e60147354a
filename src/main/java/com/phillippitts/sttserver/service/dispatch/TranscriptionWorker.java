package com.phillippitts.sttserver.service.dispatch;

import com.phillippitts.sttserver.exception.TranscriptionException;
import com.phillippitts.sttserver.exception.WorkerUnavailableException;
import com.phillippitts.sttserver.service.audio.PcmCodec;
import com.phillippitts.sttserver.service.metrics.TranscriptionMetrics;
import com.phillippitts.sttserver.service.stt.SttEngine;
import com.phillippitts.sttserver.util.LogSanitizer;
import com.phillippitts.sttserver.util.ProcessTimeouts;
import com.phillippitts.sttserver.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Owns the loaded engine and runs every transcription on one dedicated thread.
 *
 * <p>Lifecycle: {@link #start()} loads the engine, runs an optional warm-up inference on
 * silence and starts the {@value #THREAD_NAME} thread; {@link #stop()} closes admission and
 * waits for the queue to drain. The engine is touched only by the worker thread once it runs.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>A {@link RuntimeException} from the engine fails that job only, as a
 *       {@link TranscriptionException}. The worker carries on.</li>
 *   <li>An {@link Error} (for example a native crash surfacing as {@code UnsatisfiedLinkError})
 *       stops the worker. The current job and everything still queued fail with
 *       {@link WorkerUnavailableException}.</li>
 * </ul>
 */
public class TranscriptionWorker {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWorker.class);

    static final String THREAD_NAME = "transcription-worker";

    private final SttEngine engine;
    private final DefaultTranscriptionDispatcher dispatcher;
    private final TranscriptionMetrics metrics;
    private final boolean warmUpEnabled;
    private final Duration pollInterval;

    private volatile WorkerState state = WorkerState.NEW;
    private volatile Thread thread;
    private volatile boolean interruptedByStop;

    public TranscriptionWorker(SttEngine engine, DefaultTranscriptionDispatcher dispatcher,
                               TranscriptionMetrics metrics, boolean warmUpEnabled) {
        this(engine, dispatcher, metrics, warmUpEnabled, ProcessTimeouts.WORKER_POLL_INTERVAL);
    }

    TranscriptionWorker(SttEngine engine, DefaultTranscriptionDispatcher dispatcher,
                        TranscriptionMetrics metrics, boolean warmUpEnabled, Duration pollInterval) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.warmUpEnabled = warmUpEnabled;
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /**
     * Loads the engine, warms it up and starts consuming jobs.
     *
     * @throws com.phillippitts.sttserver.exception.ModelNotFoundException if the model cannot be loaded
     * @throws IllegalStateException if called more than once
     */
    public synchronized void start() {
        if (state != WorkerState.NEW) {
            throw new IllegalStateException("Worker already started (state=" + state + ")");
        }
        try {
            engine.initialize();
        } catch (RuntimeException e) {
            state = WorkerState.STOPPED;
            dispatcher.shutdown();
            throw e;
        }
        if (warmUpEnabled) {
            warmUp();
        }
        Thread worker = new Thread(this::runLoop, THREAD_NAME);
        worker.setDaemon(false);
        this.thread = worker;
        state = WorkerState.RUNNING;
        worker.start();
        LOG.info("Transcription worker started: engine={}, queueCapacity={}",
                engine.getEngineName(), dispatcher.capacity());
    }

    private void warmUp() {
        long startNanos = System.nanoTime();
        try {
            engine.transcribe(PcmCodec.silentChunk());
            LOG.info("Warm-up inference finished in {} ms", TimeUtils.elapsedMillis(startNanos));
        } catch (RuntimeException e) {
            LOG.warn("Warm-up inference failed; continuing without it: {}", e.getMessage());
        }
    }

    /**
     * Closes admission and waits for queued jobs to finish. Jobs that cannot finish in time,
     * including one interrupted mid-inference, are failed with {@link WorkerUnavailableException}.
     */
    public void stop() {
        stop(ProcessTimeouts.WORKER_DRAIN_TIMEOUT);
    }

    void stop(Duration drainTimeout) {
        dispatcher.shutdown();
        Thread worker = this.thread;
        if (worker == null) {
            // Never started; nothing can be queued, but release the engine
            state = WorkerState.STOPPED;
            engine.close();
            return;
        }
        try {
            worker.join(drainTimeout.toMillis());
            if (worker.isAlive()) {
                LOG.warn("Worker did not drain within {} ms; interrupting", drainTimeout.toMillis());
                interruptedByStop = true;
                worker.interrupt();
                worker.join(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interruptedByStop = true;
            worker.interrupt();
        }
    }

    public WorkerState state() {
        return state;
    }

    public String engineName() {
        return engine.getEngineName();
    }

    private void runLoop() {
        Error fatal = null;
        try {
            while (true) {
                TranscriptionJob job = dispatcher.poll(pollInterval);
                if (job == null) {
                    if (dispatcher.isClosed()) {
                        break;
                    }
                    continue;
                }
                fatal = process(job);
                if (fatal != null || interruptedByStop) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Transcription worker interrupted; stopping");
        } finally {
            state = WorkerState.STOPPED;
            dispatcher.shutdown();
            failPending(fatal);
            engine.close();
            LOG.info("Transcription worker stopped");
        }
    }

    /**
     * Runs one job with the submitter's logging context restored.
     *
     * @return the fatal error that must stop the worker, or null to keep going
     */
    private Error process(TranscriptionJob job) {
        ThreadContext.putAll(job.logContext());
        ThreadContext.put("jobId", String.valueOf(job.id()));
        try {
            metrics.recordQueueWait(System.nanoTime() - job.submittedAtNanos());
            float[] samples = job.takeAudio();
            if (job.isAbandoned()) {
                LOG.debug("Skipping job {}: abandoned by submitter before it started", job.id());
                metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_SKIPPED);
                return null;
            }
            long startNanos = System.nanoTime();
            try {
                String text = engine.transcribe(samples);
                metrics.recordInference(engine.getEngineName(), System.nanoTime() - startNanos);
                metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_SUCCESS);
                LOG.info("Job {} transcribed in {} ms (chars={})",
                        job.id(), TimeUtils.elapsedMillis(startNanos), text == null ? 0 : text.length());
                LOG.debug("Job {} transcript: {}", job.id(), LogSanitizer.preview(text));
                job.complete(text == null ? "" : text);
            } catch (RuntimeException e) {
                if (interruptedByStop) {
                    LOG.warn("Job {} interrupted by shutdown after {} ms", job.id(), TimeUtils.elapsedMillis(startNanos));
                    metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_WORKER_UNAVAILABLE);
                    job.fail(new WorkerUnavailableException(DefaultTranscriptionDispatcher.WORKER_UNAVAILABLE, e));
                    return null;
                }
                metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_FAILURE);
                LOG.warn("Job {} failed after {} ms: {}", job.id(), TimeUtils.elapsedMillis(startNanos), e.getMessage());
                job.fail(asTranscriptionException(e));
            }
            return null;
        } catch (Error e) {
            LOG.error("Fatal error in transcription engine; stopping worker", e);
            metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_WORKER_UNAVAILABLE);
            job.fail(new WorkerUnavailableException(DefaultTranscriptionDispatcher.WORKER_UNAVAILABLE, e));
            return e;
        } finally {
            ThreadContext.clearMap();
        }
    }

    private TranscriptionException asTranscriptionException(RuntimeException e) {
        if (e instanceof TranscriptionException te) {
            return te;
        }
        return new TranscriptionException("transcription failed: " + e.getMessage(), engine.getEngineName(), e);
    }

    private void failPending(Error cause) {
        List<TranscriptionJob> stranded = dispatcher.drainPending();
        if (stranded.isEmpty()) {
            return;
        }
        LOG.warn("Failing {} queued job(s): worker stopped", stranded.size());
        for (TranscriptionJob job : stranded) {
            WorkerUnavailableException error = cause == null
                    ? new WorkerUnavailableException(DefaultTranscriptionDispatcher.WORKER_UNAVAILABLE)
                    : new WorkerUnavailableException(DefaultTranscriptionDispatcher.WORKER_UNAVAILABLE, cause);
            job.fail(error);
            metrics.incrementCompleted(TranscriptionMetrics.OUTCOME_WORKER_UNAVAILABLE);
        }
    }
}
