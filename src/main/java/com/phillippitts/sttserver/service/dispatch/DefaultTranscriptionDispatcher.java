package com.phillippitts.sttserver.service.dispatch;

import com.phillippitts.sttserver.exception.AdmissionException;
import com.phillippitts.sttserver.exception.QueueFullException;
import com.phillippitts.sttserver.exception.WorkerUnavailableException;
import com.phillippitts.sttserver.service.metrics.TranscriptionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TranscriptionDispatcher} over a bounded {@link ArrayBlockingQueue}.
 *
 * <p>The queue is the only structure shared between request threads and the worker. Producers use
 * a non-blocking {@code offer}; the {@link TranscriptionWorker} is the single consumer.
 *
 * <p>Shutdown race: a job offered concurrently with {@link #shutdown()} is either taken back by
 * its submitter (who then gets {@link WorkerUnavailableException}) or picked up by the worker's
 * final drain. Whichever removes it from the queue first owns it, so no job is left pending.
 */
public class DefaultTranscriptionDispatcher implements TranscriptionDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionDispatcher.class);

    static final String WORKER_UNAVAILABLE = "transcription worker unavailable";

    private final BlockingQueue<TranscriptionJob> queue;
    private final int capacity;
    private final TranscriptionMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();

    public DefaultTranscriptionDispatcher(int capacity, TranscriptionMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        metrics.registerQueueDepth(queue::size);
    }

    @Override
    public CompletableFuture<String> submit(float[] audio) {
        Objects.requireNonNull(audio, "audio");
        if (closed.get()) {
            throw reject(new WorkerUnavailableException(WORKER_UNAVAILABLE));
        }
        TranscriptionJob job = new TranscriptionJob(sequence.incrementAndGet(), audio,
                ThreadContext.getImmutableContext());
        if (!queue.offer(job)) {
            throw reject(new QueueFullException(capacity));
        }
        if (closed.get() && queue.remove(job)) {
            // Shut down between the check and the offer; the worker may already be gone
            throw reject(new WorkerUnavailableException(WORKER_UNAVAILABLE));
        }
        metrics.incrementAdmitted();
        LOG.debug("Queued job {} ({} samples, depth={}/{})", job.id(), audio.length, queue.size(), capacity);
        return job.result();
    }

    private AdmissionException reject(AdmissionException e) {
        metrics.incrementRejected(e.reason());
        LOG.debug("Rejected submission: {}", e.getMessage());
        return e;
    }

    @Override
    public int queuedJobs() {
        return queue.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean isAcceptingJobs() {
        return !closed.get();
    }

    @Override
    public void shutdown() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Dispatcher closed to new jobs ({} still queued)", queue.size());
        }
    }

    // Worker-side access, package-private

    boolean isClosed() {
        return closed.get();
    }

    /**
     * Waits up to {@code timeout} for the next job in FIFO order.
     *
     * @return the job, or null if none arrived in time
     */
    TranscriptionJob poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes every job still queued. Used once the worker has stopped so stranded jobs can be failed.
     */
    List<TranscriptionJob> drainPending() {
        List<TranscriptionJob> pending = new ArrayList<>();
        queue.drainTo(pending);
        return pending;
    }
}
