package com.phillippitts.sttserver.service.dispatch;

import com.phillippitts.sttserver.exception.QueueFullException;
import com.phillippitts.sttserver.exception.WorkerUnavailableException;

import java.util.concurrent.CompletableFuture;

/**
 * Admission-controlled front door to the single transcription worker.
 *
 * <p>Submissions never block: a job is either queued immediately or rejected with an
 * {@link com.phillippitts.sttserver.exception.AdmissionException}. Queued jobs are processed in
 * strict FIFO order, one at a time.
 */
public interface TranscriptionDispatcher {

    /**
     * Queues audio for transcription.
     *
     * <p>The returned future completes with the transcript, or exceptionally with
     * {@link com.phillippitts.sttserver.exception.TranscriptionException} if the engine failed on this
     * job, or {@link WorkerUnavailableException} if the worker stopped before answering. Cancelling
     * it before the worker starts the job skips the job; a running inference is never interrupted.
     *
     * @param audio normalized samples; ownership passes to the dispatcher
     * @return result channel for this job only
     * @throws QueueFullException if the queue is at capacity
     * @throws WorkerUnavailableException if the dispatcher has been shut down or the worker stopped
     */
    CompletableFuture<String> submit(float[] audio);

    /** @return jobs currently waiting (excludes the one being transcribed) */
    int queuedJobs();

    /** @return fixed queue capacity */
    int capacity();

    /** @return false once shutdown has begun or the worker has stopped */
    boolean isAcceptingJobs();

    /**
     * Stops admission. Already-queued jobs are still processed by the worker.
     */
    void shutdown();
}
