/**
 * Admission-controlled single-worker job dispatcher.
 *
 * <p>Request threads decode audio and call
 * {@link com.phillippitts.sttserver.service.dispatch.TranscriptionDispatcher#submit(float[])}, which
 * either queues the job or rejects it immediately. The
 * {@link com.phillippitts.sttserver.service.dispatch.TranscriptionWorker} owns the engine and takes
 * jobs in FIFO order on its own thread; each job's result travels back on that job's own
 * {@link java.util.concurrent.CompletableFuture}.
 *
 * @since 1.0
 */
package com.phillippitts.sttserver.service.dispatch;
