package com.phillippitts.sttserver.service.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One unit of work: the decoded audio plus the private channel its result is delivered on.
 *
 * <p>The result future is written at most once. Completing it after the submitter has gone away
 * is a harmless no-op. The audio reference is released when the worker takes it.
 */
final class TranscriptionJob {

    private final long id;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final long submittedAtNanos;
    private final Map<String, String> logContext;
    private float[] audio;

    TranscriptionJob(long id, float[] audio, Map<String, String> logContext) {
        this.id = id;
        this.audio = Objects.requireNonNull(audio, "audio");
        this.logContext = logContext == null ? Map.of() : Map.copyOf(logContext);
        this.submittedAtNanos = System.nanoTime();
    }

    long id() {
        return id;
    }

    CompletableFuture<String> result() {
        return result;
    }

    long submittedAtNanos() {
        return submittedAtNanos;
    }

    /** Logging context captured on the submitting thread. */
    Map<String, String> logContext() {
        return logContext;
    }

    /**
     * Hands the audio to the worker and drops the job's reference to it. Only the worker thread calls this.
     */
    float[] takeAudio() {
        float[] samples = audio;
        audio = null;
        return samples;
    }

    /** True if the submitter cancelled the future before the worker got to it. */
    boolean isAbandoned() {
        return result.isDone();
    }

    void complete(String text) {
        result.complete(text);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }

    @Override
    public String toString() {
        return "TranscriptionJob[id=" + id + "]";
    }
}
