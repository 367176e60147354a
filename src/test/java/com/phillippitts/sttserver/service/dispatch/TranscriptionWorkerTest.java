package com.phillippitts.sttserver.service.dispatch;

import com.phillippitts.sttserver.exception.ModelNotFoundException;
import com.phillippitts.sttserver.exception.QueueFullException;
import com.phillippitts.sttserver.exception.TranscriptionException;
import com.phillippitts.sttserver.exception.WorkerUnavailableException;
import com.phillippitts.sttserver.service.metrics.TranscriptionMetrics;
import com.phillippitts.sttserver.testutil.FakeSttEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TranscriptionWorkerTest {

    private static final Duration POLL = Duration.ofMillis(10);

    private SimpleMeterRegistry registry;
    private TranscriptionMetrics metrics;
    private DefaultTranscriptionDispatcher dispatcher;
    private FakeSttEngine engine;
    private TranscriptionWorker worker;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TranscriptionMetrics(registry);
        dispatcher = new DefaultTranscriptionDispatcher(4, metrics);
        engine = new FakeSttEngine("fake");
    }

    @AfterEach
    void tearDown() {
        engine.release();
        if (worker != null) {
            worker.stop(Duration.ofSeconds(2));
        }
        ThreadContext.clearAll();
    }

    private TranscriptionWorker startWorker(boolean warmUp) {
        worker = new TranscriptionWorker(engine, dispatcher, metrics, warmUp, POLL);
        worker.start();
        return worker;
    }

    @Test
    void startLoadsEngineAndRuns() {
        startWorker(false);

        assertThat(engine.isInitialized()).isTrue();
        assertThat(worker.state()).isEqualTo(WorkerState.RUNNING);
        assertThat(worker.engineName()).isEqualTo("fake");
    }

    @Test
    void warmUpTranscribesTenSecondsOfSilence() {
        startWorker(true);

        assertThat(engine.transcribedLengths()).containsExactly(160_000);
    }

    @Test
    void warmUpFailureIsNotFatal() throws Exception {
        engine.respondWith(samples -> {
            if (samples.length == 160_000) {
                throw new TranscriptionException("warm-up exploded", "fake");
            }
            return "ok";
        });

        startWorker(true);

        assertThat(worker.state()).isEqualTo(WorkerState.RUNNING);
        assertThat(dispatcher.submit(new float[5]).get(5, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    void modelNotFoundOnStartStopsWorkerAndPropagates() {
        engine.failInitializationWith(new ModelNotFoundException("/missing/model"));
        worker = new TranscriptionWorker(engine, dispatcher, metrics, true, POLL);

        assertThatThrownBy(worker::start).isInstanceOf(ModelNotFoundException.class);
        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(dispatcher.isAcceptingJobs()).isFalse();
        assertThatThrownBy(() -> dispatcher.submit(new float[1])).isInstanceOf(WorkerUnavailableException.class);
    }

    @Test
    void startTwiceFails() {
        startWorker(false);

        assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transcribesOnDedicatedThread() throws Exception {
        startWorker(false);

        assertThat(dispatcher.submit(new float[7]).get(5, TimeUnit.SECONDS)).isEqualTo("len=7");
        assertThat(engine.callingThreads()).containsOnly(TranscriptionWorker.THREAD_NAME);
    }

    @Test
    void completesJobsInFifoOrderOneAtATime() throws Exception {
        engine.withDelayMs(30);
        List<String> completionOrder = new CopyOnWriteArrayList<>();
        startWorker(false);

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            futures.add(dispatcher.submit(new float[i]).thenApply(text -> {
                completionOrder.add(text);
                return text;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertThat(completionOrder).containsExactly("len=1", "len=2", "len=3", "len=4");
        assertThat(engine.maxConcurrentCalls()).isEqualTo(1);
    }

    @Test
    void engineFailureAffectsOnlyThatJob() throws Exception {
        engine.respondWith(samples -> {
            if (samples.length == 2) {
                throw new IllegalStateException("bad chunk");
            }
            return "len=" + samples.length;
        });
        startWorker(false);

        CompletableFuture<String> first = dispatcher.submit(new float[1]);
        CompletableFuture<String> failing = dispatcher.submit(new float[2]);
        CompletableFuture<String> third = dispatcher.submit(new float[3]);

        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("len=1");
        assertThat(third.get(5, TimeUnit.SECONDS)).isEqualTo("len=3");
        assertThatThrownBy(() -> failing.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("transcription failed: bad chunk");
        assertThat(worker.state()).isEqualTo(WorkerState.RUNNING);
        assertThat(completed(TranscriptionMetrics.OUTCOME_FAILURE)).isEqualTo(1.0);
        assertThat(completed(TranscriptionMetrics.OUTCOME_SUCCESS)).isEqualTo(2.0);
    }

    @Test
    void engineTranscriptionExceptionIsDeliveredUnchanged() {
        TranscriptionException original = new TranscriptionException("Non-zero exit: 3", "fake");
        engine.respondWith(samples -> {
            throw original;
        });
        startWorker(false);

        CompletableFuture<String> future = dispatcher.submit(new float[1]);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).hasCause(original);
    }

    @Test
    void abandonedJobDoesNotBlockOthers() throws Exception {
        engine.holdUntilReleased();
        startWorker(false);

        CompletableFuture<String> inFlight = dispatcher.submit(new float[1]);
        assertThat(engine.awaitFirstCall(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> abandoned = dispatcher.submit(new float[2]);
        CompletableFuture<String> next = dispatcher.submit(new float[3]);
        abandoned.cancel(false);
        engine.release();

        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo("len=1");
        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("len=3");
        assertThat(engine.transcribedLengths()).containsExactly(1, 3);
        assertThat(completed(TranscriptionMetrics.OUTCOME_SKIPPED)).isEqualTo(1.0);
    }

    @Test
    void inFlightJobIsNotPreemptedWhenSubmitterGivesUp() throws Exception {
        engine.holdUntilReleased();
        startWorker(false);

        CompletableFuture<String> inFlight = dispatcher.submit(new float[1]);
        assertThat(engine.awaitFirstCall(5, TimeUnit.SECONDS)).isTrue();
        inFlight.cancel(false);
        CompletableFuture<String> next = dispatcher.submit(new float[2]);
        engine.release();

        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("len=2");
        assertThat(engine.transcribedLengths()).containsExactly(1, 2);
    }

    @Test
    void fatalErrorFailsCurrentAndQueuedJobsAndStopsWorker() {
        engine.holdUntilReleased().respondWith(samples -> {
            throw new UnsatisfiedLinkError("native crash");
        });
        startWorker(false);

        CompletableFuture<String> current = dispatcher.submit(new float[1]);
        await().atMost(Duration.ofSeconds(5)).until(() -> !engine.transcribedLengths().isEmpty());
        CompletableFuture<String> queued1 = dispatcher.submit(new float[2]);
        CompletableFuture<String> queued2 = dispatcher.submit(new float[3]);
        engine.release();

        for (CompletableFuture<String> f : List.of(current, queued1, queued2)) {
            assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(WorkerUnavailableException.class);
        }
        await().atMost(Duration.ofSeconds(5)).until(() -> worker.state() == WorkerState.STOPPED);
        assertThat(engine.isClosed()).isTrue();
        assertThat(dispatcher.isAcceptingJobs()).isFalse();
        assertThatThrownBy(() -> dispatcher.submit(new float[1])).isInstanceOf(WorkerUnavailableException.class);
        assertThat(engine.transcribedLengths()).containsExactly(1);
    }

    @Test
    void stopDrainsQueuedJobsBeforeStopping() throws Exception {
        engine.withDelayMs(20);
        startWorker(false);

        CompletableFuture<String> a = dispatcher.submit(new float[1]);
        CompletableFuture<String> b = dispatcher.submit(new float[2]);
        worker.stop(Duration.ofSeconds(5));

        assertThat(a.get(1, TimeUnit.SECONDS)).isEqualTo("len=1");
        assertThat(b.get(1, TimeUnit.SECONDS)).isEqualTo("len=2");
        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(engine.isClosed()).isTrue();
    }

    @Test
    void capacityOneAdmitsOneBehindTheInFlightJobAndRejectsTheRest() throws Exception {
        dispatcher = new DefaultTranscriptionDispatcher(1, metrics);
        engine.holdUntilReleased();
        startWorker(false);

        CompletableFuture<String> inFlight = dispatcher.submit(new float[1]);
        assertThat(engine.awaitFirstCall(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> queued = dispatcher.submit(new float[2]);

        assertThatThrownBy(() -> dispatcher.submit(new float[3])).isInstanceOf(QueueFullException.class);
        assertThatThrownBy(() -> dispatcher.submit(new float[4])).isInstanceOf(QueueFullException.class);

        engine.release();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo("len=1");
        assertThat(queued.get(5, TimeUnit.SECONDS)).isEqualTo("len=2");
        assertThat(engine.transcribedLengths()).containsExactly(1, 2);
        assertThat(registry.counter("sttserver.transcription.rejected", "reason", "queue-full").count())
                .isEqualTo(2.0);
    }

    @Test
    void jobInterruptedByStopFailsAsWorkerUnavailable() throws Exception {
        engine.holdUntilReleased();
        startWorker(false);

        CompletableFuture<String> inFlight = dispatcher.submit(new float[1]);
        assertThat(engine.awaitFirstCall(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> queued = dispatcher.submit(new float[2]);

        worker.stop(Duration.ofMillis(50));

        for (CompletableFuture<String> f : List.of(inFlight, queued)) {
            assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(WorkerUnavailableException.class);
        }
        await().atMost(Duration.ofSeconds(5)).until(() -> worker.state() == WorkerState.STOPPED);
        assertThat(engine.transcribedLengths()).containsExactly(1);
        assertThat(engine.isClosed()).isTrue();
    }

    @Test
    void stopBeforeStartClosesEngine() {
        worker = new TranscriptionWorker(engine, dispatcher, metrics, false, POLL);

        worker.stop(Duration.ofSeconds(1));

        assertThat(worker.state()).isEqualTo(WorkerState.STOPPED);
        assertThat(engine.isClosed()).isTrue();
    }

    @Test
    void workerLogsRunWithSubmitterContext() throws Exception {
        List<Map<String, String>> seen = new CopyOnWriteArrayList<>();
        engine.respondWith(samples -> {
            seen.add(ThreadContext.getImmutableContext());
            return "ok";
        });
        startWorker(false);

        ThreadContext.put("requestId", "req-7");
        CompletableFuture<String> first = dispatcher.submit(new float[1]);
        ThreadContext.clearMap();
        first.get(5, TimeUnit.SECONDS);
        dispatcher.submit(new float[1]).get(5, TimeUnit.SECONDS);

        assertThat(seen).hasSize(2);
        assertThat(seen.get(0)).containsEntry("requestId", "req-7").containsKey("jobId");
        assertThat(seen.get(1)).doesNotContainKey("requestId");
    }

    @Test
    void recordsQueueWaitAndInferenceTimers() throws Exception {
        startWorker(false);

        dispatcher.submit(new float[1]).get(5, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            assertThat(registry.get("sttserver.transcription.queue.wait").timer().count()).isEqualTo(1);
            assertThat(registry.get("sttserver.transcription.inference").tag("engine", "fake").timer().count())
                    .isEqualTo(1);
        });
    }

    private double completed(String outcome) {
        return registry.get("sttserver.transcription.completed").tag("outcome", outcome).counter().count();
    }
}
