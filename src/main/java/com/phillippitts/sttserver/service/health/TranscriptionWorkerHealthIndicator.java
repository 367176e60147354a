package com.phillippitts.sttserver.service.health;

import com.phillippitts.sttserver.service.dispatch.TranscriptionDispatcher;
import com.phillippitts.sttserver.service.dispatch.TranscriptionWorker;
import com.phillippitts.sttserver.service.dispatch.WorkerState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the transcription worker and its queue.
 *
 * <ul>
 *   <li>UP: worker running and accepting jobs</li>
 *   <li>SATURATED: worker running but the queue is full; new requests are being rejected</li>
 *   <li>DOWN: worker not running (starting, stopped or crashed)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TranscriptionWorkerHealthIndicator implements HealthIndicator {

    static final String SATURATED = "SATURATED";

    private final TranscriptionWorker worker;
    private final TranscriptionDispatcher dispatcher;

    public TranscriptionWorkerHealthIndicator(TranscriptionWorker worker, TranscriptionDispatcher dispatcher) {
        this.worker = worker;
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        WorkerState state = worker.state();
        int queued = dispatcher.queuedJobs();
        int capacity = dispatcher.capacity();

        Health.Builder builder;
        if (state != WorkerState.RUNNING || !dispatcher.isAcceptingJobs()) {
            builder = Health.down();
        } else if (queued >= capacity) {
            builder = Health.status(SATURATED);
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("engine", worker.engineName())
                .withDetail("worker", state.name())
                .withDetail("queuedJobs", queued)
                .withDetail("queueCapacity", capacity)
                .build();
    }
}
