package com.phillippitts.sttserver.presentation.controller;

import com.phillippitts.sttserver.config.stt.SttServerProperties;
import com.phillippitts.sttserver.service.dispatch.TranscriptionDispatcher;
import com.phillippitts.sttserver.service.dispatch.TranscriptionWorker;
import com.phillippitts.sttserver.service.dispatch.WorkerState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code GET /health}: liveness of the worker plus queue occupancy. Returns 503 with status
 * {@code "unavailable"} once the worker has stopped.
 */
@RestController
class HealthController {

    private final TranscriptionDispatcher dispatcher;
    private final TranscriptionWorker worker;
    private final String modelPath;

    HealthController(TranscriptionDispatcher dispatcher, TranscriptionWorker worker, SttServerProperties properties) {
        this.dispatcher = dispatcher;
        this.worker = worker;
        this.modelPath = properties.modelPath();
    }

    @GetMapping("/health")
    ResponseEntity<HealthResponse> health() {
        WorkerState state = worker.state();
        boolean up = state == WorkerState.RUNNING && dispatcher.isAcceptingJobs();
        HealthResponse body = new HealthResponse(
                up ? "ok" : "unavailable",
                worker.engineName(),
                modelPath,
                dispatcher.queuedJobs(),
                dispatcher.capacity(),
                state.name());
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
