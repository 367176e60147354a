package com.phillippitts.sttserver.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /health}.
 */
public record HealthResponse(
        String status,
        String engine,
        @JsonProperty("model_path") String modelPath,
        @JsonProperty("queued_jobs") int queuedJobs,
        @JsonProperty("queue_capacity") int queueCapacity,
        String worker
) {
}
