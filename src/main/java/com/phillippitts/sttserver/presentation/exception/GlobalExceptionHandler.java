package com.phillippitts.sttserver.presentation.exception;

import com.phillippitts.sttserver.exception.AdmissionException;
import com.phillippitts.sttserver.exception.InvalidAudioException;
import com.phillippitts.sttserver.exception.ModelNotFoundException;
import com.phillippitts.sttserver.exception.PayloadTooLargeException;
import com.phillippitts.sttserver.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes. Admission failures
 * are transient and carry {@code Retry-After}; engine failures surface their detail so callers can
 * tell a bad clip from an overloaded server.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "1";

    /**
     * Client error - undecodable audio (HTTP 400). Never retried.
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid audio format", ex.getMessage());
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    ResponseEntity<ApiError> handlePayloadTooLarge(PayloadTooLargeException ex) {
        LOG.warn("Rejected oversized body: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, ex.getClass().getSimpleName(), "Payload too large", ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        LOG.warn("Unsupported Content-Type: {}", ex.getContentType());
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UnsupportedMediaType", "Unsupported media type",
                "Content-Type must be " + MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    /**
     * Transient capacity fault - queue full or worker gone (HTTP 503, retry after 1s).
     */
    @ExceptionHandler(AdmissionException.class)
    ResponseEntity<ApiError> handleAdmission(AdmissionException ex) {
        LOG.warn("Admission rejected: reason={}, message={}", ex.reason(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "service temporarily overloaded",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * The request outlived {@code spring.mvc.async.request-timeout}. The job itself keeps its
     * place; its result is discarded.
     */
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    ResponseEntity<ApiError> handleAsyncTimeout(AsyncRequestTimeoutException ex) {
        LOG.warn("Transcription request timed out waiting for the worker");
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(new ApiError(
                "AsyncRequestTimeout",
                "service temporarily overloaded",
                "Timed out waiting for the transcription worker",
                Instant.now()
            ));
    }

    /**
     * Engine failed on this clip (HTTP 500). Detail is surfaced.
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Transcription failed: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "internal processing failure", ex.getMessage());
    }

    /**
     * Configuration/setup error - fail fast on startup, but if encountered at runtime return 503.
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found at path: {}", ex.getModelPath());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Speech-to-text service unavailable", "Model not loaded. Contact administrator.");
    }

    /**
     * Catch-all. Framework exceptions that already know their status (405, 404, ...) keep it;
     * anything else is a 500.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.warn("Request failed: status={}, message={}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                .body(new ApiError(ex.getClass().getSimpleName(), "Request failed", ex.getMessage(), Instant.now()));
        }
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String errorCode, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(errorCode, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
