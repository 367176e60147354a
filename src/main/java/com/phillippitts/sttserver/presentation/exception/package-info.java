/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.sttserver.exception.InvalidAudioException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.sttserver.exception.PayloadTooLargeException} → 413 Payload Too Large</li>
 *   <li>wrong {@code Content-Type} → 415 Unsupported Media Type</li>
 *   <li>{@link com.phillippitts.sttserver.exception.AdmissionException} → 503 with {@code Retry-After: 1}</li>
 *   <li>async request timeout → 503 with {@code Retry-After: 1}</li>
 *   <li>{@link com.phillippitts.sttserver.exception.TranscriptionException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "QueueFullException",
 *   "message": "service temporarily overloaded",
 *   "details": "Transcription queue is full (capacity 8)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.sttserver.exception
 * @since 1.0
 */
package com.phillippitts.sttserver.presentation.exception;
