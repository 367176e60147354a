/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.sttserver.exception.SttServerException} and are
 * mapped to HTTP responses by {@code GlobalExceptionHandler}:
 * <ul>
 *   <li>{@link com.phillippitts.sttserver.exception.InvalidAudioException} - undecodable payload (400)</li>
 *   <li>{@link com.phillippitts.sttserver.exception.PayloadTooLargeException} - body over the size cap (413)</li>
 *   <li>{@link com.phillippitts.sttserver.exception.AdmissionException} - queue full or worker gone (503, retryable)</li>
 *   <li>{@link com.phillippitts.sttserver.exception.TranscriptionException} - engine failure for one job (500)</li>
 *   <li>{@link com.phillippitts.sttserver.exception.ModelNotFoundException} - model missing or wrong shape;
 *       fatal at startup</li>
 * </ul>
 *
 * @see com.phillippitts.sttserver.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sttserver.exception;
