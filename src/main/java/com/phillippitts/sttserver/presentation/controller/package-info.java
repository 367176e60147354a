/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@code POST /transcribe} - raw PCM16LE body, async response with the transcript</li>
 *   <li>{@code GET /health} - engine, model path, worker state and queue occupancy</li>
 * </ul>
 *
 * <p>Controllers stay thin: size check and decode, then delegate to the dispatcher. Exceptions are
 * left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.sttserver.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sttserver.presentation.controller;
