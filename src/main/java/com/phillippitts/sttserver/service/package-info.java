/**
 * Service layer: the transcription pipeline behind the REST endpoints.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.dispatch} - bounded job queue and the single worker thread that owns the engine</li>
 *   <li>{@code service.stt} - engine abstraction and the Whisper and Vosk implementations</li>
 *   <li>{@code service.audio} - PCM16LE decoding and WAV writing</li>
 *   <li>{@code service.metrics}, {@code service.events}, {@code service.health} - Micrometer meters,
 *       engine failure events and the actuator health indicator</li>
 * </ul>
 *
 * <p>Services throw domain exceptions from {@code com.phillippitts.sttserver.exception}, never
 * HTTP types; the presentation layer maps them to status codes.
 *
 * @see com.phillippitts.sttserver.service.dispatch
 * @see com.phillippitts.sttserver.service.stt
 * @since 1.0
 */
package com.phillippitts.sttserver.service;
