/**
 * Speech-to-Text (STT) engine abstractions and implementations.
 *
 * <ul>
 *   <li>Vosk - JNI engine loading a model directory</li>
 *   <li>Whisper - whisper.cpp process driven against a single GGML model file</li>
 * </ul>
 *
 * <p>All implementations accept normalized 16 kHz mono samples, return plain text and are
 * driven by exactly one thread, the transcription worker.
 *
 * @see com.phillippitts.sttserver.service.stt.SttEngine
 * @see com.phillippitts.sttserver.service.dispatch.TranscriptionWorker
 * @since 1.0
 */
package com.phillippitts.sttserver.service.stt;
