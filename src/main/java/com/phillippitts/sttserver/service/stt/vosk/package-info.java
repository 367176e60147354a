/**
 * Vosk speech-to-text engine adapter (JNI).
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.engine=vosk
 * stt.model-path=models/vosk-model-small-en-us-0.15
 * stt.vosk.sample-rate=16000
 * stt.vosk.max-alternatives=0
 * </pre>
 *
 * <p>The model directory is validated at startup by {@code ModelValidationService}, loaded once,
 * and a recognizer is created per transcription via try-with-resources.
 *
 * @see com.phillippitts.sttserver.service.stt.SttEngine
 * @see com.phillippitts.sttserver.config.stt.VoskConfig
 * @since 1.0
 */
package com.phillippitts.sttserver.service.stt.vosk;
