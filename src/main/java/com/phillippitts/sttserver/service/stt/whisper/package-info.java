/**
 * whisper.cpp speech-to-text engine adapter.
 *
 * <ul>
 *   <li>{@link com.phillippitts.sttserver.service.stt.whisper.WhisperSttEngine} - writes a temp WAV
 *       per job and normalizes stdout into one transcript line</li>
 *   <li>{@link com.phillippitts.sttserver.service.stt.whisper.WhisperProcessManager} - spawn, capture,
 *       timeout and cleanup of the external process</li>
 *   <li>{@link com.phillippitts.sttserver.service.stt.whisper.ProcessFactory} - seam for hermetic tests</li>
 * </ul>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.engine=whisper
 * stt.model-path=models/ggml-base.en.bin
 * stt.whisper.binary-path=tools/whisper.cpp/whisper-cli
 * stt.whisper.timeout-seconds=300
 * stt.whisper.language=en
 * stt.whisper.threads=4
 * </pre>
 *
 * @see com.phillippitts.sttserver.service.stt.SttEngine
 * @see com.phillippitts.sttserver.config.stt.WhisperConfig
 * @since 1.0
 */
package com.phillippitts.sttserver.service.stt.whisper;
