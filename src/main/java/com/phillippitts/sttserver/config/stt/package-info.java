/**
 * Server configuration: engine selection, model validation and dispatcher wiring.
 *
 * <ul>
 *   <li>{@link com.phillippitts.sttserver.config.stt.SttServerProperties} - {@code stt.*}
 *       (engine, model path, queue capacity, max request bytes)</li>
 *   <li>{@link com.phillippitts.sttserver.config.stt.WhisperConfig} - {@code stt.whisper.*}</li>
 *   <li>{@link com.phillippitts.sttserver.config.stt.VoskConfig} - {@code stt.vosk.*}</li>
 *   <li>{@link com.phillippitts.sttserver.config.stt.EngineKind} - engine factory and model-path shape</li>
 *   <li>{@link com.phillippitts.sttserver.config.stt.SttEngineConfig} - engine, dispatcher and worker beans</li>
 * </ul>
 *
 * <p>All configuration records are immutable, carry Jakarta Bean Validation constraints and take
 * their defaults from {@code @DefaultValue}.
 *
 * @see org.springframework.boot.context.properties.ConfigurationProperties
 * @since 1.0
 */
package com.phillippitts.sttserver.config.stt;
