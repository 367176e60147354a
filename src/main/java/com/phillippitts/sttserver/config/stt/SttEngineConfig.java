package com.phillippitts.sttserver.config.stt;

import com.phillippitts.sttserver.service.dispatch.DefaultTranscriptionDispatcher;
import com.phillippitts.sttserver.service.dispatch.TranscriptionWorker;
import com.phillippitts.sttserver.service.metrics.TranscriptionMetrics;
import com.phillippitts.sttserver.service.stt.SttEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the selected engine, the dispatcher and the single transcription worker.
 *
 * <p>The worker's {@code start} loads the model and runs the warm-up before the web server begins
 * accepting requests; a model that cannot be loaded fails startup. On shutdown the worker closes
 * admission, drains the queue and releases the engine.
 */
@Configuration
public class SttEngineConfig {

    private static final Logger LOG = LogManager.getLogger(SttEngineConfig.class);

    @Bean
    public SttEngine sttEngine(SttServerProperties properties,
                               WhisperConfig whisperConfig,
                               VoskConfig voskConfig,
                               ApplicationEventPublisher publisher) {
        EngineKind kind = properties.engine();
        LOG.info("Selected STT engine: {} (model={})", kind.engineName(), properties.modelPath());
        return kind.createEngine(properties.modelPath(),
                new EngineKind.EngineSettings(whisperConfig, voskConfig, publisher));
    }

    @Bean
    public DefaultTranscriptionDispatcher transcriptionDispatcher(SttServerProperties properties,
                                                                  TranscriptionMetrics metrics) {
        return new DefaultTranscriptionDispatcher(properties.server().queueCapacity(), metrics);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public TranscriptionWorker transcriptionWorker(SttEngine sttEngine,
                                                   DefaultTranscriptionDispatcher transcriptionDispatcher,
                                                   TranscriptionMetrics metrics,
                                                   SttServerProperties properties) {
        return new TranscriptionWorker(sttEngine, transcriptionDispatcher, metrics,
                properties.server().warmUpEnabled());
    }
}
