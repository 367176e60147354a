package com.phillippitts.sttserver.presentation.controller;

import com.phillippitts.sttserver.config.stt.SttServerProperties;
import com.phillippitts.sttserver.exception.PayloadTooLargeException;
import com.phillippitts.sttserver.service.audio.PcmCodec;
import com.phillippitts.sttserver.service.dispatch.TranscriptionDispatcher;
import com.phillippitts.sttserver.util.TimeUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * {@code POST /transcribe}: raw PCM16LE mono 16 kHz in, {@code {"text": "..."}} out.
 *
 * <p>The body is size-checked and decoded on the request thread, then handed to the dispatcher.
 * The returned future is completed by the worker, so the servlet thread is released while the job
 * waits. Admission and engine failures are rendered by
 * {@link com.phillippitts.sttserver.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    private final TranscriptionDispatcher dispatcher;
    private final long maxBytes;

    TranscriptionController(TranscriptionDispatcher dispatcher, SttServerProperties properties) {
        this.dispatcher = dispatcher;
        this.maxBytes = properties.server().maxBytes();
        if (maxBytes > SttServerProperties.Server.MAX_BODY_BYTES) {
            throw new IllegalArgumentException(
                    "maxBytes exceeds " + SttServerProperties.Server.MAX_BODY_BYTES + ": " + maxBytes);
        }
    }

    @PostMapping(path = "/transcribe",
            consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    CompletableFuture<ResponseEntity<TranscribeResponse>> transcribe(HttpServletRequest request) throws IOException {
        byte[] body = readBody(request);
        float[] samples = PcmCodec.decode(body);
        LOG.info("Transcription request: bytes={}, samples={}, queued={}",
                body.length, samples.length, dispatcher.queuedJobs());

        long startNanos = System.nanoTime();
        return dispatcher.submit(samples).thenApply(text -> {
            LOG.info("Transcription response: chars={}, elapsedMs={}", text.length(), TimeUtils.elapsedMillis(startNanos));
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONNECTION, "keep-alive")
                    .body(new TranscribeResponse(text));
        });
    }

    /**
     * Reads at most {@code maxBytes}. A declared Content-Length over the limit is rejected before
     * reading; chunked bodies are cut off one byte past it.
     */
    private byte[] readBody(HttpServletRequest request) throws IOException {
        long declared = request.getContentLengthLong();
        if (declared > maxBytes) {
            throw new PayloadTooLargeException(declared, maxBytes);
        }
        int limit = Math.toIntExact(maxBytes + 1);
        try (InputStream in = request.getInputStream()) {
            byte[] body = in.readNBytes(limit);
            if (body.length > maxBytes) {
                throw new PayloadTooLargeException(-1, maxBytes);
            }
            return body;
        }
    }
}
