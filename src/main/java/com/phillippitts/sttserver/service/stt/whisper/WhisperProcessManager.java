package com.phillippitts.sttserver.service.stt.whisper;

import com.phillippitts.sttserver.config.stt.WhisperConfig;
import com.phillippitts.sttserver.exception.TranscriptionException;
import com.phillippitts.sttserver.exception.TranscriptionExceptionBuilder;
import com.phillippitts.sttserver.service.stt.SttEngineNames;
import com.phillippitts.sttserver.util.ProcessTimeouts;
import com.phillippitts.sttserver.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external whisper.cpp binary for one WAV file at a time.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build a deterministic command line from {@link WhisperConfig} and the model path</li>
 *   <li>Capture stdout (transcript) and stderr (diagnostics) on daemon gobbler threads, each capped</li>
 *   <li>Enforce the configured timeout, terminating runaway processes</li>
 *   <li>Report failures as {@link TranscriptionException} with exit code, duration and a stderr snippet</li>
 * </ul>
 *
 * <p>Not thread-safe: the transcription worker is its only caller. Temp-file handling belongs to
 * {@link WhisperSttEngine}.
 */
public final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final WhisperConfig cfg;
    private final ProcessFactory processFactory;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    public WhisperProcessManager(WhisperConfig cfg) {
        this(cfg, new DefaultProcessFactory());
    }

    WhisperProcessManager(WhisperConfig cfg, ProcessFactory processFactory) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes whisper.cpp and returns its stdout.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -nt -np
     * </pre>
     * {@code -nt} drops segment timestamps and {@code -np} suppresses progress output, so stdout
     * holds only transcript lines.
     *
     * @param wavPath WAV file written by the caller
     * @param modelPath GGML model file
     * @return raw stdout, possibly empty
     * @throws TranscriptionException on timeout, non-zero exit or I/O error
     */
    public String transcribe(Path wavPath, String modelPath) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(modelPath, "modelPath");

        List<String> command = buildCommand(wavPath, modelPath);
        long startNanos = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        try {
            Process process = processFactory.start(command, wavPath.getParent());
            this.current = process;
            // Start gobblers before waiting to avoid pipe-buffer deadlock
            this.outGobbler = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
            this.errGobbler = startGobbler(process.getErrorStream(), stderr, "whisper-err",
                    WhisperConstants.STDERR_MAX_BYTES);

            if (!process.waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS)) {
                destroyProcess(process);
                throw failure("Timeout after " + cfg.timeoutSeconds() + "s", -1, modelPath, stderr, startNanos, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, exitCode, modelPath, stderr, startNanos, null);
            }
            LOG.debug("whisper.cpp finished in {} ms, stdout={} chars",
                    TimeUtils.elapsedMillis(startNanos), stdout.length());
            return stdout.toString();
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), -1, modelPath, stderr, startNanos, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for whisper.cpp", -1, modelPath, stderr, startNanos, e);
        } finally {
            close();
        }
    }

    List<String> buildCommand(Path wavPath, String modelPath) {
        return List.of(
                resolvePath(cfg.binaryPath()).toString(),
                "-m", resolvePath(modelPath).toString(),
                "-f", wavPath.toAbsolutePath().toString(),
                "-l", cfg.language(),
                "-t", String.valueOf(cfg.threads()),
                "-nt",
                "-np");
    }

    /**
     * Resolves relative configuration paths against the working directory so the command does not
     * depend on the process working directory (the WAV's temp dir).
     */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        return path.isAbsolute() ? path : path.toAbsolutePath().normalize();
    }

    private TranscriptionException failure(String msg, int exitCode, String modelPath,
                                           StringBuilder stderr, long startNanos, Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(WhisperConstants.ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        return TranscriptionExceptionBuilder.create(msg)
                .engine(SttEngineNames.WHISPER)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", modelPath)
                .metadata("stderr", snippet)
                .cause(cause)
                .build();
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Copies lines into a shared buffer until {@code maxChars} is reached, then keeps draining the
     * stream without storing so the child process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            boolean capped = false;
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (capped) {
                        continue;
                    }
                    capped = append(line);
                    if (capped) {
                        LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }

        /** @return true once the cap has been hit */
        private boolean append(String line) {
            synchronized (sink) {
                if (!sink.isEmpty()) {
                    sink.append('\n');
                }
                int available = maxChars - sink.length();
                if (line.length() >= available) {
                    sink.append(line, 0, Math.max(0, available));
                    return true;
                }
                sink.append(line);
                return false;
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            if (!process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                if (!process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("whisper.cpp still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying whisper.cpp process");
        }
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
