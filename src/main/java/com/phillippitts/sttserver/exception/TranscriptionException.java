package com.phillippitts.sttserver.exception;

/**
 * Thrown when an engine fails to transcribe one job's audio.
 *
 * <p>The failure is local to the affected job: the worker delivers it through that job's result
 * channel and keeps serving subsequent jobs.
 */
public class TranscriptionException extends SttServerException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
