package com.phillippitts.sttserver.exception;

/**
 * Thrown when the transcription worker is shut down or terminated before answering a job.
 */
public class WorkerUnavailableException extends AdmissionException {

    public WorkerUnavailableException(String message) {
        super(message);
    }

    public WorkerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "worker-unavailable";
    }
}
