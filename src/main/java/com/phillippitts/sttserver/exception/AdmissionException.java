package com.phillippitts.sttserver.exception;

/**
 * Transient server-capacity fault raised when a transcription job cannot be accepted or answered.
 *
 * <p>Admission failures are retryable from the client's point of view and never terminate the process.
 * Subclasses distinguish a saturated queue from an absent worker for logging and metrics; the REST
 * boundary renders both the same way.
 */
public abstract class AdmissionException extends SttServerException {

    protected AdmissionException(String message) {
        super(message);
    }

    protected AdmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason used as a metrics tag (e.g. "queue-full").
     *
     * @return reason tag
     */
    public abstract String reason();
}
