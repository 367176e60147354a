package com.phillippitts.sttserver.exception;

/**
 * Base exception for all stt-server application-specific errors.
 * All domain exceptions extend this class so the REST boundary can handle them centrally.
 */
public class SttServerException extends RuntimeException {

    public SttServerException(String message) {
        super(message);
    }

    public SttServerException(String message, Throwable cause) {
        super(message, cause);
    }

    public SttServerException(Throwable cause) {
        super(cause);
    }
}
