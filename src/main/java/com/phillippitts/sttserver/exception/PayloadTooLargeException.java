package com.phillippitts.sttserver.exception;

/**
 * Thrown when a request body exceeds the configured maximum payload size.
 */
public class PayloadTooLargeException extends SttServerException {

    private final long maxBytes;

    public PayloadTooLargeException(long actualBytes, long maxBytes) {
        super("Audio payload too large: " + (actualBytes < 0 ? "more than " + maxBytes : actualBytes)
                + " bytes. Max: " + maxBytes + " bytes");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
