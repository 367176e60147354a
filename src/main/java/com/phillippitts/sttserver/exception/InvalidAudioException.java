package com.phillippitts.sttserver.exception;

/**
 * Thrown when an audio payload cannot be decoded as 16kHz, 16-bit signed PCM, mono, little-endian.
 * This is a caller fault: it is surfaced to the requester and never retried.
 */
public class InvalidAudioException extends SttServerException {

    /**
     * Why the payload was rejected.
     */
    public enum Reason {
        /** The payload contained no bytes at all. */
        EMPTY_INPUT,
        /** The payload length is not a whole number of 16-bit samples. */
        MISALIGNED_LENGTH
    }

    private final int audioSize;
    private final Reason reason;

    public InvalidAudioException(Reason reason, String detail) {
        this(0, reason, detail);
    }

    public InvalidAudioException(int audioSize, Reason reason, String detail) {
        super("Invalid audio data (" + audioSize + " bytes): " + detail);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public Reason getReason() {
        return reason;
    }
}
