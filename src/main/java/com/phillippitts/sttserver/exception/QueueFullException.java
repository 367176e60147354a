package com.phillippitts.sttserver.exception;

/**
 * Thrown synchronously by the dispatcher when the job queue is already at capacity.
 */
public class QueueFullException extends AdmissionException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Transcription queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String reason() {
        return "queue-full";
    }
}
