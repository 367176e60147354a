package com.phillippitts.sttserver.service.dispatch;

/**
 * Lifecycle of the transcription worker. Transitions only move forward; {@link #STOPPED} is terminal.
 */
public enum WorkerState {
    /** Constructed; engine not yet loaded. */
    NEW,
    /** Engine loaded and the worker thread is consuming jobs. */
    RUNNING,
    /** Queue closed and drained, or the worker died. Engine released. */
    STOPPED
}
