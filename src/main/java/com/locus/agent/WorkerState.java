package com.locus.agent;

/**
 * Where the worker loop currently is.
 */
public enum WorkerState {
    IDLE,
    DISPATCHING,
    CLAIMED,
    ISOLATING,
    EXECUTING,
    INTEGRATING,
    REPORTING,
    FINALIZING,
    FINISHED,
    SHUTDOWN;

    public boolean isTerminal() {
        return this == FINISHED || this == SHUTDOWN;
    }
}
