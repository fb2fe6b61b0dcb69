package com.ai.codeindex.entity;

/**
 * Lifecycle states of an indexing job.
 * PARTIAL_SUCCESS is not a state of its own: a COMPLETED job with failed files reports it.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
