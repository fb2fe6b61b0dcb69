package com.ai.codeindex.entity;

/**
 * Why a run stopped before every pending file got an outcome.
 */
public enum StopReason {
    CANCELLED,
    PAUSE_REQUESTED,
    CREDENTIAL_DEGRADED,
    FAILURE_RATIO,
    SYSTEMIC_FAILURE,
    /** Service stopped mid-run; resumed automatically on the next start. */
    SHUTDOWN
}
