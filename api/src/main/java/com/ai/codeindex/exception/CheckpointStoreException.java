package com.ai.codeindex.exception;

/**
 * Thrown when job state, checkpoints or file outcomes cannot be read or written.
 */
public class CheckpointStoreException extends RuntimeException {
    public CheckpointStoreException(String message) {
        super(message);
    }

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
