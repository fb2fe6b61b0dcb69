package com.ai.codeindex.exception;

/**
 * Thrown when the text or vector index store is unreachable. Fails the whole run, never a single file.
 */
public class IndexStorageException extends RuntimeException {
    public IndexStorageException(String message) {
        super(message);
    }

    public IndexStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
