package com.ai.codeindex.exception;

/**
 * Thrown when no valid upstream credential can be obtained. Indexing pauses on it instead of recording file errors.
 */
public class CredentialUnavailableException extends RuntimeException {
    public CredentialUnavailableException(String message) {
        super(message);
    }

    public CredentialUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
