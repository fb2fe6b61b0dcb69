package com.ai.codeindex.exception;

/**
 * Thrown when the embedding endpoint is down, times out or answers with an unusable payload.
 */
public class EmbeddingProviderException extends RuntimeException {

    private final boolean timeout;

    public EmbeddingProviderException(String message) {
        this(message, null, false);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public EmbeddingProviderException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
