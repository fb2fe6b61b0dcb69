package com.ai.codeindex.exception;

/**
 * Thrown when both retrieval branches failed for a query.
 */
public class SearchUnavailableException extends RuntimeException {
    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
