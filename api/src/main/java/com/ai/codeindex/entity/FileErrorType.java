package com.ai.codeindex.entity;

/**
 * Pipeline stage a file-level failure happened in.
 */
public enum FileErrorType {
    READ,
    PARSE,
    TIMEOUT,
    EMBEDDING,
    INDEX_WRITE,
    UNSUPPORTED,
    DISPATCH
}
