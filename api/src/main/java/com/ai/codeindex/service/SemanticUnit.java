package com.ai.codeindex.service;

/**
 * A contiguous, line-addressed piece of a source file. Lines are 1-based and inclusive.
 */
public record SemanticUnit(String content, int startLine, int endLine, String language, String kind) {
}
