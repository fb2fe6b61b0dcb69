package com.ai.codeindex.index;

/**
 * A ranked hit from one retrieval branch. Higher score is better within its branch only.
 */
public record IndexHit(String recordId, double score) {
}
