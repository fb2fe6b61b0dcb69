package com.ai.codeindex.entity;

/**
 * FULL indexes every selected file. INCREMENTAL leaves out files an earlier job already
 * indexed for the same repository and commit, unless a re-index is forced.
 */
public enum JobType {
    FULL,
    INCREMENTAL
}
