package com.ai.codeindex.entity;

public enum FileOutcomeStatus {
    SUCCESS,
    ERROR,
    SKIPPED
}
