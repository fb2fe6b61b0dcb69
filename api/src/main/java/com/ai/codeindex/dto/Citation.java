package com.ai.codeindex.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Where a result lives: path, 1-based inclusive line span and commit.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Citation(String path, int startLine, int endLine, String commit) {
}
