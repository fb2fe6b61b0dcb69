package com.ai.codeindex.dto;

import com.ai.codeindex.entity.FileOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FileOutcomeResponse(
        String filePath,
        String status,
        String errorType,
        String errorDetail,
        int entitiesEmitted,
        int attempt,
        OffsetDateTime processedAt) {

    public static FileOutcomeResponse from(FileOutcome outcome) {
        return new FileOutcomeResponse(
                outcome.getFilePath(),
                outcome.getStatus().name(),
                outcome.getErrorType() != null ? outcome.getErrorType().name() : null,
                outcome.getErrorDetail(),
                outcome.getEntitiesEmitted(),
                outcome.getAttempt(),
                outcome.getProcessedAt());
    }
}
