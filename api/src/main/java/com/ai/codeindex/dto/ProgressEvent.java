package com.ai.codeindex.dto;

import com.ai.codeindex.entity.JobStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * Progress snapshot pushed to subscribers. {@code sequence} increases with every event
 * published for the job by this process.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressEvent(
        UUID jobId,
        long sequence,
        int processed,
        int total,
        JobStatus status,
        String lastError) {
}
