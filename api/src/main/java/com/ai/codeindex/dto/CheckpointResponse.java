package com.ai.codeindex.dto;

import com.ai.codeindex.entity.Checkpoint;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckpointResponse(
        UUID jobId,
        int layoutVersion,
        List<String> processingOrder,
        int nextIndex,
        OffsetDateTime updatedAt) {

    public static CheckpointResponse from(Checkpoint checkpoint) {
        return new CheckpointResponse(
                checkpoint.getJobId(),
                checkpoint.getLayoutVersion(),
                checkpoint.getProcessingOrder(),
                checkpoint.getNextIndex(),
                checkpoint.getUpdatedAt());
    }
}
