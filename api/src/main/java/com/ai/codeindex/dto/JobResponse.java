package com.ai.codeindex.dto;

import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for job status.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
        UUID jobId,
        String repositoryRef,
        String repoId,
        String commit,
        String status,
        String jobType,
        boolean forceReindex,
        List<String> filePatterns,
        List<String> excludePatterns,
        String completion,
        String stopReason,
        int totalFiles,
        int processedFiles,
        int succeededFiles,
        int failedFiles,
        int skippedFiles,
        int progress,
        String message,
        int chunkSize,
        String embedModel,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        int attempt,
        String lastError,
        OffsetDateTime createdAt,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt) {

    public static JobResponse from(IndexJob job) {
        int total = job.getTotalFiles();
        int processed = job.getProcessedFiles();

        // Calculate progress percentage (0-100)
        int progress = total > 0 ? (int) ((processed * 100.0) / total) : 100;

        String completion = null;
        if (job.getStatus() == JobStatus.COMPLETED) {
            completion = job.isPartialSuccess() ? "PARTIAL_SUCCESS" : "FULL_SUCCESS";
        }

        String message = switch (job.getStatus()) {
            case PENDING -> "Waiting to start...";
            case RUNNING -> String.format("Indexing files... (%d/%d)", processed, total);
            case PAUSED -> job.getLastError() != null ? "Paused: " + job.getLastError() : "Paused";
            case COMPLETED -> job.isPartialSuccess()
                    ? String.format("Completed with errors. %d/%d files failed.", job.getFailedFiles(), total)
                    : String.format("Completed! %d files indexed, %d skipped.", job.getSucceededFiles(), job.getSkippedFiles());
            case FAILED -> job.getLastError() != null ? job.getLastError() : "Indexing failed.";
        };

        long lookups = job.getCacheHits() + job.getCacheMisses();
        double hitRate = lookups == 0 ? 0.0 : (double) job.getCacheHits() / lookups;

        return new JobResponse(
                job.getId(),
                job.getRepositoryRef(),
                job.getRepoId(),
                job.getCommitRef(),
                job.getStatus().name(),
                job.getJobType().name(),
                job.isForceReindex(),
                job.getFilePatterns(),
                job.getExcludePatterns(),
                completion,
                job.getStopReason() != null ? job.getStopReason().name() : null,
                total,
                processed,
                job.getSucceededFiles(),
                job.getFailedFiles(),
                job.getSkippedFiles(),
                progress,
                message,
                job.getChunkSize(),
                job.getEmbedModel(),
                job.getCacheHits(),
                job.getCacheMisses(),
                hitRate,
                job.getAttempt(),
                job.getLastError(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt());
    }
}
