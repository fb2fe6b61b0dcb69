package com.ai.codeindex.entity;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One recorded result of processing a file. Rows are append-only; the latest row
 * for a (job, path) pair is the effective outcome.
 */
@Entity
@Table(name = "file_outcomes", indexes = @Index(name = "idx_file_outcomes_job", columnList = "job_id"))
public class FileOutcome {

    public static final int MAX_ERROR_DETAIL = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "file_path", nullable = false, length = 1000)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileOutcomeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_type")
    private FileErrorType errorType;

    @Column(name = "error_detail", length = MAX_ERROR_DETAIL)
    private String errorDetail;

    @Column(name = "entities_emitted")
    private int entitiesEmitted;

    @Column(name = "attempt")
    private int attempt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    protected FileOutcome() {
    }

    private FileOutcome(UUID jobId, String filePath, FileOutcomeStatus status, FileErrorType errorType,
                        String errorDetail, int entitiesEmitted, int attempt, OffsetDateTime processedAt) {
        this.jobId = jobId;
        this.filePath = filePath;
        this.status = status;
        this.errorType = errorType;
        this.errorDetail = truncate(errorDetail);
        this.entitiesEmitted = entitiesEmitted;
        this.attempt = attempt;
        this.processedAt = processedAt;
    }

    public static FileOutcome success(UUID jobId, String filePath, int entitiesEmitted, int attempt, OffsetDateTime at) {
        return new FileOutcome(jobId, filePath, FileOutcomeStatus.SUCCESS, null, null, entitiesEmitted, attempt, at);
    }

    public static FileOutcome error(UUID jobId, String filePath, FileErrorType type, String detail, int attempt, OffsetDateTime at) {
        return new FileOutcome(jobId, filePath, FileOutcomeStatus.ERROR, type, detail, 0, attempt, at);
    }

    public static FileOutcome skipped(UUID jobId, String filePath, String detail, int attempt, OffsetDateTime at) {
        return new FileOutcome(jobId, filePath, FileOutcomeStatus.SKIPPED, FileErrorType.UNSUPPORTED, detail, 0, attempt, at);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_ERROR_DETAIL) {
            return detail;
        }
        return detail.substring(0, MAX_ERROR_DETAIL - 3) + "...";
    }

    public boolean isSuccess() {
        return status == FileOutcomeStatus.SUCCESS;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getFilePath() {
        return filePath;
    }

    public FileOutcomeStatus getStatus() {
        return status;
    }

    public FileErrorType getErrorType() {
        return errorType;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public int getEntitiesEmitted() {
        return entitiesEmitted;
    }

    public int getAttempt() {
        return attempt;
    }

    public OffsetDateTime getProcessedAt() {
        return processedAt;
    }
}
