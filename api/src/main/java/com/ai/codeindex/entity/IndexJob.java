package com.ai.codeindex.entity;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "index_jobs")
public class IndexJob {

    @Id
    private UUID id;

    @Column(name = "repository_ref", nullable = false, length = 1000)
    private String repositoryRef;

    @Column(name = "repo_id", nullable = false)
    private String repoId;

    @Column(name = "commit_ref", nullable = false)
    private String commitRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "stop_reason")
    private StopReason stopReason;

    @Column(name = "total_files")
    private int totalFiles;

    @Column(name = "chunk_size")
    private int chunkSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType = JobType.FULL;

    @Column(name = "force_reindex")
    private boolean forceReindex;

    @Column(name = "file_patterns", columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> filePatterns = new ArrayList<>();

    @Column(name = "exclude_patterns", columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> excludePatterns = new ArrayList<>();

    @Column(name = "succeeded_files")
    private int succeededFiles;

    @Column(name = "failed_files")
    private int failedFiles;

    @Column(name = "skipped_files")
    private int skippedFiles;

    @Column(name = "cache_hits")
    private long cacheHits;

    @Column(name = "cache_misses")
    private long cacheMisses;

    @Column(name = "embed_model")
    private String embedModel;

    @Column(name = "attempt")
    private int attempt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected IndexJob() {
    }

    public IndexJob(String repositoryRef, String repoId, String commitRef, int totalFiles, int chunkSize, String embedModel) {
        this.id = UUID.randomUUID();
        this.repositoryRef = repositoryRef;
        this.repoId = repoId;
        this.commitRef = commitRef;
        this.totalFiles = totalFiles;
        this.chunkSize = chunkSize;
        this.embedModel = embedModel;
        this.createdAt = OffsetDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        updatedAt = OffsetDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public int getProcessedFiles() {
        return succeededFiles + failedFiles + skippedFiles;
    }

    /**
     * A completed job that still carries failed files.
     */
    public boolean isPartialSuccess() {
        return status == JobStatus.COMPLETED && failedFiles > 0;
    }

    public void addCacheStats(long hits, long misses) {
        this.cacheHits += hits;
        this.cacheMisses += misses;
    }

    // Getters and setters
    public UUID getId() {
        return id;
    }

    public String getRepositoryRef() {
        return repositoryRef;
    }

    public String getRepoId() {
        return repoId;
    }

    public String getCommitRef() {
        return commitRef;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public void setStopReason(StopReason stopReason) {
        this.stopReason = stopReason;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public JobType getJobType() {
        return jobType;
    }

    public void setJobType(JobType jobType) {
        this.jobType = jobType;
    }

    public boolean isForceReindex() {
        return forceReindex;
    }

    public void setForceReindex(boolean forceReindex) {
        this.forceReindex = forceReindex;
    }

    public List<String> getFilePatterns() {
        return filePatterns;
    }

    public void setFilePatterns(List<String> filePatterns) {
        this.filePatterns = filePatterns == null ? new ArrayList<>() : new ArrayList<>(filePatterns);
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns == null ? new ArrayList<>() : new ArrayList<>(excludePatterns);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getSucceededFiles() {
        return succeededFiles;
    }

    public void setSucceededFiles(int succeededFiles) {
        this.succeededFiles = succeededFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public void setFailedFiles(int failedFiles) {
        this.failedFiles = failedFiles;
    }

    public int getSkippedFiles() {
        return skippedFiles;
    }

    public void setSkippedFiles(int skippedFiles) {
        this.skippedFiles = skippedFiles;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public String getEmbedModel() {
        return embedModel;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError == null || lastError.length() <= 2000
                ? lastError
                : lastError.substring(0, 1997) + "...";
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
