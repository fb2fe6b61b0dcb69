package com.ai.codeindex.service;

import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable job state: the job row, its checkpoint and its append-only file outcomes.
 * Implementations throw {@link com.ai.codeindex.exception.CheckpointStoreException} when
 * the backing store cannot be reached.
 */
public interface CheckpointStore {

    /**
     * Persists a new job together with its initial checkpoint.
     */
    IndexJob createJob(IndexJob job, Checkpoint checkpoint);

    Optional<IndexJob> findJob(UUID jobId);

    IndexJob saveJob(IndexJob job);

    List<IndexJob> findJobsByStatus(JobStatus status);

    /**
     * Jobs newest first, optionally restricted to one status.
     */
    JobPage listJobs(JobStatus status, int page, int size);

    /**
     * Paths with a successful outcome in any job over the same repository and commit.
     */
    Set<String> succeededPaths(String repoId, String commitRef);

    Optional<Checkpoint> loadCheckpoint(UUID jobId);

    void saveCheckpoint(Checkpoint checkpoint);

    FileOutcome appendOutcome(FileOutcome outcome);

    /**
     * Every recorded outcome of the job, oldest first.
     */
    List<FileOutcome> findOutcomes(UUID jobId);

    /**
     * Latest outcome per path.
     */
    default Map<String, FileOutcome> effectiveOutcomes(UUID jobId) {
        Map<String, FileOutcome> effective = new LinkedHashMap<>();
        for (FileOutcome outcome : findOutcomes(jobId)) {
            effective.put(outcome.getFilePath(), outcome);
        }
        return effective;
    }
}
