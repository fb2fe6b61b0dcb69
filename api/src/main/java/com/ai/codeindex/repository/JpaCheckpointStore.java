package com.ai.codeindex.repository;

import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.FileOutcomeStatus;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.ai.codeindex.exception.CheckpointStoreException;
import com.ai.codeindex.service.CheckpointStore;
import com.ai.codeindex.service.JobPage;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link CheckpointStore} on the relational database through Spring Data JPA.
 */
@Component
public class JpaCheckpointStore implements CheckpointStore {

    private final IndexJobRepository jobRepository;
    private final CheckpointRepository checkpointRepository;
    private final FileOutcomeRepository outcomeRepository;

    public JpaCheckpointStore(IndexJobRepository jobRepository,
                              CheckpointRepository checkpointRepository,
                              FileOutcomeRepository outcomeRepository) {
        this.jobRepository = jobRepository;
        this.checkpointRepository = checkpointRepository;
        this.outcomeRepository = outcomeRepository;
    }

    @Override
    @Transactional
    public IndexJob createJob(IndexJob job, Checkpoint checkpoint) {
        return guarded("create job", () -> {
            IndexJob saved = jobRepository.save(job);
            checkpointRepository.save(checkpoint);
            return saved;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IndexJob> findJob(UUID jobId) {
        return guarded("find job", () -> jobRepository.findById(jobId));
    }

    @Override
    @Transactional
    public IndexJob saveJob(IndexJob job) {
        return guarded("save job", () -> jobRepository.save(job));
    }

    @Override
    @Transactional(readOnly = true)
    public List<IndexJob> findJobsByStatus(JobStatus status) {
        return guarded("list jobs", () -> jobRepository.findByStatusOrderByCreatedAtAsc(status));
    }

    @Override
    @Transactional(readOnly = true)
    public JobPage listJobs(JobStatus status, int page, int size) {
        PageRequest request = PageRequest.of(page, size, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.asc("id")));
        Page<IndexJob> result = guarded("list jobs", () -> status == null
                ? jobRepository.findAll(request)
                : jobRepository.findByStatus(status, request));
        return new JobPage(result.getContent(), page, size, result.getTotalElements());
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> succeededPaths(String repoId, String commitRef) {
        return guarded("list indexed paths", () -> new HashSet<>(
                outcomeRepository.findPathsWithStatus(repoId, commitRef, FileOutcomeStatus.SUCCESS)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> loadCheckpoint(UUID jobId) {
        return guarded("load checkpoint", () -> checkpointRepository.findById(jobId));
    }

    @Override
    @Transactional
    public void saveCheckpoint(Checkpoint checkpoint) {
        guarded("save checkpoint", () -> checkpointRepository.save(checkpoint));
    }

    @Override
    @Transactional
    public FileOutcome appendOutcome(FileOutcome outcome) {
        if (outcome.getId() != null) {
            throw new IllegalArgumentException("File outcomes are append-only");
        }
        return guarded("append outcome", () -> outcomeRepository.save(outcome));
    }

    @Override
    @Transactional(readOnly = true)
    public List<FileOutcome> findOutcomes(UUID jobId) {
        return guarded("list outcomes", () -> outcomeRepository.findByJobIdOrderByIdAsc(jobId));
    }

    private static <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CheckpointStoreException("Checkpoint store failed to " + operation + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
