package com.ai.codeindex.support;

import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.ai.codeindex.exception.CheckpointStoreException;
import com.ai.codeindex.service.CheckpointStore;
import com.ai.codeindex.service.JobPage;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * One process's connection to a shared store. After {@link #kill()} every call fails,
 * the way a crashed process can no longer write anything.
 */
public class KillableCheckpointStore implements CheckpointStore {

    private final CheckpointStore delegate;
    private volatile boolean killed;

    public KillableCheckpointStore(CheckpointStore delegate) {
        this.delegate = delegate;
    }

    public void kill() {
        killed = true;
    }

    private <T> T call(Supplier<T> action) {
        if (killed) {
            throw new CheckpointStoreException("process killed");
        }
        return action.get();
    }

    @Override
    public IndexJob createJob(IndexJob job, Checkpoint checkpoint) {
        return call(() -> delegate.createJob(job, checkpoint));
    }

    @Override
    public Optional<IndexJob> findJob(UUID jobId) {
        return call(() -> delegate.findJob(jobId));
    }

    @Override
    public IndexJob saveJob(IndexJob job) {
        return call(() -> delegate.saveJob(job));
    }

    @Override
    public List<IndexJob> findJobsByStatus(JobStatus status) {
        return call(() -> delegate.findJobsByStatus(status));
    }

    @Override
    public JobPage listJobs(JobStatus status, int page, int size) {
        return call(() -> delegate.listJobs(status, page, size));
    }

    @Override
    public Set<String> succeededPaths(String repoId, String commitRef) {
        return call(() -> delegate.succeededPaths(repoId, commitRef));
    }

    @Override
    public Optional<Checkpoint> loadCheckpoint(UUID jobId) {
        return call(() -> delegate.loadCheckpoint(jobId));
    }

    @Override
    public void saveCheckpoint(Checkpoint checkpoint) {
        call(() -> {
            delegate.saveCheckpoint(checkpoint);
            return null;
        });
    }

    @Override
    public FileOutcome appendOutcome(FileOutcome outcome) {
        return call(() -> delegate.appendOutcome(outcome));
    }

    @Override
    public List<FileOutcome> findOutcomes(UUID jobId) {
        return call(() -> delegate.findOutcomes(jobId));
    }
}
