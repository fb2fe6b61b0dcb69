package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import com.ai.codeindex.config.IndexingProperties;
import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileErrorType;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.ai.codeindex.entity.JobType;
import com.ai.codeindex.entity.StopReason;
import com.ai.codeindex.exception.CheckpointStoreException;
import com.ai.codeindex.exception.CredentialUnavailableException;
import com.ai.codeindex.exception.IndexStorageException;
import com.ai.codeindex.exception.JobNotFoundException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs indexing jobs: freezes a deterministic processing order, feeds fixed-size chunks of
 * it to a bounded worker pool, records every file outcome and advances the checkpoint, so
 * that a job interrupted at any point resumes without redoing succeeded files.
 *
 * <p>Each run has one driver thread. Workers never touch job state; they post
 * {@link WorkerEvent}s that the driver applies in arrival order.
 */
@Service
public class IndexJobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IndexJobOrchestrator.class);
    private static final long PERMIT_POLL_MS = 100;
    static final int MAX_PAGE_SIZE = 100;

    private final CheckpointStore store;
    private final RepositoryFileSource files;
    private final FileProcessor processor;
    private final CredentialSupervisor credentials;
    private final EmbeddingCache cache;
    private final ProgressBroadcaster progress;
    private final IndexingProperties properties;
    private final EmbeddingProperties embeddingProperties;
    private final Clock clock;

    private final ExecutorService workers;
    private final ExecutorService drivers;
    private final Semaphore dispatchPermits;
    private final Map<UUID, JobRun> activeRuns = new ConcurrentHashMap<>();

    public IndexJobOrchestrator(CheckpointStore store, RepositoryFileSource files, FileProcessor processor,
                                CredentialSupervisor credentials, EmbeddingCache cache,
                                ProgressBroadcaster progress, IndexingProperties properties,
                                EmbeddingProperties embeddingProperties, Clock clock) {
        this.store = store;
        this.files = files;
        this.processor = processor;
        this.credentials = credentials;
        this.cache = cache;
        this.progress = progress;
        this.properties = properties;
        this.embeddingProperties = embeddingProperties;
        this.clock = clock;

        int threads = Math.max(1, properties.getWorkerThreads());
        int queueCapacity = Math.max(1, properties.getQueueCapacity());
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity), namedThreads("index-worker-"));
        this.drivers = Executors.newCachedThreadPool(namedThreads("index-run-"));
        // never more chunks in flight than the pool can hold, so the queue cannot overflow
        this.dispatchPermits = new Semaphore(threads + queueCapacity);
    }

    /**
     * Submits a full job over every file of the repository.
     */
    public IndexJob submit(String repositoryRef, Integer requestedChunkSize) {
        return submit(JobSubmission.full(repositoryRef, requestedChunkSize));
    }

    /**
     * Enumerates the repository, applies the file selection, freezes the processing order and
     * starts the first run.
     */
    public IndexJob submit(JobSubmission submission) {
        String repositoryRef = submission.repositoryRef();
        if (repositoryRef == null || repositoryRef.isBlank()) {
            throw new IllegalArgumentException("repository_ref is required");
        }
        int chunkSize = properties.normalizeChunkSize(submission.chunkSize());
        FileSelection selection = FileSelection.of(submission.filePatterns(), submission.excludePatterns());
        String repoId = files.repositoryId(repositoryRef);
        String commit = files.resolveCommit(repositoryRef);

        List<String> listed = files.listFiles(repositoryRef);
        List<String> order = listed.stream()
                .distinct()
                .filter(selection::matches)
                .sorted()
                .toList();

        int alreadyIndexed = 0;
        if (submission.jobType() == JobType.INCREMENTAL && !submission.forceReindex()) {
            Set<String> indexed = store.succeededPaths(repoId, commit);
            List<String> pending = order.stream().filter(path -> !indexed.contains(path)).toList();
            alreadyIndexed = order.size() - pending.size();
            order = pending;
        }

        IndexJob job = new IndexJob(
                repositoryRef,
                repoId,
                commit,
                order.size(),
                chunkSize,
                embeddingProperties.getModel());
        job.setJobType(submission.jobType());
        job.setForceReindex(submission.forceReindex());
        job.setFilePatterns(selection.includes());
        job.setExcludePatterns(selection.excludes());
        job = store.createJob(job, new Checkpoint(job.getId(), order));

        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [JOB SUBMITTED] {}", job.getId());
        log.info("║   Repository: {} ({} @ {})", repositoryRef, job.getRepoId(), job.getCommitRef());
        log.info("║   Type: {}{}, Files listed: {}, selected: {}", job.getJobType(),
                job.isForceReindex() ? " (forced)" : "", listed.size(), order.size() + alreadyIndexed);
        if (alreadyIndexed > 0) {
            log.info("║   Already indexed at this commit: {}", alreadyIndexed);
        }
        log.info("║   Files in processing order: {}", order.size());
        log.info("║   Chunk size: {}, Embedding model: {}", chunkSize, job.getEmbedModel());
        log.info("╚══════════════════════════════════════════════════════════════════════════════");

        progress.publish(job.getId(), 0, order.size(), JobStatus.PENDING, null);

        if (order.isEmpty()) {
            job.setStatus(JobStatus.COMPLETED);
            job.setStartedAt(now());
            job.setCompletedAt(now());
            job = store.saveJob(job);
            progress.publish(job.getId(), 0, 0, JobStatus.COMPLETED, null);
            return job;
        }

        startRun(job.getId());
        return job;
    }

    public IndexJob status(UUID jobId) {
        return store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Jobs newest first. {@code status} may be null; the page size is capped at {@value #MAX_PAGE_SIZE}.
     */
    public JobPage listJobs(JobStatus status, int page, int size) {
        int boundedSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return store.listJobs(status, Math.max(0, page), boundedSize);
    }

    /**
     * Continues a paused, failed or interrupted job. No-op for completed or running jobs.
     */
    public IndexJob resume(UUID jobId) {
        IndexJob job = status(jobId);
        if (job.getStatus() == JobStatus.COMPLETED) {
            log.info("[Orchestrator] Resume of completed job {} ignored", jobId);
            return job;
        }
        if (!startRun(jobId)) {
            log.info("[Orchestrator] Job {} is already running", jobId);
        }
        return job;
    }

    /**
     * Stops dispatching new files. In-flight files finish and are recorded; the job ends up PAUSED.
     */
    public IndexJob cancel(UUID jobId) {
        return stop(jobId, StopReason.CANCELLED, "cancelled");
    }

    public IndexJob pause(UUID jobId) {
        return stop(jobId, StopReason.PAUSE_REQUESTED, "paused by request");
    }

    public Checkpoint checkpoint(UUID jobId) {
        status(jobId);
        return store.loadCheckpoint(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<FileOutcome> outcomes(UUID jobId) {
        status(jobId);
        return store.findOutcomes(jobId);
    }

    public boolean isActive(UUID jobId) {
        return activeRuns.containsKey(jobId);
    }

    /**
     * Waits up to {@code timeout} for the current run of a job to end and returns the job.
     */
    public IndexJob awaitCompletion(UUID jobId, Duration timeout) {
        JobRun run = activeRuns.get(jobId);
        if (run != null) {
            try {
                IndexJob finished = run.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (finished != null) {
                    return finished;
                }
            } catch (TimeoutException e) {
                log.debug("[Orchestrator] Job {} still running after {}", jobId, timeout);
            } catch (ExecutionException e) {
                log.warn("[Orchestrator] Run of job {} ended abnormally: {}", jobId, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return status(jobId);
    }

    /**
     * Restarts jobs a previous process left RUNNING or PENDING, or paused on shutdown.
     */
    public int recoverInterruptedJobs() {
        List<IndexJob> candidates = new ArrayList<>();
        try {
            candidates.addAll(store.findJobsByStatus(JobStatus.RUNNING));
            candidates.addAll(store.findJobsByStatus(JobStatus.PENDING));
            store.findJobsByStatus(JobStatus.PAUSED).stream()
                    .filter(j -> j.getStopReason() == StopReason.SHUTDOWN)
                    .forEach(candidates::add);
        } catch (CheckpointStoreException e) {
            log.error("[Recovery] Cannot list interrupted jobs: {}", e.getMessage());
            return 0;
        }

        int recovered = 0;
        for (IndexJob job : candidates) {
            if (startRun(job.getId())) {
                log.warn("[Recovery] Resuming interrupted job {} (was {})", job.getId(), job.getStatus());
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("[Recovery] Resumed {} interrupted job(s)", recovered);
        }
        return recovered;
    }

    /**
     * Resumes jobs paused by a degraded credential supervisor once it accepts requests again.
     */
    public int resumeDegradedJobs() {
        if (!credentials.isAcceptingRequests()) {
            return 0;
        }
        int resumed = 0;
        try {
            for (IndexJob job : store.findJobsByStatus(JobStatus.PAUSED)) {
                if (job.getStopReason() == StopReason.CREDENTIAL_DEGRADED && startRun(job.getId())) {
                    log.info("[Recovery] Credentials available again, resuming job {}", job.getId());
                    resumed++;
                }
            }
        } catch (CheckpointStoreException e) {
            log.error("[Recovery] Cannot list paused jobs: {}", e.getMessage());
        }
        return resumed;
    }

    /**
     * Remaining work of a job in processing order: files before the watermark whose
     * effective outcome is not SUCCESS (retries), then every file from the watermark on
     * that has not succeeded yet.
     */
    static List<String> planRemaining(Checkpoint checkpoint, Map<String, FileOutcome> effective) {
        // retries all sit below the watermark, so one pass in processing order puts them first
        List<String> remaining = new ArrayList<>();
        for (String path : checkpoint.getProcessingOrder()) {
            FileOutcome outcome = effective.get(path);
            if (outcome == null || !outcome.isSuccess()) {
                remaining.add(path);
            }
        }
        return remaining;
    }

    private IndexJob stop(UUID jobId, StopReason reason, String detail) {
        IndexJob job = status(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("[Orchestrator] Job {} already {}, {} ignored", jobId, job.getStatus(), reason);
            return job;
        }
        AtomicReference<IndexJob> result = new AtomicReference<>(job);
        // holding the run slot keeps a concurrent resume from starting until the job is updated
        activeRuns.compute(jobId, (id, run) -> {
            if (run != null) {
                log.info("[Orchestrator] Stop requested for job {}: {}", id, detail);
                run.requestStop(reason, detail);
                return run;
            }
            IndexJob current = status(id);
            if (!current.getStatus().isTerminal() && current.getStatus() != JobStatus.PAUSED) {
                current.setStatus(JobStatus.PAUSED);
                current.setStopReason(reason);
                current.setLastError(detail);
                current = store.saveJob(current);
                progress.publish(id, current.getProcessedFiles(), current.getTotalFiles(), JobStatus.PAUSED, detail);
            }
            result.set(current);
            return null;
        });
        return result.get();
    }

    private boolean startRun(UUID jobId) {
        JobRun run = new JobRun(jobId);
        if (activeRuns.putIfAbsent(jobId, run) != null) {
            return false;
        }
        try {
            drivers.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(jobId, run);
            throw new IllegalStateException("Orchestrator is shut down", e);
        }
        return true;
    }

    private void execute(JobRun run) {
        UUID jobId = run.jobId();
        IndexJob job = null;
        try {
            job = store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            Checkpoint checkpoint = store.loadCheckpoint(jobId)
                    .orElseThrow(() -> new CheckpointStoreException("No checkpoint for job " + jobId));
            Map<String, FileOutcome> effective = store.effectiveOutcomes(jobId);
            List<String> remaining = planRemaining(checkpoint, effective);
            RunTracker tracker = new RunTracker(checkpoint, effective, remaining);

            job.setStatus(JobStatus.RUNNING);
            job.setStopReason(null);
            job.setLastError(null);
            job.setCompletedAt(null);
            job.setAttempt(job.getAttempt() + 1);
            if (job.getStartedAt() == null) {
                job.setStartedAt(now());
            }
            tracker.applyCounts(job);
            job = store.saveJob(job);

            log.info("╔══════════════════════════════════════════════════════════════════════════════");
            log.info("║ [RUN START] Job {} attempt {}", jobId, job.getAttempt());
            log.info("║   Pending files: {} of {} (checkpoint at {})", remaining.size(), tracker.total(),
                    checkpoint.getNextIndex());
            log.info("╚══════════════════════════════════════════════════════════════════════════════");
            progress.publish(jobId, tracker.processed(), tracker.total(), JobStatus.RUNNING, null);

            FileTask task = new FileTask(jobId, job.getRepositoryRef(), job.getRepoId(), job.getCommitRef(),
                    job.getAttempt());
            job = dispatchAndCollect(run, task, job, checkpoint, tracker, remaining);
            job = finish(run, job, tracker);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Run of job {} aborted: {}", jobId, e.getMessage(), e);
            run.requestStop(StopReason.SYSTEMIC_FAILURE, e.getMessage());
            job = markFailed(job, e);
        } finally {
            activeRuns.remove(jobId, run);
            run.completion().complete(job);
        }
    }

    private IndexJob dispatchAndCollect(JobRun run, FileTask task, IndexJob job, Checkpoint checkpoint,
                                        RunTracker tracker, List<String> remaining) {
        List<FileChunk> chunks = FileChunk.partition(run.jobId(), remaining, job.getChunkSize());
        int dispatched = 0;
        int finished = 0;

        try {
            for (FileChunk chunk : chunks) {
                if (!run.isStopRequested() && !credentials.isAcceptingRequests()) {
                    run.requestStop(StopReason.CREDENTIAL_DEGRADED, "credential supervisor degraded");
                }
                if (run.isStopRequested()) {
                    break;
                }

                // keep applying results while waiting for room in the pool
                while (!dispatchPermits.tryAcquire(PERMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    WorkerEvent event;
                    while ((event = run.channel().poll()) != null) {
                        if (event instanceof WorkerEvent.ChunkDone) {
                            finished++;
                        }
                        job = apply(run, event, job, checkpoint, tracker);
                    }
                }

                try {
                    workers.execute(() -> runChunk(run, task, chunk));
                    dispatched++;
                } catch (RejectedExecutionException e) {
                    dispatchPermits.release();
                    log.error("[Orchestrator] Worker pool rejected chunk {} of job {}", chunk.chunkIndex(), run.jobId());
                    for (String path : chunk.filePaths()) {
                        job = apply(run, new WorkerEvent.FileDone(FileOutcome.error(run.jobId(), path,
                                FileErrorType.DISPATCH, "Worker pool rejected the chunk", task.attempt(), now())),
                                job, checkpoint, tracker);
                    }
                }
            }

            while (finished < dispatched) {
                WorkerEvent event = run.channel().take();
                if (event instanceof WorkerEvent.ChunkDone) {
                    finished++;
                }
                job = apply(run, event, job, checkpoint, tracker);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestStop(StopReason.SHUTDOWN, "service shutting down");
        }
        return job;
    }

    private void runChunk(JobRun run, FileTask task, FileChunk chunk) {
        try {
            for (String path : chunk.filePaths()) {
                if (run.isStopRequested()) {
                    break;
                }
                try {
                    run.channel().add(new WorkerEvent.FileDone(processor.process(task, path)));
                } catch (CredentialUnavailableException e) {
                    run.requestStop(StopReason.CREDENTIAL_DEGRADED, e.getMessage());
                    run.channel().add(new WorkerEvent.Halted(path, StopReason.CREDENTIAL_DEGRADED, e.getMessage()));
                    break;
                } catch (IndexStorageException e) {
                    run.requestStop(StopReason.SYSTEMIC_FAILURE, e.getMessage());
                    run.channel().add(new WorkerEvent.Halted(path, StopReason.SYSTEMIC_FAILURE, e.getMessage()));
                    break;
                } catch (RuntimeException e) {
                    log.error("[Orchestrator] Processor failed unexpectedly on {}: {}", path, e.getMessage());
                    run.channel().add(new WorkerEvent.FileDone(FileOutcome.error(task.jobId(), path,
                            FileErrorType.DISPATCH, e.getClass().getSimpleName() + ": " + e.getMessage(),
                            task.attempt(), now())));
                }
            }
        } finally {
            run.channel().add(new WorkerEvent.ChunkDone(chunk.chunkIndex()));
            dispatchPermits.release();
        }
    }

    private IndexJob apply(JobRun run, WorkerEvent event, IndexJob job, Checkpoint checkpoint, RunTracker tracker) {
        if (event instanceof WorkerEvent.FileDone done) {
            if (run.hasFailedSystemically()) {
                return job;
            }
            try {
                store.appendOutcome(done.outcome());
                tracker.record(done.outcome());
                if (checkpoint.advanceTo(tracker.watermark())) {
                    store.saveCheckpoint(checkpoint);
                }
                progress.publish(run.jobId(), tracker.processed(), tracker.total(), JobStatus.RUNNING, null);
            } catch (RuntimeException e) {
                log.error("[Orchestrator] Cannot record outcome of {}: {}", done.outcome().getFilePath(), e.getMessage());
                run.requestStop(StopReason.SYSTEMIC_FAILURE, "Checkpoint store failed: " + e.getMessage());
            }
        } else if (event instanceof WorkerEvent.Halted halted) {
            log.warn("[Orchestrator] Worker halted at {} ({}): {}", halted.path(), halted.reason(), halted.detail());
        } else if (event instanceof WorkerEvent.ChunkDone chunkDone) {
            if (run.hasFailedSystemically()) {
                return job;
            }
            tracker.applyCounts(job);
            try {
                job = store.saveJob(job);
            } catch (RuntimeException e) {
                run.requestStop(StopReason.SYSTEMIC_FAILURE, "Checkpoint store failed: " + e.getMessage());
                return job;
            }
            progress.publish(run.jobId(), tracker.processed(), tracker.total(), JobStatus.RUNNING, null);
            int percent = tracker.total() == 0 ? 100 : (int) ((tracker.processed() * 100.0) / tracker.total());
            log.info("[INDEXING PROGRESS] Job {} chunk {} done: {}/{} files ({}%), {} failed",
                    run.jobId(), chunkDone.chunkIndex(), tracker.processed(), tracker.total(), percent,
                    job.getFailedFiles());
            checkFailureRatio(run, tracker);
        }
        return job;
    }

    private void checkFailureRatio(JobRun run, RunTracker tracker) {
        double maxRatio = properties.getMaxFailureRatio();
        if (maxRatio <= 0 || tracker.cycleRecorded() < properties.getFailureRatioMinFiles()) {
            return;
        }
        double ratio = (double) tracker.cycleFailures() / tracker.cycleRecorded();
        if (ratio > maxRatio) {
            run.requestStop(StopReason.FAILURE_RATIO, String.format(
                    "failure rate %.0f%% exceeds %.0f%% after %d files", ratio * 100, maxRatio * 100,
                    tracker.cycleRecorded()));
        }
    }

    private IndexJob finish(JobRun run, IndexJob job, RunTracker tracker) {
        JobRun.Stop stop = run.stop();
        tracker.applyCounts(job);
        EmbeddingCache.CacheStats stats = cache.drainStats(run.jobId());
        job.addCacheStats(stats.hits(), stats.misses());

        if (stop != null && stop.reason() == StopReason.SYSTEMIC_FAILURE) {
            job.setStatus(JobStatus.FAILED);
            job.setStopReason(StopReason.SYSTEMIC_FAILURE);
            job.setLastError(stop.detail());
            job.setCompletedAt(now());
        } else if (tracker.cycleComplete()) {
            job.setStatus(JobStatus.COMPLETED);
            job.setStopReason(null);
            job.setLastError(null);
            job.setCompletedAt(now());
        } else {
            job.setStatus(JobStatus.PAUSED);
            job.setStopReason(stop != null ? stop.reason() : StopReason.SHUTDOWN);
            job.setLastError(stop != null ? stop.detail() : "run ended before all files were processed");
        }

        try {
            job = store.saveJob(job);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Cannot persist final state of job {}; it will be recovered on restart: {}",
                    run.jobId(), e.getMessage());
        }
        progress.publish(run.jobId(), tracker.processed(), tracker.total(), job.getStatus(), job.getLastError());

        log.info("╔══════════════════════════════════════════════════════════════════════════════");
        log.info("║ [RUN END] Job {} attempt {}", run.jobId(), job.getAttempt());
        log.info("║   Status: {}{}", job.getStatus(), job.isPartialSuccess() ? " (partial success)" : "");
        log.info("║   Succeeded: {}, Failed: {}, Skipped: {} of {}", job.getSucceededFiles(),
                job.getFailedFiles(), job.getSkippedFiles(), job.getTotalFiles());
        log.info("║   Embedding cache: {} hits, {} misses", job.getCacheHits(), job.getCacheMisses());
        if (job.getLastError() != null) {
            log.info("║   Reason: {}", job.getLastError());
        }
        log.info("╚══════════════════════════════════════════════════════════════════════════════");
        return job;
    }

    private IndexJob markFailed(IndexJob job, RuntimeException cause) {
        if (job == null) {
            return null;
        }
        job.setStatus(JobStatus.FAILED);
        job.setStopReason(StopReason.SYSTEMIC_FAILURE);
        job.setLastError(cause.getMessage());
        job.setCompletedAt(now());
        try {
            job = store.saveJob(job);
            progress.publish(job.getId(), job.getProcessedFiles(), job.getTotalFiles(), JobStatus.FAILED,
                    job.getLastError());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Cannot persist failure of job {}: {}", job.getId(), e.getMessage());
        }
        return job;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.values().forEach(run -> run.requestStop(StopReason.SHUTDOWN, "service shutting down"));
        drivers.shutdown();
        workers.shutdown();
        try {
            if (!drivers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("[Orchestrator] Runs still active after shutdown grace period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        drivers.shutdownNow();
        workers.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
