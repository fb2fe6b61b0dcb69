package com.ai.codeindex.service;

import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.StopReason;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process state of one execution of a job.
 */
final class JobRun {

    record Stop(StopReason reason, String detail) {
    }

    private final UUID jobId;
    private final BlockingQueue<WorkerEvent> channel = new LinkedBlockingQueue<>();
    private final AtomicReference<Stop> stop = new AtomicReference<>();
    private final CompletableFuture<IndexJob> completion = new CompletableFuture<>();

    JobRun(UUID jobId) {
        this.jobId = jobId;
    }

    UUID jobId() {
        return jobId;
    }

    BlockingQueue<WorkerEvent> channel() {
        return channel;
    }

    /**
     * First request wins, except that a systemic failure overrides any softer reason.
     */
    void requestStop(StopReason reason, String detail) {
        Stop requested = new Stop(reason, detail);
        if (reason == StopReason.SYSTEMIC_FAILURE) {
            stop.getAndUpdate(current -> current != null && current.reason() == StopReason.SYSTEMIC_FAILURE
                    ? current : requested);
        } else {
            stop.compareAndSet(null, requested);
        }
    }

    boolean isStopRequested() {
        return stop.get() != null;
    }

    boolean hasFailedSystemically() {
        Stop current = stop.get();
        return current != null && current.reason() == StopReason.SYSTEMIC_FAILURE;
    }

    Stop stop() {
        return stop.get();
    }

    CompletableFuture<IndexJob> completion() {
        return completion;
    }
}
