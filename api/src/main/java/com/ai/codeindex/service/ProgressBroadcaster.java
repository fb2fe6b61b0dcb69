package com.ai.codeindex.service;

import com.ai.codeindex.config.IndexingProperties;
import com.ai.codeindex.dto.ProgressEvent;
import com.ai.codeindex.entity.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keeps the latest progress snapshot per job and fans events out to subscribers.
 * Delivery is best-effort: a subscriber that throws is dropped.
 *
 * <p>Sequence numbers come from one process-wide counter, so they keep increasing for a job
 * even after its snapshot was evicted and the job is resumed later.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private record Snapshot(ProgressEvent event, Instant publishedAt) {
    }

    private final Clock clock;
    private final Duration retention;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<UUID, Snapshot> latest = new ConcurrentHashMap<>();
    private final Map<UUID, List<Consumer<ProgressEvent>>> listeners = new ConcurrentHashMap<>();

    public ProgressBroadcaster(Clock clock, IndexingProperties properties) {
        this.clock = clock;
        this.retention = properties.getProgressRetention();
    }

    public ProgressEvent publish(UUID jobId, int processed, int total, JobStatus status, String lastError) {
        // sequence allocation and snapshot replacement must not interleave for one job
        Snapshot snapshot = latest.compute(jobId, (id, previous) -> new Snapshot(
                new ProgressEvent(id, sequence.incrementAndGet(), processed, total, status, lastError),
                clock.instant()));
        ProgressEvent event = snapshot.event();
        for (Consumer<ProgressEvent> listener : listeners.getOrDefault(jobId, List.of())) {
            deliver(jobId, listener, event);
        }
        return event;
    }

    /**
     * Registers {@code listener} and replays the latest snapshot to it. Returns the unsubscribe action.
     */
    public Runnable subscribe(UUID jobId, Consumer<ProgressEvent> listener) {
        listeners.compute(jobId, (id, list) -> {
            List<Consumer<ProgressEvent>> jobListeners = list != null ? list : new CopyOnWriteArrayList<>();
            jobListeners.add(listener);
            return jobListeners;
        });
        Snapshot snapshot = latest.get(jobId);
        if (snapshot != null) {
            deliver(jobId, listener, snapshot.event());
        }
        return () -> unsubscribe(jobId, listener);
    }

    public Optional<ProgressEvent> latest(UUID jobId) {
        return Optional.ofNullable(latest.get(jobId)).map(Snapshot::event);
    }

    /**
     * Drops snapshots of jobs that stopped running more than the retention period ago and
     * have no subscribers left. Returns how many were dropped.
     */
    @Scheduled(fixedDelayString = "${indexing.progress-eviction-interval-ms:300000}")
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Map.Entry<UUID, Snapshot> entry : latest.entrySet()) {
            UUID jobId = entry.getKey();
            Snapshot snapshot = entry.getValue();
            if (isLive(snapshot.event().status()) || snapshot.publishedAt().isAfter(cutoff)
                    || !listeners.getOrDefault(jobId, List.of()).isEmpty()) {
                continue;
            }
            // a publish that raced in keeps the entry
            if (latest.remove(jobId, snapshot)) {
                listeners.computeIfPresent(jobId, (id, list) -> list.isEmpty() ? null : list);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[Progress] Evicted {} idle job snapshot(s)", evicted);
        }
        return evicted;
    }

    int trackedJobs() {
        return latest.size();
    }

    private static boolean isLive(JobStatus status) {
        return status == JobStatus.RUNNING || status == JobStatus.PENDING;
    }

    private void unsubscribe(UUID jobId, Consumer<ProgressEvent> listener) {
        listeners.computeIfPresent(jobId, (id, list) -> {
            list.remove(listener);
            return list.isEmpty() ? null : list;
        });
    }

    private void deliver(UUID jobId, Consumer<ProgressEvent> listener, ProgressEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.debug("[Progress] Dropping subscriber of job {}: {}", jobId, e.getMessage());
            unsubscribe(jobId, listener);
        }
    }
}
