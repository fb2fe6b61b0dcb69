package com.ai.codeindex.controller;

import com.ai.codeindex.dto.CheckpointResponse;
import com.ai.codeindex.dto.FileOutcomeResponse;
import com.ai.codeindex.dto.JobPageResponse;
import com.ai.codeindex.dto.JobResponse;
import com.ai.codeindex.dto.JobSubmittedResponse;
import com.ai.codeindex.dto.ProgressEvent;
import com.ai.codeindex.dto.SubmitJobRequest;
import com.ai.codeindex.entity.IndexJob;
import com.ai.codeindex.entity.JobStatus;
import com.ai.codeindex.service.IndexJobOrchestrator;
import com.ai.codeindex.service.JobSubmission;
import com.ai.codeindex.service.ProgressBroadcaster;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

/**
 * REST API for indexing jobs.
 *
 * POST /jobs                   - submit a repository for indexing
 * GET  /jobs                   - recent jobs, newest first, optionally by status
 * GET  /jobs/{id}              - job status and counters
 * POST /jobs/{id}/resume       - continue a paused, failed or interrupted job
 * POST /jobs/{id}/pause        - stop dispatching, keep progress
 * POST /jobs/{id}/cancel       - same as pause, recorded as cancelled
 * GET  /jobs/{id}/checkpoint   - processing order and watermark
 * GET  /jobs/{id}/outcomes     - every recorded file outcome, oldest first
 * GET  /jobs/{id}/events       - progress as server-sent events
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);
    private static final long EVENTS_TIMEOUT_MS = 30 * 60 * 1000L;

    private final IndexJobOrchestrator orchestrator;
    private final ProgressBroadcaster progress;

    public JobController(IndexJobOrchestrator orchestrator, ProgressBroadcaster progress) {
        this.orchestrator = orchestrator;
        this.progress = progress;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"repository_ref":"/srv/repos/commons-lang","chunk_size":25,"exclude_patterns":["**&#47;test/**"]}'
     */
    @PostMapping
    public ResponseEntity<JobSubmittedResponse> submit(@RequestBody @Valid SubmitJobRequest request) {
        log.info("[Jobs] Submit request for {} ({})", request.repositoryRef(),
                request.jobType() != null ? request.jobType() : "FULL");
        IndexJob job = orchestrator.submit(new JobSubmission(
                request.repositoryRef(),
                request.chunkSize(),
                request.jobType(),
                request.filePatterns(),
                request.excludePatterns(),
                Boolean.TRUE.equals(request.forceReindex())));
        return ResponseEntity.status(HttpStatus.CREATED).body(new JobSubmittedResponse(job.getId()));
    }

    @GetMapping
    public JobPageResponse list(@RequestParam(required = false) JobStatus status,
                                @RequestParam(defaultValue = "0") int page,
                                @RequestParam(defaultValue = "20") int size) {
        return JobPageResponse.from(orchestrator.listJobs(status, page, size));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(orchestrator.status(id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<JobResponse> resume(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(orchestrator.resume(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<JobResponse> pause(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(orchestrator.pause(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(orchestrator.cancel(id)));
    }

    @GetMapping("/{id}/checkpoint")
    public CheckpointResponse checkpoint(@PathVariable UUID id) {
        return CheckpointResponse.from(orchestrator.checkpoint(id));
    }

    @GetMapping("/{id}/outcomes")
    public List<FileOutcomeResponse> outcomes(@PathVariable UUID id) {
        return orchestrator.outcomes(id).stream()
                .map(FileOutcomeResponse::from)
                .toList();
    }

    @GetMapping(path = "/{id}/events", produces = "text/event-stream")
    public SseEmitter events(@PathVariable UUID id) {
        IndexJob job = orchestrator.status(id);
        SseEmitter emitter = new SseEmitter(EVENTS_TIMEOUT_MS);

        if (progress.latest(id).isEmpty()) {
            // nothing published by this process yet: start from the stored state
            send(emitter, new ProgressEvent(id, 0, job.getProcessedFiles(), job.getTotalFiles(),
                    job.getStatus(), job.getLastError()));
            if (job.getStatus().isTerminal()) {
                emitter.complete();
                return emitter;
            }
        }

        Runnable unsubscribe = progress.subscribe(id, event -> {
            send(emitter, event);
            if (event.status().isTerminal()) {
                emitter.complete();
            }
        });
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(e -> unsubscribe.run());
        return emitter;
    }

    private static void send(SseEmitter emitter, ProgressEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(Long.toString(event.sequence()))
                    .name("progress")
                    .data(event));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
