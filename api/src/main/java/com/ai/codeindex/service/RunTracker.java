package com.ai.codeindex.service;

import com.ai.codeindex.entity.Checkpoint;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.FileOutcomeStatus;
import com.ai.codeindex.entity.IndexJob;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Driver-side bookkeeping of a run: effective outcomes, the contiguous watermark and the
 * files still pending in this cycle. Only the driver thread touches it.
 */
final class RunTracker {

    private final List<String> order;
    private final Map<String, Integer> positions = new HashMap<>();
    private final boolean[] recorded;
    private final Map<String, FileOutcome> effective;
    private final Set<String> pending;
    private int watermark;
    private int processed;
    private int cycleRecorded;
    private int cycleFailures;

    RunTracker(Checkpoint checkpoint, Map<String, FileOutcome> effective, List<String> pending) {
        this.order = checkpoint.getProcessingOrder();
        this.recorded = new boolean[order.size()];
        this.effective = new HashMap<>(effective);
        this.pending = new LinkedHashSet<>(pending);
        for (int i = 0; i < order.size(); i++) {
            positions.put(order.get(i), i);
            recorded[i] = effective.containsKey(order.get(i));
        }
        this.watermark = checkpoint.getNextIndex();
        advanceWatermark();
        this.processed = order.size() - this.pending.size();
    }

    void record(FileOutcome outcome) {
        String path = outcome.getFilePath();
        effective.put(path, outcome);
        Integer position = positions.get(path);
        if (position != null) {
            recorded[position] = true;
        }
        if (pending.remove(path)) {
            processed++;
            cycleRecorded++;
            if (outcome.getStatus() == FileOutcomeStatus.ERROR) {
                cycleFailures++;
            }
        }
        advanceWatermark();
    }

    private void advanceWatermark() {
        while (watermark < recorded.length && recorded[watermark]) {
            watermark++;
        }
    }

    void applyCounts(IndexJob job) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (FileOutcome outcome : effective.values()) {
            switch (outcome.getStatus()) {
                case SUCCESS -> succeeded++;
                case ERROR -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        job.setSucceededFiles(succeeded);
        job.setFailedFiles(failed);
        job.setSkippedFiles(skipped);
    }

    int watermark() {
        return watermark;
    }

    int processed() {
        return processed;
    }

    int total() {
        return order.size();
    }

    boolean cycleComplete() {
        return pending.isEmpty();
    }

    int cycleRecorded() {
        return cycleRecorded;
    }

    int cycleFailures() {
        return cycleFailures;
    }
}
