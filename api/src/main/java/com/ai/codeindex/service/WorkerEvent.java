package com.ai.codeindex.service;

import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.StopReason;

/**
 * Messages from workers to the run driver, the only writer of job state.
 */
sealed interface WorkerEvent permits WorkerEvent.FileDone, WorkerEvent.Halted, WorkerEvent.ChunkDone {

    record FileDone(FileOutcome outcome) implements WorkerEvent {
    }

    /**
     * A worker stopped its chunk at {@code path} without recording an outcome for it.
     */
    record Halted(String path, StopReason reason, String detail) implements WorkerEvent {
    }

    record ChunkDone(int chunkIndex) implements WorkerEvent {
    }
}
