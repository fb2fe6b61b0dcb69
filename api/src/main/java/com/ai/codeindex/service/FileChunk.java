package com.ai.codeindex.service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A contiguous slice of the processing order, handed to one worker.
 */
public record FileChunk(UUID jobId, int chunkIndex, List<String> filePaths) {

    public FileChunk {
        filePaths = List.copyOf(filePaths);
    }

    /**
     * Splits {@code paths} into consecutive chunks of at most {@code chunkSize}, preserving order.
     */
    public static List<FileChunk> partition(UUID jobId, List<String> paths, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        List<FileChunk> chunks = new ArrayList<>((paths.size() + chunkSize - 1) / chunkSize);
        for (int from = 0, index = 0; from < paths.size(); from += chunkSize, index++) {
            chunks.add(new FileChunk(jobId, index, paths.subList(from, Math.min(from + chunkSize, paths.size()))));
        }
        return chunks;
    }
}
