package com.ai.codeindex.index;

import java.util.UUID;

/**
 * One indexed semantic unit. {@code id} is derived from content hash and path, so writing
 * the same unit twice overwrites instead of duplicating.
 */
public record IndexRecord(
        String id,
        UUID jobId,
        String repoId,
        String commit,
        String path,
        int startLine,
        int endLine,
        String language,
        String kind,
        String contentHash,
        String content) {
}
