package com.ai.codeindex.service;

import java.util.UUID;

/**
 * Job-level context handed to the file processor with every path.
 */
public record FileTask(UUID jobId, String repositoryRef, String repoId, String commit, int attempt) {
}
