package com.ai.codeindex.service;

import com.ai.codeindex.entity.JobType;

import java.util.List;

/**
 * Everything a caller can ask for when submitting a job. {@code chunkSize} may be null.
 */
public record JobSubmission(
        String repositoryRef,
        Integer chunkSize,
        JobType jobType,
        List<String> filePatterns,
        List<String> excludePatterns,
        boolean forceReindex) {

    public JobSubmission {
        jobType = jobType != null ? jobType : JobType.FULL;
        filePatterns = filePatterns != null ? List.copyOf(filePatterns) : List.of();
        excludePatterns = excludePatterns != null ? List.copyOf(excludePatterns) : List.of();
    }

    public static JobSubmission full(String repositoryRef, Integer chunkSize) {
        return new JobSubmission(repositoryRef, chunkSize, JobType.FULL, null, null, false);
    }
}
