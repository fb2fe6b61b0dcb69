package com.ai.codeindex.dto;

import com.ai.codeindex.entity.JobType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request DTO for submitting an indexing job. Everything but {@code repositoryRef} is optional;
 * a missing or non-positive {@code chunkSize} falls back to the configured default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitJobRequest(
        @NotBlank(message = "repository_ref is required") String repositoryRef,
        Integer chunkSize,
        JobType jobType,
        List<String> filePatterns,
        List<String> excludePatterns,
        Boolean forceReindex) {
}
