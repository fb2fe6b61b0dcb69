package com.ai.codeindex.dto;

import com.ai.codeindex.service.JobPage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobPageResponse(List<JobResponse> jobs, int page, int size, long totalCount) {

    public static JobPageResponse from(JobPage page) {
        return new JobPageResponse(
                page.jobs().stream().map(JobResponse::from).toList(),
                page.page(),
                page.size(),
                page.totalCount());
    }
}
