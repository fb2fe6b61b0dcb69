package com.ai.codeindex.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(
        String query,
        List<SearchResult> results,
        Diagnostics diagnostics) {

    /**
     * How the fused list was produced.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Diagnostics(
            int lexicalCandidates,
            int vectorCandidates,
            int fusedCandidates,
            int droppedWithoutCitation,
            int rrfK,
            double lexicalWeight,
            double vectorWeight,
            boolean degraded,
            List<String> failedBranches,
            long tookMs) {
    }
}
