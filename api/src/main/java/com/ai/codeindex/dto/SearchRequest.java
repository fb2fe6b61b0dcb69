package com.ai.codeindex.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for hybrid search. {@code filters} and {@code topN} are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchRequest(
        @NotBlank(message = "query must not be blank") String query,
        Filters filters,
        @Positive(message = "top_n must be positive") Integer topN) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Filters(String repoId, String commit) {
    }
}
