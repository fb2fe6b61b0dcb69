package com.ai.codeindex.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResult(
        String id,
        double score,
        ResultSource source,
        Citation citation,
        Integer lexicalRank,
        Integer vectorRank,
        String language,
        String snippet) {

    public enum ResultSource {
        LEXICAL,
        VECTOR,
        FUSED
    }
}
