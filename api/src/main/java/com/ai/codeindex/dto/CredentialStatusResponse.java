package com.ai.codeindex.dto;

import com.ai.codeindex.credential.CredentialStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Supervisor state for operators. Never carries the token itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CredentialStatusResponse(
        String state,
        String source,
        Instant expiresAt,
        int consecutiveFailures,
        Instant breakerOpenUntil,
        long refreshCount,
        String lastFailure) {

    public static CredentialStatusResponse from(CredentialStatus status) {
        return new CredentialStatusResponse(
                status.state().name(),
                status.source() != null ? status.source().name() : null,
                status.expiresAt(),
                status.consecutiveFailures(),
                status.breakerOpenUntil(),
                status.refreshCount(),
                status.lastFailure());
    }
}
