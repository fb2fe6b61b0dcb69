package com.ai.codeindex.credential;

import java.time.Instant;

public record CredentialStatus(
        SupervisorState state,
        CredentialSourceType source,
        Instant expiresAt,
        int consecutiveFailures,
        Instant breakerOpenUntil,
        long refreshCount,
        String lastFailure) {
}
