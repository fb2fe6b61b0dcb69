package com.ai.codeindex.credential;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token for the upstream embedding endpoint. A null {@code expiresAt} means the
 * token does not expire.
 */
public record Credential(String token, Instant issuedAt, Instant expiresAt, CredentialSourceType source) {

    public Credential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(source, "source");
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean expiresWithin(Duration window, Instant now) {
        return expiresAt != null && !now.plus(window).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", expiresAt=" + expiresAt + ", token=****]";
    }
}
