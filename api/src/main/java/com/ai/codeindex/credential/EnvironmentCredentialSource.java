package com.ai.codeindex.credential;

import com.ai.codeindex.config.CredentialProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

/**
 * Reads a token (and optionally its ISO-8601 expiry) from environment variables.
 */
@Component
public class EnvironmentCredentialSource implements CredentialSource {

    private final Function<String, String> environment;
    private final CredentialProperties properties;
    private final Clock clock;

    @Autowired
    public EnvironmentCredentialSource(CredentialProperties properties, Clock clock) {
        this(System::getenv, properties, clock);
    }

    EnvironmentCredentialSource(Function<String, String> environment, CredentialProperties properties, Clock clock) {
        this.environment = environment;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CredentialSourceType type() {
        return CredentialSourceType.ENVIRONMENT;
    }

    @Override
    public CredentialResult fetch() {
        String token = environment.apply(properties.getTokenEnv());
        if (token == null || token.isBlank()) {
            return CredentialResult.failure(type(), properties.getTokenEnv() + " is not set");
        }
        String rawExpiry = environment.apply(properties.getExpiresAtEnv());
        Instant expiresAt = null;
        if (rawExpiry != null && !rawExpiry.isBlank()) {
            try {
                expiresAt = Instant.parse(rawExpiry.trim());
            } catch (DateTimeParseException e) {
                return CredentialResult.failure(type(), properties.getExpiresAtEnv() + " is not an ISO-8601 instant");
            }
        }
        return CredentialResult.success(new Credential(token.trim(), clock.instant(), expiresAt, type()));
    }
}
