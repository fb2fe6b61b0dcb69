package com.ai.codeindex.credential;

import com.ai.codeindex.config.CredentialProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Reads a named profile from a properties file:
 * <pre>
 * default.token=...
 * default.expires_at=2026-01-01T00:00:00Z
 * </pre>
 */
@Component
public class ProfileCredentialSource implements CredentialSource {

    private final CredentialProperties properties;
    private final Clock clock;

    public ProfileCredentialSource(CredentialProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CredentialSourceType type() {
        return CredentialSourceType.PROFILE;
    }

    @Override
    public CredentialResult fetch() {
        Path file = Path.of(properties.getProfilePath());
        if (!Files.isRegularFile(file)) {
            return CredentialResult.failure(type(), "profile file not found: " + file);
        }

        Properties values = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            values.load(reader);
        } catch (IOException e) {
            return CredentialResult.failure(type(), "cannot read profile file: " + e.getMessage());
        }

        String profile = properties.getProfileName();
        String token = values.getProperty(profile + ".token");
        if (token == null || token.isBlank()) {
            return CredentialResult.failure(type(), "profile '" + profile + "' has no token");
        }

        Instant expiresAt = null;
        String rawExpiry = values.getProperty(profile + ".expires_at");
        if (rawExpiry != null && !rawExpiry.isBlank()) {
            try {
                expiresAt = Instant.parse(rawExpiry.trim());
            } catch (DateTimeParseException e) {
                return CredentialResult.failure(type(), "profile '" + profile + "' has an invalid expires_at");
            }
        }
        return CredentialResult.success(new Credential(token.trim(), clock.instant(), expiresAt, type()));
    }
}
