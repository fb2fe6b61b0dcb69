package com.ai.codeindex.credential;

import com.ai.codeindex.config.CredentialProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileCredentialSourceTest {

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private CredentialProperties properties;
    private Path file;

    @BeforeEach
    void setUp() {
        file = dir.resolve("credentials");
        properties = new CredentialProperties();
        properties.setProfilePath(file.toString());
        properties.setProfileName("work");
    }

    @Test
    void fetch_readsNamedProfile() throws IOException {
        Files.writeString(file, """
                default.token=other
                work.token=abc
                work.expires_at=2026-03-01T12:00:00Z
                """);

        CredentialResult result = new ProfileCredentialSource(properties, clock).fetch();

        Credential credential = ((CredentialResult.Success) result).credential();
        assertThat(credential.token()).isEqualTo("abc");
        assertThat(credential.expiresAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(credential.source()).isEqualTo(CredentialSourceType.PROFILE);
    }

    @Test
    void fetch_missingFileIsFailure() {
        CredentialResult result = new ProfileCredentialSource(properties, clock).fetch();

        assertThat(result).isInstanceOf(CredentialResult.Failure.class);
        assertThat(((CredentialResult.Failure) result).reason()).contains("not found");
    }

    @Test
    void fetch_missingProfileIsFailure() throws IOException {
        Files.writeString(file, "default.token=other\n");

        CredentialResult result = new ProfileCredentialSource(properties, clock).fetch();

        assertThat(((CredentialResult.Failure) result).reason()).contains("'work'");
    }

    @Test
    void fetch_invalidExpiryIsFailure() throws IOException {
        Files.writeString(file, "work.token=abc\nwork.expires_at=soon\n");

        CredentialResult result = new ProfileCredentialSource(properties, clock).fetch();

        assertThat(result).isInstanceOf(CredentialResult.Failure.class);
    }
}
