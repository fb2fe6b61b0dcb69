package com.ai.codeindex.credential;

/**
 * Result of asking one source for a credential.
 */
public sealed interface CredentialResult permits CredentialResult.Success, CredentialResult.Failure {

    record Success(Credential credential) implements CredentialResult {
    }

    record Failure(CredentialSourceType source, String reason) implements CredentialResult {
    }

    static CredentialResult success(Credential credential) {
        return new Success(credential);
    }

    static CredentialResult failure(CredentialSourceType source, String reason) {
        return new Failure(source, reason);
    }
}
