package com.ai.codeindex.credential;

/**
 * One place a credential can come from. Implementations report problems as
 * {@link CredentialResult.Failure} instead of throwing.
 */
public interface CredentialSource {

    CredentialSourceType type();

    CredentialResult fetch();
}
