package com.ai.codeindex.credential;

public enum CredentialSourceType {
    PROFILE,
    ENVIRONMENT,
    WORKLOAD_IDENTITY
}
