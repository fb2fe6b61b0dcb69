package com.ai.codeindex.credential;

public enum SupervisorState {
    /** Credential present and outside the refresh window. */
    VALID,
    /** No credential yet, or inside the refresh window; the next caller refreshes. */
    NEAR_EXPIRY,
    REFRESHING,
    /** Breaker open or probing after cooldown. */
    DEGRADED
}
