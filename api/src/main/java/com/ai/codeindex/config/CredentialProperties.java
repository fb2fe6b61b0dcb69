package com.ai.codeindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "credential")
public class CredentialProperties {
    private Duration refreshThreshold = Duration.ofMinutes(30);
    private Duration acquireTimeout = Duration.ofSeconds(10);
    private int failureThreshold = 3;
    private Duration cooldown = Duration.ofSeconds(60);
    private String profilePath = System.getProperty("user.home") + "/.code-index/credentials";
    private String profileName = "default";
    private String tokenEnv = "CODE_INDEX_API_TOKEN";
    private String expiresAtEnv = "CODE_INDEX_API_TOKEN_EXPIRES_AT";
    private String workloadRegistrationId = "code-index-upstream";

    public Duration getRefreshThreshold() { return refreshThreshold; }
    public void setRefreshThreshold(Duration v) { this.refreshThreshold = v; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public void setAcquireTimeout(Duration v) { this.acquireTimeout = v; }
    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int v) { this.failureThreshold = v; }
    public Duration getCooldown() { return cooldown; }
    public void setCooldown(Duration v) { this.cooldown = v; }
    public String getProfilePath() { return profilePath; }
    public void setProfilePath(String v) { this.profilePath = v; }
    public String getProfileName() { return profileName; }
    public void setProfileName(String v) { this.profileName = v; }
    public String getTokenEnv() { return tokenEnv; }
    public void setTokenEnv(String v) { this.tokenEnv = v; }
    public String getExpiresAtEnv() { return expiresAtEnv; }
    public void setExpiresAtEnv(String v) { this.expiresAtEnv = v; }
    public String getWorkloadRegistrationId() { return workloadRegistrationId; }
    public void setWorkloadRegistrationId(String v) { this.workloadRegistrationId = v; }
}
