package com.ai.codeindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingProperties {
    private String baseUrl = "http://localhost:11434";
    private String model = "nomic-embed-text";
    private int batchSize = 16;
    private Duration callTimeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration retryBackoff = Duration.ofMillis(500);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String v) { this.baseUrl = v; }
    public String getModel() { return model; }
    public void setModel(String v) { this.model = v; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int v) { this.batchSize = v; }
    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration v) { this.callTimeout = v; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int v) { this.maxRetries = v; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration v) { this.retryBackoff = v; }
}
