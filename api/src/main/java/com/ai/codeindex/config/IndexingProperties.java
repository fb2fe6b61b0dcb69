package com.ai.codeindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "indexing")
public class IndexingProperties {
    private int defaultChunkSize = 25;
    private int maxChunkSize = 500;
    private int workerThreads = 4;
    private int queueCapacity = 8;
    private Duration parseTimeout = Duration.ofSeconds(30);
    private long maxFileBytes = 1_048_576;
    private int blockChars = 1500;
    private int blockOverlapLines = 2;
    // 0 disables the guard
    private double maxFailureRatio = 0.0;
    private int failureRatioMinFiles = 10;
    // how long progress of a job that is no longer running stays in memory
    private Duration progressRetention = Duration.ofMinutes(30);

    public int getDefaultChunkSize() { return defaultChunkSize; }
    public void setDefaultChunkSize(int v) { this.defaultChunkSize = v; }
    public int getMaxChunkSize() { return maxChunkSize; }
    public void setMaxChunkSize(int v) { this.maxChunkSize = v; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int v) { this.workerThreads = v; }
    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int v) { this.queueCapacity = v; }
    public Duration getParseTimeout() { return parseTimeout; }
    public void setParseTimeout(Duration v) { this.parseTimeout = v; }
    public long getMaxFileBytes() { return maxFileBytes; }
    public void setMaxFileBytes(long v) { this.maxFileBytes = v; }
    public int getBlockChars() { return blockChars; }
    public void setBlockChars(int v) { this.blockChars = v; }
    public int getBlockOverlapLines() { return blockOverlapLines; }
    public void setBlockOverlapLines(int v) { this.blockOverlapLines = v; }
    public double getMaxFailureRatio() { return maxFailureRatio; }
    public void setMaxFailureRatio(double v) { this.maxFailureRatio = v; }
    public int getFailureRatioMinFiles() { return failureRatioMinFiles; }
    public void setFailureRatioMinFiles(int v) { this.failureRatioMinFiles = v; }
    public Duration getProgressRetention() { return progressRetention; }
    public void setProgressRetention(Duration v) { this.progressRetention = v; }

    /**
     * Clamps a requested chunk size into [1, maxChunkSize], falling back to the default.
     */
    public int normalizeChunkSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return Math.max(1, Math.min(defaultChunkSize, maxChunkSize));
        }
        return Math.min(requested, maxChunkSize);
    }
}
