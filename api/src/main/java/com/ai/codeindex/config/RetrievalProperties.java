package com.ai.codeindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {
    private int rrfK = 60;
    private double lexicalWeight = 1.2;
    private double vectorWeight = 1.0;
    private int candidateMultiplier = 5;
    private int defaultTopN = 10;
    private int maxTopN = 100;
    private Duration queryTimeout = Duration.ofSeconds(5);
    private int threads = 4;

    public int getRrfK() { return rrfK; }
    public void setRrfK(int v) { this.rrfK = v; }
    public double getLexicalWeight() { return lexicalWeight; }
    public void setLexicalWeight(double v) { this.lexicalWeight = v; }
    public double getVectorWeight() { return vectorWeight; }
    public void setVectorWeight(double v) { this.vectorWeight = v; }
    public int getCandidateMultiplier() { return candidateMultiplier; }
    public void setCandidateMultiplier(int v) { this.candidateMultiplier = v; }
    public int getDefaultTopN() { return defaultTopN; }
    public void setDefaultTopN(int v) { this.defaultTopN = v; }
    public int getMaxTopN() { return maxTopN; }
    public void setMaxTopN(int v) { this.maxTopN = v; }
    public Duration getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(Duration v) { this.queryTimeout = v; }
    public int getThreads() { return threads; }
    public void setThreads(int v) { this.threads = v; }
}
