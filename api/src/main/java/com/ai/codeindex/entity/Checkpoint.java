package com.ai.codeindex.entity;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Durable resume point of a job: the frozen processing order and the index below which
 * every file has a recorded outcome.
 */
@Entity
@Table(name = "checkpoints")
public class Checkpoint {

    public static final int LAYOUT_VERSION = 1;

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "layout_version", nullable = false)
    private int layoutVersion = LAYOUT_VERSION;

    @Convert(converter = StringListConverter.class)
    @Column(name = "processing_order", nullable = false, columnDefinition = "TEXT")
    private List<String> processingOrder = new ArrayList<>();

    @Column(name = "next_index", nullable = false)
    private int nextIndex;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected Checkpoint() {
    }

    public Checkpoint(UUID jobId, List<String> processingOrder) {
        this.jobId = jobId;
        this.processingOrder = List.copyOf(processingOrder);
        this.nextIndex = 0;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = OffsetDateTime.now();
    }

    /**
     * Moves the watermark forward. Returns false when {@code index} would not advance it.
     */
    public boolean advanceTo(int index) {
        int bounded = Math.min(index, processingOrder.size());
        if (bounded <= nextIndex) {
            return false;
        }
        nextIndex = bounded;
        return true;
    }

    public UUID getJobId() {
        return jobId;
    }

    public int getLayoutVersion() {
        return layoutVersion;
    }

    public List<String> getProcessingOrder() {
        return processingOrder;
    }

    public int getNextIndex() {
        return nextIndex;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
