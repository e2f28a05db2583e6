package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable record of one compensation step of a cancelled order.
 */
@Entity
@Table(name = "compensation_tasks", indexes = {
    @Index(name = "idx_compensation_status", columnList = "status"),
    @Index(name = "idx_compensation_order", columnList = "order_id")
})
public class CompensationTaskEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "step", length = 32, nullable = false)
    private String step;

    @Column(name = "step_sequence", nullable = false)
    private int sequence;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private CompensationTaskStatus status = CompensationTaskStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getStep() {
        return step;
    }

    public void setStep(String step) {
        this.step = step;
    }

    public int getSequence() {
        return sequence;
    }

    public void setSequence(int sequence) {
        this.sequence = sequence;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public CompensationTaskStatus getStatus() {
        return status;
    }

    public void setStatus(CompensationTaskStatus status) {
        this.status = status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void markClaimed(Instant at) {
        this.status = CompensationTaskStatus.PROCESSING;
        this.claimedAt = at;
    }

    public void markDone(Instant at) {
        this.status = CompensationTaskStatus.DONE;
        this.processedAt = at;
        this.lastError = null;
    }

    public void markFailed(String error) {
        this.status = CompensationTaskStatus.FAILED;
        this.lastError = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.retryCount++;
    }
}
