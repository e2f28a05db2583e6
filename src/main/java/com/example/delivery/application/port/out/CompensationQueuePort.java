package com.example.delivery.application.port.out;

import com.example.delivery.application.dto.CompensationTask;

import java.util.List;

/**
 * Outbound port for the durable per-order compensation task log.
 */
public interface CompensationQueuePort {

    /**
     * Persists tasks in the caller's transaction, preserving list order.
     */
    void enqueue(List<CompensationTask> tasks);
}
