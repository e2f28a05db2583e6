package com.example.delivery.application.dto;

import com.example.delivery.domain.model.OrderId;

/**
 * Published inside the cancellation transaction once compensation tasks are queued.
 */
public record CompensationScheduledEvent(OrderId orderId, int taskCount) {
}
