package com.example.delivery.application.dto;

import com.example.delivery.domain.model.OrderId;

import java.util.Objects;

/**
 * Command for binding a courier to an order.
 *
 * @param noReassign when true, only an {@code unassigned} order is taken; otherwise the call is a silent no-op
 */
public record AssignOrderCommand(
        OrderId orderId,
        String courierId,
        boolean noReassign
) {
    public AssignOrderCommand {
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        Objects.requireNonNull(courierId, "CourierId cannot be null");
        if (courierId.isBlank()) {
            throw new IllegalArgumentException("CourierId cannot be blank");
        }
    }
}
