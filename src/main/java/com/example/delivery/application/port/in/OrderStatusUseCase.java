package com.example.delivery.application.port.in;

import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;

import java.util.Optional;

/**
 * Inbound port for raw status changes.
 */
public interface OrderStatusUseCase {

    /**
     * Overwrites the order's status and appends a history entry. Legality of the edge is
     * the caller's responsibility.
     *
     * @param orderId the order
     * @param status  the new status
     */
    void setStatus(OrderId orderId, OrderStatus status);

    /**
     * Looks up the forward successor of a status.
     *
     * @param status the current status
     * @return the successor, or empty for terminal statuses
     */
    Optional<OrderStatus> nextStatus(OrderStatus status);
}
