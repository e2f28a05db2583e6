package com.example.delivery.application.port.in;

import com.example.delivery.application.dto.AssignOrderCommand;
import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.domain.model.OrderId;

import java.util.Optional;

/**
 * Inbound port for courier assignment and courier-driven progress.
 */
public interface CourierOrderUseCase {

    /**
     * Binds a courier to an order.
     *
     * @param command the assignment command
     * @return the result, or empty when {@code noReassign} skipped an already-taken order
     */
    Optional<OrderActionResult> assign(AssignOrderCommand command);

    OrderActionResult accept(OrderId orderId);

    OrderActionResult beginRoute(OrderId orderId);

    OrderActionResult service(OrderId orderId);
}
