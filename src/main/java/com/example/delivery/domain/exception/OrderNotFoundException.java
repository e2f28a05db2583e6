package com.example.delivery.domain.exception;

import com.example.delivery.domain.model.OrderId;

/**
 * Thrown when a write targets an order id that the store does not hold.
 */
public class OrderNotFoundException extends DomainException {

    private final OrderId orderId;

    public OrderNotFoundException(OrderId orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
