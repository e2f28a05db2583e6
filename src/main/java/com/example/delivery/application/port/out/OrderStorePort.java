package com.example.delivery.application.port.out;

import com.example.delivery.domain.model.ChargeCapture;
import com.example.delivery.domain.model.Money;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Outbound port for durable order records.
 * <p>
 * Every write method is one durable update. Writes against an unknown id throw
 * {@link com.example.delivery.domain.exception.OrderNotFoundException}.
 */
public interface OrderStorePort {

    /**
     * Point read by id, including the status history.
     */
    Optional<Order> findById(OrderId orderId);

    /**
     * Overwrites the status and appends one history entry in the same transaction.
     *
     * @param orderId    the order
     * @param status     the new status
     * @param occurredAt timestamp recorded in the history entry
     */
    void updateStatus(OrderId orderId, OrderStatus status, Instant occurredAt);

    void assignCourier(OrderId orderId, String courierId);

    /**
     * Stamps the capture outcome onto the order; {@code paid} is taken from
     * {@link ChargeCapture#captured()}.
     */
    void recordCapture(OrderId orderId, ChargeCapture capture);

    void recordRefund(OrderId orderId, String refundId);

    void clearReferralGallons(OrderId orderId);

    void clearCouponCode(OrderId orderId);

    /**
     * Sum of {@code total_price} over the user's complete, unpaid orders with a positive total.
     */
    Money unpaidBalance(String userId);

    /**
     * Whether the courier is still bound to a non-terminal order other than {@code excluding}.
     */
    boolean hasActiveOrdersForCourier(String courierId, OrderId excluding);
}
