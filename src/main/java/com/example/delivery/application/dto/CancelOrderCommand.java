package com.example.delivery.application.dto;

import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;

import java.util.Objects;
import java.util.Set;

/**
 * Command for cancelling an order.
 *
 * @param userId                      the user requesting cancellation; receives the notice and details
 * @param orderId                     the order to cancel
 * @param originWasDashboard          true when an operator cancelled from the dashboard
 * @param notifyCustomer              push a cancellation notice to {@code userId}
 * @param suppressUserDetails         return a bare success instead of the customer's profile
 * @param overrideCancellableStatuses replaces the configured cancellable set when not null
 */
public record CancelOrderCommand(
        String userId,
        OrderId orderId,
        boolean originWasDashboard,
        boolean notifyCustomer,
        boolean suppressUserDetails,
        Set<OrderStatus> overrideCancellableStatuses
) {
    public CancelOrderCommand {
        Objects.requireNonNull(userId, "UserId cannot be null");
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        if (overrideCancellableStatuses != null) {
            overrideCancellableStatuses = Set.copyOf(overrideCancellableStatuses);
        }
    }

    /**
     * A customer cancelling their own order from the app.
     */
    public static CancelOrderCommand byCustomer(String userId, OrderId orderId) {
        return new CancelOrderCommand(userId, orderId, false, false, false, null);
    }

    /**
     * An operator cancelling on the customer's behalf; the customer is notified.
     */
    public static CancelOrderCommand byDashboard(String userId, OrderId orderId) {
        return new CancelOrderCommand(userId, orderId, true, true, true, null);
    }

    public Set<OrderStatus> cancellableStatuses(Set<OrderStatus> defaults) {
        return overrideCancellableStatuses != null ? overrideCancellableStatuses : defaults;
    }
}
