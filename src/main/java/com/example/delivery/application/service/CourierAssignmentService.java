package com.example.delivery.application.service;

import com.example.delivery.application.dto.AssignOrderCommand;
import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.application.port.in.CourierOrderUseCase;
import com.example.delivery.application.port.in.OrderStatusUseCase;
import com.example.delivery.application.port.out.NotifierPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Courier assignment and the courier-driven status steps.
 */
@Service
public class CourierAssignmentService implements CourierOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(CourierAssignmentService.class);

    private final OrderStorePort orderStore;
    private final OrderStatusUseCase orderStatus;
    private final CourierCapacityService courierCapacity;
    private final NotifierPort notifier;
    private final CourierOrderSummaryFormatter summaryFormatter;

    public CourierAssignmentService(OrderStorePort orderStore,
                                    OrderStatusUseCase orderStatus,
                                    CourierCapacityService courierCapacity,
                                    NotifierPort notifier,
                                    CourierOrderSummaryFormatter summaryFormatter) {
        this.orderStore = orderStore;
        this.orderStatus = orderStatus;
        this.courierCapacity = courierCapacity;
        this.notifier = notifier;
        this.summaryFormatter = summaryFormatter;
    }

    @Override
    public Optional<OrderActionResult> assign(AssignOrderCommand command) {
        OrderId orderId = command.orderId();
        Order order = orderStore.findById(orderId).orElse(null);
        if (order == null) {
            log.warn("Cannot assign order {}: not found", orderId);
            return Optional.of(OrderActionResult.notFound());
        }
        if (command.noReassign() && order.getStatus() != OrderStatus.UNASSIGNED) {
            log.info("Order {} already {}, not reassigning to {}",
                    orderId, order.getStatus().wireName(), command.courierId());
            return Optional.empty();
        }

        orderStatus.setStatus(orderId, OrderStatus.ASSIGNED);
        orderStore.assignCourier(orderId, command.courierId());
        courierCapacity.acquire(command.courierId(), orderId);
        String previousCourier = order.getCourierId();
        if (previousCourier != null && !previousCourier.isBlank() && !previousCourier.equals(command.courierId())) {
            courierCapacity.release(previousCourier, orderId);
            log.info("Order {} taken from courier {}", orderId, previousCourier);
        }
        log.info("Order {} assigned to courier {}", orderId, command.courierId());

        notifyQuietly(notifier.push(command.courierId(), NotificationMessages.COURIER_ASSIGNED),
                "push assignment", command.courierId(), orderId);
        notifyQuietly(notifier.sms(command.courierId(), summaryFormatter.format(order, true)),
                "text order summary", command.courierId(), orderId);
        return Optional.of(OrderActionResult.succeeded());
    }

    @Override
    public OrderActionResult accept(OrderId orderId) {
        if (orderStore.findById(orderId).isEmpty()) {
            return OrderActionResult.notFound();
        }
        orderStatus.setStatus(orderId, OrderStatus.ACCEPTED);
        return OrderActionResult.succeeded();
    }

    @Override
    public OrderActionResult beginRoute(OrderId orderId) {
        return advanceAndNotifyCustomer(orderId, OrderStatus.ENROUTE, NotificationMessages.CUSTOMER_COURIER_ENROUTE);
    }

    @Override
    public OrderActionResult service(OrderId orderId) {
        return advanceAndNotifyCustomer(orderId, OrderStatus.SERVICING, NotificationMessages.CUSTOMER_SERVICING);
    }

    private OrderActionResult advanceAndNotifyCustomer(OrderId orderId, OrderStatus status, String message) {
        Order order = orderStore.findById(orderId).orElse(null);
        if (order == null) {
            log.warn("Cannot move order {} to {}: not found", orderId, status.wireName());
            return OrderActionResult.notFound();
        }
        orderStatus.setStatus(orderId, status);
        notifyQuietly(notifier.push(order.getUserId(), message), "push " + status.wireName(), order.getUserId(), orderId);
        return OrderActionResult.succeeded();
    }

    private void notifyQuietly(CompletableFuture<Void> delivery, String what, String recipient, OrderId orderId) {
        delivery.exceptionally(throwable -> {
            log.warn("Failed to {} to {} for order {}: {}", what, recipient, orderId, throwable.getMessage());
            return null;
        });
    }
}
