package com.example.delivery.application.service;

import com.example.delivery.application.port.in.OrderStatusUseCase;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Applies status changes. Does not check that the edge is legal; the workflows only
 * call it on legal edges.
 */
@Service
public class OrderStatusService implements OrderStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderStatusService.class);

    private final OrderStorePort orderStore;
    private final Clock clock;

    public OrderStatusService(OrderStorePort orderStore, Clock clock) {
        this.orderStore = orderStore;
        this.clock = clock;
    }

    @Override
    public void setStatus(OrderId orderId, OrderStatus status) {
        orderStore.updateStatus(orderId, status, clock.instant());
        log.info("Order {} moved to {}", orderId, status.wireName());
    }

    @Override
    public Optional<OrderStatus> nextStatus(OrderStatus status) {
        return status.next();
    }
}
