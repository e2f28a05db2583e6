package com.example.delivery.application.service;

import com.example.delivery.application.port.out.CourierCapacityPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.model.OrderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sole owner of the courier busy flag.
 * <p>
 * A courier is busy iff it is bound to at least one non-terminal order. Assignment
 * acquires capacity; completion and cancellation release it, and release recomputes
 * the flag from the order store instead of blindly clearing it.
 */
@Service
public class CourierCapacityService {

    private static final Logger log = LoggerFactory.getLogger(CourierCapacityService.class);

    private final CourierCapacityPort capacityPort;
    private final OrderStorePort orderStore;

    public CourierCapacityService(CourierCapacityPort capacityPort, OrderStorePort orderStore) {
        this.capacityPort = capacityPort;
        this.orderStore = orderStore;
    }

    /**
     * Marks the courier busy for the given order.
     */
    public void acquire(String courierId, OrderId orderId) {
        capacityPort.setBusy(courierId, true);
        log.debug("Courier {} acquired for order {}", courierId, orderId);
    }

    /**
     * Releases the courier from the given order.
     *
     * @return the courier's busy flag after release
     */
    public boolean release(String courierId, OrderId orderId) {
        boolean stillBusy = orderStore.hasActiveOrdersForCourier(courierId, orderId);
        capacityPort.setBusy(courierId, stillBusy);
        log.debug("Courier {} released from order {}, busy={}", courierId, orderId, stillBusy);
        return stillBusy;
    }
}
