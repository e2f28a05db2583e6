package com.example.delivery.application.service;

import com.example.delivery.application.port.out.CouponLedgerPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.port.out.ReferralGallonsPort;
import com.example.delivery.domain.exception.OrderNotFoundException;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ledger-side compensations. Each re-reads the order and clears the field it restores in
 * the same transaction, so a repeated run finds nothing left to do.
 */
@Component
public class OrderLedgerCompensations {

    private static final Logger log = LoggerFactory.getLogger(OrderLedgerCompensations.class);

    private final OrderStorePort orderStore;
    private final ReferralGallonsPort referralGallons;
    private final CouponLedgerPort couponLedger;

    public OrderLedgerCompensations(OrderStorePort orderStore,
                                    ReferralGallonsPort referralGallons,
                                    CouponLedgerPort couponLedger) {
        this.orderStore = orderStore;
        this.referralGallons = referralGallons;
        this.couponLedger = couponLedger;
    }

    @Transactional
    public void restoreReferralGallons(OrderId orderId) {
        Order order = load(orderId);
        if (!order.usedReferralGallons()) {
            log.debug("Referral gallons of order {} already restored", orderId);
            return;
        }
        referralGallons.credit(order.getUserId(), order.getReferralGallonsUsed());
        orderStore.clearReferralGallons(orderId);
        log.info("Restored {} referral gallons to {} for order {}",
                order.getReferralGallonsUsed(), order.getUserId(), orderId);
    }

    @Transactional
    public void releaseCoupon(OrderId orderId) {
        Order order = load(orderId);
        if (!order.hasCoupon()) {
            log.debug("Coupon of order {} already released", orderId);
            return;
        }
        couponLedger.markUnused(order.getCouponCode(), order.getVehicleId(), order.getUserId());
        orderStore.clearCouponCode(orderId);
        log.info("Released coupon {} for vehicle {} of order {}",
                order.getCouponCode(), order.getVehicleId(), orderId);
    }

    private Order load(OrderId orderId) {
        return orderStore.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
