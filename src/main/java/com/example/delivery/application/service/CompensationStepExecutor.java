package com.example.delivery.application.service;

import com.example.delivery.application.dto.CompensationTask;
import com.example.delivery.application.port.out.EventTrackerPort;
import com.example.delivery.application.port.out.NotifierPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.port.out.PaymentGatewayPort;
import com.example.delivery.application.port.out.PaymentGatewayPort.RefundResult;
import com.example.delivery.domain.exception.OrderNotFoundException;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Runs one compensation step to completion.
 * <p>
 * Blocks on the outbound call so the caller can record the outcome; any exception
 * means the step failed and may be retried.
 */
@Service
public class CompensationStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(CompensationStepExecutor.class);

    static final String CANCEL_ORDER_EVENT = "Cancel Order";

    private final OrderLedgerCompensations ledgerCompensations;
    private final CourierCapacityService courierCapacity;
    private final NotifierPort notifier;
    private final PaymentGatewayPort paymentGateway;
    private final OrderStorePort orderStore;
    private final EventTrackerPort eventTracker;
    private final String supportEmail;

    public CompensationStepExecutor(
            OrderLedgerCompensations ledgerCompensations,
            CourierCapacityService courierCapacity,
            NotifierPort notifier,
            PaymentGatewayPort paymentGateway,
            OrderStorePort orderStore,
            EventTrackerPort eventTracker,
            @Value("${delivery.support-email:info@purpleapp.com}") String supportEmail) {
        this.ledgerCompensations = ledgerCompensations;
        this.courierCapacity = courierCapacity;
        this.notifier = notifier;
        this.paymentGateway = paymentGateway;
        this.orderStore = orderStore;
        this.eventTracker = eventTracker;
        this.supportEmail = supportEmail;
    }

    public void execute(CompensationTask task) {
        log.debug("Executing {} for order {}", task.step(), task.orderId());
        switch (task.step()) {
            case RESTORE_REFERRAL_GALLONS -> ledgerCompensations.restoreReferralGallons(task.orderId());
            case RELEASE_COUPON -> ledgerCompensations.releaseCoupon(task.orderId());
            case RELEASE_COURIER -> releaseCourier(task);
            case NOTIFY_CUSTOMER -> notifier.push(
                    task.payloadString(CompensationTask.USER_ID),
                    NotificationMessages.orderCancelled(supportEmail)).join();
            case REFUND_CHARGE -> refund(task.orderId());
            case TRACK_CANCELLATION -> track(task);
        }
    }

    private void releaseCourier(CompensationTask task) {
        String courierId = task.payloadString(CompensationTask.COURIER_ID);
        courierCapacity.release(courierId, task.orderId());
        notifier.push(courierId, NotificationMessages.COURIER_ORDER_CANCELLED).join();
    }

    private void refund(OrderId orderId) {
        Order order = orderStore.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.hasCharge()) {
            return;
        }
        if (order.hasRefund()) {
            log.debug("Order {} already refunded as {}", orderId, order.getStripeRefundId());
            return;
        }
        RefundResult result = paymentGateway.refund(order.getStripeChargeId()).join();
        if (!result.success()) {
            throw new IllegalStateException("Refund of charge " + order.getStripeChargeId()
                    + " rejected: [" + result.errorCode() + "] " + result.errorMessage());
        }
        orderStore.recordRefund(orderId, result.refundId());
        log.info("Refunded charge {} of order {} as {}", order.getStripeChargeId(), orderId, result.refundId());
    }

    @SuppressWarnings("unchecked")
    private void track(CompensationTask task) {
        Object properties = task.payload().get(CompensationTask.PROPERTIES);
        eventTracker.track(
                task.payloadString(CompensationTask.USER_ID),
                CANCEL_ORDER_EVENT,
                properties instanceof Map ? (Map<String, Object>) properties : Map.of()).join();
    }
}
