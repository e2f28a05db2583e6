package com.example.delivery.application.service;

import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.application.port.in.CompleteOrderUseCase;
import com.example.delivery.application.port.in.OrderStatusUseCase;
import com.example.delivery.application.port.out.EventTrackerPort;
import com.example.delivery.application.port.out.NotifierPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.port.out.PaymentGatewayPort;
import com.example.delivery.application.port.out.PaymentGatewayPort.CaptureResult;
import com.example.delivery.application.port.out.ReferralGallonsPort;
import com.example.delivery.application.port.out.UserDirectoryPort;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Completes a delivered order: marks it complete, frees the courier, captures the
 * authorized charge and runs the post-payment fan-out.
 * <p>
 * A capture failure leaves the order complete and unpaid. It is never retried here;
 * the unpaid balance surfaces on the customer's next assignment.
 */
@Service
public class OrderCompletionService implements CompleteOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderCompletionService.class);

    static final String COMPLETE_ORDER_EVENT = "Complete Order";

    private final OrderStorePort orderStore;
    private final OrderStatusUseCase orderStatus;
    private final CourierCapacityService courierCapacity;
    private final PaymentGatewayPort paymentGateway;
    private final UserDirectoryPort userDirectory;
    private final ReferralGallonsPort referralGallons;
    private final EventTrackerPort eventTracker;
    private final NotifierPort notifier;
    private final OrderTrackingProperties trackingProperties;
    private final BigDecimal referrerBonusGallons;
    private final Executor completionExecutor;

    public OrderCompletionService(
            OrderStorePort orderStore,
            OrderStatusUseCase orderStatus,
            CourierCapacityService courierCapacity,
            PaymentGatewayPort paymentGateway,
            UserDirectoryPort userDirectory,
            ReferralGallonsPort referralGallons,
            EventTrackerPort eventTracker,
            NotifierPort notifier,
            OrderTrackingProperties trackingProperties,
            @Value("${delivery.referral.referrer-bonus-gallons:5}") BigDecimal referrerBonusGallons,
            @Qualifier("completionExecutor") Executor completionExecutor) {
        this.orderStore = orderStore;
        this.orderStatus = orderStatus;
        this.courierCapacity = courierCapacity;
        this.paymentGateway = paymentGateway;
        this.userDirectory = userDirectory;
        this.referralGallons = referralGallons;
        this.eventTracker = eventTracker;
        this.notifier = notifier;
        this.trackingProperties = trackingProperties;
        this.referrerBonusGallons = referrerBonusGallons;
        this.completionExecutor = completionExecutor;
    }

    @Override
    public CompletableFuture<OrderActionResult> complete(OrderId orderId) {
        Order order = orderStore.findById(orderId).orElse(null);
        if (order == null) {
            log.warn("Cannot complete order {}: not found", orderId);
            return CompletableFuture.completedFuture(OrderActionResult.notFound());
        }

        orderStatus.setStatus(orderId, OrderStatus.COMPLETE);
        if (order.hasCourier()) {
            courierCapacity.release(order.getCourierId(), orderId);
        }

        if (!order.requiresCapture()) {
            log.info("Order {} completed without capture (total={}, charge={})",
                    orderId, order.getTotalPrice(), order.getStripeChargeId());
            afterPayment(order);
            return CompletableFuture.completedFuture(OrderActionResult.succeeded());
        }

        log.info("Capturing charge {} for order {}", order.getStripeChargeId(), orderId);
        return paymentGateway.capture(order.getStripeChargeId())
                .exceptionally(throwable -> {
                    Throwable cause = unwrap(throwable);
                    log.error("Capture for order {} did not reach the gateway: {}", orderId, cause.getMessage());
                    return CaptureResult.failure("SERVICE_UNAVAILABLE", cause.getMessage());
                })
                .thenApplyAsync(result -> {
                    if (!result.success()) {
                        log.warn("Capture failed for order {}: [{}] {}",
                                orderId, result.errorCode(), result.errorMessage());
                        return OrderActionResult.gatewayFailure(result.errorCode(), result.errorMessage());
                    }
                    orderStore.recordCapture(orderId, result.charge());
                    log.info("Order {} captured, charge={}, paid={}",
                            orderId, result.charge().chargeId(), result.charge().captured());
                    afterPayment(order);
                    return OrderActionResult.succeeded();
                }, completionExecutor);
    }

    /**
     * Post-payment fan-out. Every step is best effort and independent of the others.
     */
    private void afterPayment(Order order) {
        creditReferrer(order);

        eventTracker.track(order.getUserId(), COMPLETE_ORDER_EVENT, trackingProperties.withRevenue(order))
                .exceptionally(throwable -> {
                    log.warn("Failed to track completion of order {}: {}",
                            order.getOrderId(), unwrap(throwable).getMessage());
                    return null;
                });

        UserDirectoryPort.UserAccount customer = userDirectory.findById(order.getUserId()).orElse(null);
        notifier.push(order.getUserId(), NotificationMessages.orderCompleted(customer))
                .exceptionally(throwable -> {
                    log.warn("Failed to notify {} of completed order {}: {}",
                            order.getUserId(), order.getOrderId(), unwrap(throwable).getMessage());
                    return null;
                });
    }

    private void creditReferrer(Order order) {
        if (!order.hasCoupon()) {
            return;
        }
        try {
            userDirectory.findUserIdByReferralCode(order.getCouponCode())
                    .filter(referrerId -> !referrerId.equals(order.getUserId()))
                    .ifPresent(referrerId -> {
                        referralGallons.credit(referrerId, referrerBonusGallons);
                        log.info("Credited referrer {} with {} gallons for order {}",
                                referrerId, referrerBonusGallons, order.getOrderId());
                    });
        } catch (RuntimeException e) {
            log.warn("Failed to apply referral bonus for order {}: {}", order.getOrderId(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
    }
}
