package com.example.delivery.application.service;

import com.example.delivery.application.dto.CancelOrderCommand;
import com.example.delivery.application.dto.CompensationScheduledEvent;
import com.example.delivery.application.dto.CompensationStep;
import com.example.delivery.application.dto.CompensationTask;
import com.example.delivery.application.dto.CustomerDetails;
import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.application.port.in.CancelOrderUseCase;
import com.example.delivery.application.port.in.OrderStatusUseCase;
import com.example.delivery.application.port.out.CompensationQueuePort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.port.out.UserDirectoryPort;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cancels orders.
 * <p>
 * The status change and the compensation plan are written in one transaction; the
 * side effects themselves run after commit from the durable task log, so the caller
 * gets its answer without waiting on the gateway or the notifier.
 */
@Service
public class OrderCancellationService implements CancelOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderCancellationService.class);

    static final String CANCELLED_BY_USER = "cancelled-by-user";

    private final OrderStorePort orderStore;
    private final OrderStatusUseCase orderStatus;
    private final CompensationQueuePort compensationQueue;
    private final UserDirectoryPort userDirectory;
    private final OrderTrackingProperties trackingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Set<OrderStatus> defaultCancellable;

    public OrderCancellationService(
            OrderStorePort orderStore,
            OrderStatusUseCase orderStatus,
            CompensationQueuePort compensationQueue,
            UserDirectoryPort userDirectory,
            OrderTrackingProperties trackingProperties,
            ApplicationEventPublisher eventPublisher,
            Clock clock,
            @Value("${delivery.cancellable-statuses:unassigned,assigned,accepted,enroute,servicing}")
            String[] cancellableStatuses) {
        this.orderStore = orderStore;
        this.orderStatus = orderStatus;
        this.compensationQueue = compensationQueue;
        this.userDirectory = userDirectory;
        this.trackingProperties = trackingProperties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.defaultCancellable = cancellableStatuses.length == 0
                ? OrderStatus.defaultCancellable()
                : Arrays.stream(cancellableStatuses)
                        .map(OrderStatus::fromWireName)
                        .collect(Collectors.toCollection(() -> EnumSet.noneOf(OrderStatus.class)));
    }

    @Override
    @Transactional
    public OrderActionResult cancel(CancelOrderCommand command) {
        Order order = orderStore.findById(command.orderId()).orElse(null);
        if (order == null) {
            log.warn("Cannot cancel order {}: not found", command.orderId());
            return OrderActionResult.notFound();
        }
        if (!order.isCancellableFrom(command.cancellableStatuses(defaultCancellable))) {
            log.info("Order {} not cancellable from status {}", order.getOrderId(), order.getStatus().wireName());
            return OrderActionResult.tooLateToCancel();
        }

        orderStatus.setStatus(order.getOrderId(), OrderStatus.CANCELLED);
        List<CompensationTask> plan = planCompensation(order, command);
        compensationQueue.enqueue(plan);
        eventPublisher.publishEvent(new CompensationScheduledEvent(order.getOrderId(), plan.size()));
        log.info("Order {} cancelled by {}, {} compensation steps queued",
                order.getOrderId(), command.originWasDashboard() ? "dashboard" : "customer", plan.size());

        if (command.suppressUserDetails()) {
            return OrderActionResult.succeeded();
        }
        return userDirectory.findById(command.userId())
                .map(CustomerDetails::from)
                .map(OrderActionResult::succeeded)
                .orElseGet(OrderActionResult::succeeded);
    }

    /**
     * Builds the ordered compensation steps for an order as it was before cancellation.
     */
    List<CompensationTask> planCompensation(Order order, CancelOrderCommand command) {
        Instant createdAt = clock.instant();
        List<CompensationTask> tasks = new ArrayList<>();

        if (order.usedReferralGallons()) {
            tasks.add(task(order, CompensationStep.RESTORE_REFERRAL_GALLONS, tasks.size(), Map.of(), createdAt));
        }
        if (order.hasCoupon()) {
            tasks.add(task(order, CompensationStep.RELEASE_COUPON, tasks.size(), Map.of(), createdAt));
        }
        if (order.hasCourier()) {
            tasks.add(task(order, CompensationStep.RELEASE_COURIER, tasks.size(),
                    Map.of(CompensationTask.COURIER_ID, order.getCourierId()), createdAt));
        }
        if (command.notifyCustomer()) {
            tasks.add(task(order, CompensationStep.NOTIFY_CUSTOMER, tasks.size(),
                    Map.of(CompensationTask.USER_ID, command.userId()), createdAt));
        }
        if (order.hasCharge()) {
            tasks.add(task(order, CompensationStep.REFUND_CHARGE, tasks.size(), Map.of(), createdAt));
        }

        Map<String, Object> properties = trackingProperties.standard(order);
        properties.put(CANCELLED_BY_USER, !command.originWasDashboard());
        Map<String, Object> trackPayload = new LinkedHashMap<>();
        trackPayload.put(CompensationTask.USER_ID, order.getUserId());
        trackPayload.put(CompensationTask.PROPERTIES, properties);
        tasks.add(task(order, CompensationStep.TRACK_CANCELLATION, tasks.size(), trackPayload, createdAt));

        return tasks;
    }

    private static CompensationTask task(Order order, CompensationStep step, int sequence,
                                         Map<String, Object> payload, Instant createdAt) {
        return new CompensationTask(UUID.randomUUID().toString(), order.getOrderId(), step, sequence, payload, createdAt);
    }
}
