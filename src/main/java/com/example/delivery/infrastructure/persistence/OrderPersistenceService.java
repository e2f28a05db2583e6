package com.example.delivery.infrastructure.persistence;

import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.exception.OrderNotFoundException;
import com.example.delivery.domain.model.ChargeCapture;
import com.example.delivery.domain.model.Money;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEventEntity;
import com.example.delivery.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.delivery.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.delivery.infrastructure.persistence.repository.OrderStatusEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * JPA-backed order store. Every write is its own transaction unless the caller already has one.
 */
@Service
public class OrderPersistenceService implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);

    private final OrderJpaRepository orderRepository;
    private final OrderStatusEventRepository statusEventRepository;
    private final OrderPersistenceMapper mapper;
    private final Set<OrderStatusEnum> activeStatuses;

    public OrderPersistenceService(
            OrderJpaRepository orderRepository,
            OrderStatusEventRepository statusEventRepository,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.statusEventRepository = statusEventRepository;
        this.mapper = mapper;
        this.activeStatuses = Arrays.stream(OrderStatus.values())
                .filter(status -> !status.isTerminal())
                .map(mapper::toStatusEnum)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(OrderStatusEnum.class)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(OrderId orderId) {
        return orderRepository.findById(orderId.getValue())
                .map(entity -> mapper.toDomain(entity,
                        statusEventRepository.findByOrderIdOrderByIdAsc(entity.getId())));
    }

    @Override
    @Transactional
    public void updateStatus(OrderId orderId, OrderStatus status, Instant occurredAt) {
        OrderStatusEnum stored = mapper.toStatusEnum(status);
        update(orderId, entity -> entity.setStatus(stored));
        statusEventRepository.save(new OrderStatusEventEntity(orderId.getValue(), stored, occurredAt));
        log.debug("Recorded status {} for order {} at {}", stored, orderId, occurredAt);
    }

    @Override
    @Transactional
    public void assignCourier(OrderId orderId, String courierId) {
        update(orderId, entity -> entity.setCourierId(courierId));
    }

    @Override
    @Transactional
    public void recordCapture(OrderId orderId, ChargeCapture capture) {
        update(orderId, entity -> mapper.applyCapture(entity, capture));
    }

    @Override
    @Transactional
    public void recordRefund(OrderId orderId, String refundId) {
        update(orderId, entity -> entity.setStripeRefundId(refundId));
    }

    @Override
    @Transactional
    public void clearReferralGallons(OrderId orderId) {
        update(orderId, entity -> entity.setReferralGallonsUsed(BigDecimal.ZERO));
    }

    @Override
    @Transactional
    public void clearCouponCode(OrderId orderId) {
        update(orderId, entity -> entity.setCouponCode(""));
    }

    @Override
    @Transactional(readOnly = true)
    public Money unpaidBalance(String userId) {
        return Money.ofCents(orderRepository.sumUnpaidTotal(userId, OrderStatusEnum.COMPLETE));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasActiveOrdersForCourier(String courierId, OrderId excluding) {
        return orderRepository.existsByCourierIdAndStatusInAndIdNot(courierId, activeStatuses, excluding.getValue());
    }

    private void update(OrderId orderId, Consumer<OrderEntity> change) {
        OrderEntity entity = orderRepository.findById(orderId.getValue())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        change.accept(entity);
        orderRepository.save(entity);
    }
}
