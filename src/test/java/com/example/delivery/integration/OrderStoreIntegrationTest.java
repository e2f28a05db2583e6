package com.example.delivery.integration;

import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.exception.OrderNotFoundException;
import com.example.delivery.domain.model.Money;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import com.example.delivery.domain.model.StatusChange;
import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.delivery.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.delivery.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static com.example.delivery.support.OrderFixtures.order;
import static com.example.delivery.support.OrderFixtures.uniqueId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ActiveProfiles("test")
@DisplayName("Order store Integration Tests")
class OrderStoreIntegrationTest extends WireMockTestSupport {

    @Autowired
    private OrderStorePort orderStore;

    @Autowired
    private OrderJpaRepository orderRepository;

    private OrderEntity save(String userId, OrderStatusEnum status, long totalCents, boolean paid) {
        OrderEntity order = order(uniqueId("order"), userId, status);
        order.setTotalPrice(totalCents);
        order.setPaid(paid);
        return orderRepository.save(order);
    }

    @Test
    @DisplayName("should_sum_only_complete_unpaid_positive_orders")
    void should_sum_only_complete_unpaid_positive_orders() {
        String userId = uniqueId("user");
        save(userId, OrderStatusEnum.COMPLETE, 2500, false);
        save(userId, OrderStatusEnum.COMPLETE, 1250, false);
        save(userId, OrderStatusEnum.COMPLETE, 0, false);
        save(userId, OrderStatusEnum.COMPLETE, 4000, true);
        save(userId, OrderStatusEnum.SERVICING, 3000, false);
        save(userId, OrderStatusEnum.CANCELLED, 3000, false);
        save(uniqueId("other"), OrderStatusEnum.COMPLETE, 9900, false);

        assertThat(orderStore.unpaidBalance(userId)).isEqualTo(Money.ofCents(3750));
        assertThat(orderStore.unpaidBalance(uniqueId("nobody"))).isEqualTo(Money.zero());
    }

    @Test
    @DisplayName("should_see_courier_busy_only_with_other_active_orders")
    void should_see_courier_busy_only_with_other_active_orders() {
        String courierId = uniqueId("courier");
        OrderEntity current = save(uniqueId("user"), OrderStatusEnum.ENROUTE, 2500, false);
        current.setCourierId(courierId);
        orderRepository.save(current);
        OrderEntity finished = save(uniqueId("user"), OrderStatusEnum.COMPLETE, 2500, true);
        finished.setCourierId(courierId);
        orderRepository.save(finished);

        assertThat(orderStore.hasActiveOrdersForCourier(courierId, OrderId.of(current.getId()))).isFalse();

        OrderEntity queued = save(uniqueId("user"), OrderStatusEnum.ASSIGNED, 2500, false);
        queued.setCourierId(courierId);
        orderRepository.save(queued);

        assertThat(orderStore.hasActiveOrdersForCourier(courierId, OrderId.of(current.getId()))).isTrue();
    }

    @Test
    @DisplayName("should_append_status_history_in_order")
    void should_append_status_history_in_order() {
        OrderEntity seeded = save(uniqueId("user"), OrderStatusEnum.UNASSIGNED, 2500, false);
        OrderId orderId = OrderId.of(seeded.getId());

        orderStore.updateStatus(orderId, OrderStatus.ASSIGNED, Instant.ofEpochSecond(1700000000L));
        orderStore.updateStatus(orderId, OrderStatus.ACCEPTED, Instant.ofEpochSecond(1700000060L));
        orderStore.updateStatus(orderId, OrderStatus.CANCELLED, Instant.ofEpochSecond(1700000120L));

        Order order = orderStore.findById(orderId).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getStatusHistory())
                .extracting(StatusChange::toLogEntry)
                .containsExactly("assigned 1700000000|", "accepted 1700000060|", "cancelled 1700000120|");
    }

    @Test
    @DisplayName("should_reject_writes_to_unknown_order")
    void should_reject_writes_to_unknown_order() {
        OrderId missing = OrderId.of(uniqueId("missing"));

        assertThat(orderStore.findById(missing)).isEmpty();
        assertThatThrownBy(() -> orderStore.updateStatus(missing, OrderStatus.ASSIGNED, Instant.now()))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
