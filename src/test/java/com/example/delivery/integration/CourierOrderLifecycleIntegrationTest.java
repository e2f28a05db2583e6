package com.example.delivery.integration;

import com.example.delivery.application.dto.AssignOrderCommand;
import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.application.port.in.CompleteOrderUseCase;
import com.example.delivery.application.port.in.CourierOrderUseCase;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import com.example.delivery.domain.model.StatusChange;
import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.delivery.infrastructure.persistence.repository.CourierRepository;
import com.example.delivery.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.delivery.infrastructure.persistence.repository.UserAccountRepository;
import com.example.delivery.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.Optional;

import static com.example.delivery.support.OrderFixtures.customer;
import static com.example.delivery.support.OrderFixtures.order;
import static com.example.delivery.support.OrderFixtures.uniqueId;
import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * A courier takes an order from assignment through completion.
 */
@ActiveProfiles("test")
@DisplayName("Courier order lifecycle Integration Tests")
class CourierOrderLifecycleIntegrationTest extends WireMockTestSupport {

    @Autowired
    private CourierOrderUseCase courierOrderUseCase;

    @Autowired
    private CompleteOrderUseCase completeOrderUseCase;

    @Autowired
    private OrderStorePort orderStore;

    @Autowired
    private OrderJpaRepository orderRepository;

    @Autowired
    private UserAccountRepository userRepository;

    @Autowired
    private CourierRepository courierRepository;

    @Test
    @DisplayName("should_walk_order_from_assignment_to_completion")
    void should_walk_order_from_assignment_to_completion() {
        // Given
        String userId = uniqueId("user");
        String courierId = uniqueId("courier");
        userRepository.save(customer(userId, uniqueId("REF")));
        OrderEntity seeded = orderRepository.save(order(uniqueId("order"), userId, OrderStatusEnum.UNASSIGNED));
        OrderId orderId = OrderId.of(seeded.getId());

        // When: assigned, courier busy
        Optional<OrderActionResult> assigned = courierOrderUseCase.assign(new AssignOrderCommand(orderId, courierId, true));
        assertThat(assigned).hasValueSatisfying(result -> assertThat(result.success()).isTrue());
        assertThat(courierRepository.findById(courierId).orElseThrow().isBusy()).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                notificationServer.verify(postRequestedFor(urlEqualTo("/api/notifications/sms"))
                        .withRequestBody(matchingJsonPath("$.userId", equalTo(courierId)))
                        .withRequestBody(matchingJsonPath("$.message", containing("123 Main St, 90210")))));

        // a second courier cannot take it over
        assertThat(courierOrderUseCase.assign(new AssignOrderCommand(orderId, uniqueId("courier"), true))).isEmpty();

        assertThat(courierOrderUseCase.accept(orderId).success()).isTrue();
        assertThat(courierOrderUseCase.beginRoute(orderId).success()).isTrue();
        assertThat(courierOrderUseCase.service(orderId).success()).isTrue();
        assertThat(completeOrderUseCase.complete(orderId).join().success()).isTrue();

        // Then
        assertThat(orderStore.findById(orderId).orElseThrow().getStatusHistory())
                .extracting(StatusChange::status)
                .containsExactly(OrderStatus.ASSIGNED, OrderStatus.ACCEPTED, OrderStatus.ENROUTE,
                        OrderStatus.SERVICING, OrderStatus.COMPLETE);
        assertThat(orderRepository.findById(seeded.getId()).orElseThrow().getCourierId()).isEqualTo(courierId);
        assertThat(courierRepository.findById(courierId).orElseThrow().isBusy()).isFalse();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verifyPushSent(userId, "A courier is enroute to your location. Please ensure that your fueling door is open.");
            verifyPushSent(userId, "We are currently servicing your vehicle.");
        });
    }

    @Test
    @DisplayName("should_free_previous_courier_when_order_is_reassigned")
    void should_free_previous_courier_when_order_is_reassigned() {
        // Given: the first courier holds one order, the loaded courier two
        String userId = uniqueId("user");
        String first = uniqueId("courier");
        String second = uniqueId("courier");
        String loaded = uniqueId("courier");
        userRepository.save(customer(userId, uniqueId("REF")));
        OrderId solo = OrderId.of(orderRepository.save(order(uniqueId("order"), userId, OrderStatusEnum.UNASSIGNED)).getId());
        OrderId shared = OrderId.of(orderRepository.save(order(uniqueId("order"), userId, OrderStatusEnum.UNASSIGNED)).getId());
        OrderId other = OrderId.of(orderRepository.save(order(uniqueId("order"), userId, OrderStatusEnum.UNASSIGNED)).getId());
        courierOrderUseCase.assign(new AssignOrderCommand(solo, first, true));
        courierOrderUseCase.assign(new AssignOrderCommand(shared, loaded, true));
        courierOrderUseCase.assign(new AssignOrderCommand(other, loaded, true));

        // When
        assertThat(courierOrderUseCase.assign(new AssignOrderCommand(solo, second, false))).isPresent();
        assertThat(courierOrderUseCase.assign(new AssignOrderCommand(shared, second, false))).isPresent();

        // Then
        assertThat(courierRepository.findById(first).orElseThrow().isBusy()).isFalse();
        assertThat(courierRepository.findById(loaded).orElseThrow().isBusy()).isTrue();
        assertThat(courierRepository.findById(second).orElseThrow().isBusy()).isTrue();
        assertThat(orderRepository.findById(solo.getValue()).orElseThrow().getCourierId()).isEqualTo(second);
    }
}
