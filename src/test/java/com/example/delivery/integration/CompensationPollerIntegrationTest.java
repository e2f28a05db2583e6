package com.example.delivery.integration;

import com.example.delivery.application.dto.CancelOrderCommand;
import com.example.delivery.application.dto.CompensationStep;
import com.example.delivery.application.port.in.CancelOrderUseCase;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskEntity;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskStatus;
import com.example.delivery.infrastructure.persistence.entity.CouponRedemptionEntity;
import com.example.delivery.infrastructure.persistence.entity.CourierEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.delivery.infrastructure.persistence.repository.CompensationTaskRepository;
import com.example.delivery.infrastructure.persistence.repository.CouponRedemptionRepository;
import com.example.delivery.infrastructure.persistence.repository.CourierRepository;
import com.example.delivery.infrastructure.persistence.repository.OrderJpaRepository;
import com.example.delivery.infrastructure.persistence.repository.UserAccountRepository;
import com.example.delivery.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.example.delivery.support.OrderFixtures.customer;
import static com.example.delivery.support.OrderFixtures.order;
import static com.example.delivery.support.OrderFixtures.uniqueId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Compensation driven by the scheduled poller alone, with the after-commit dispatch switched off.
 */
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "delivery.compensation.poller.enabled=true",
        "delivery.compensation.dispatch-immediately=false",
        "delivery.compensation.poller.interval-ms=100",
        "delivery.compensation.poller.retry-interval-ms=200",
        "delivery.compensation.claim-lease-seconds=60"
})
@DisplayName("Compensation poller Integration Tests")
class CompensationPollerIntegrationTest extends WireMockTestSupport {

    @Autowired
    private CancelOrderUseCase cancelOrderUseCase;

    @Autowired
    private CompensationTaskRepository taskRepository;

    @Autowired
    private OrderJpaRepository orderRepository;

    @Autowired
    private UserAccountRepository userRepository;

    @Autowired
    private CourierRepository courierRepository;

    @Autowired
    private CouponRedemptionRepository couponRepository;

    private List<CompensationTaskEntity> tasksOf(String orderId) {
        return taskRepository.findByOrderIdOrderBySequenceAsc(orderId);
    }

    @Test
    @DisplayName("should_run_whole_plan_in_sequence_from_poller")
    void should_run_whole_plan_in_sequence_from_poller() {
        // Given
        String userId = uniqueId("user");
        String courierId = uniqueId("courier");
        String chargeId = uniqueId("ch");
        userRepository.save(customer(userId, uniqueId("REF")));
        CourierEntity courier = new CourierEntity(courierId);
        courier.setBusy(true);
        courierRepository.save(courier);
        couponRepository.save(new CouponRedemptionEntity("SAVE10", "veh-1", userId));
        OrderEntity order = order(uniqueId("order"), userId, OrderStatusEnum.ACCEPTED);
        order.setCourierId(courierId);
        order.setStripeChargeId(chargeId);
        order.setCouponCode("SAVE10");
        order.setReferralGallonsUsed(new BigDecimal("3"));
        orderRepository.save(order);
        stubRefundSuccess(chargeId, "re_poll");

        // When
        cancelOrderUseCase.cancel(CancelOrderCommand.byDashboard(userId, OrderId.of(order.getId())));

        // Then
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(tasksOf(order.getId()))
                        .hasSize(6)
                        .allSatisfy(task -> assertThat(task.getStatus()).isEqualTo(CompensationTaskStatus.DONE)));

        List<CompensationTaskEntity> tasks = tasksOf(order.getId());
        for (int i = 1; i < tasks.size(); i++) {
            assertThat(tasks.get(i).getClaimedAt()).isAfterOrEqualTo(tasks.get(i - 1).getProcessedAt());
        }
        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStripeRefundId()).isEqualTo("re_poll");
        assertThat(courierRepository.findById(courierId).orElseThrow().isBusy()).isFalse();
    }

    @Test
    @DisplayName("should_requeue_task_whose_claim_expired")
    void should_requeue_task_whose_claim_expired() {
        // Given: a coupon release claimed an hour ago by a worker that never finished
        OrderEntity order = orderRepository.save(order(uniqueId("order"), uniqueId("user"), OrderStatusEnum.CANCELLED));
        CompensationTaskEntity stranded = new CompensationTaskEntity();
        stranded.setId(UUID.randomUUID().toString());
        stranded.setOrderId(order.getId());
        stranded.setStep(CompensationStep.RELEASE_COUPON.name());
        stranded.setSequence(0);
        stranded.setPayload("{}");
        stranded.setCreatedAt(Instant.now().minus(Duration.ofHours(1)));
        stranded.markClaimed(Instant.now().minus(Duration.ofHours(1)));
        taskRepository.save(stranded);

        // Then: it is failed for the lost claim and then completed by the retry pass
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            CompensationTaskEntity task = taskRepository.findById(stranded.getId()).orElseThrow();
            assertThat(task.getStatus()).isEqualTo(CompensationTaskStatus.DONE);
            assertThat(task.getRetryCount()).isEqualTo(1);
        });
    }
}
