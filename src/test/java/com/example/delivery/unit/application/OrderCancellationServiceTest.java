package com.example.delivery.unit.application;

import com.example.delivery.application.dto.CancelOrderCommand;
import com.example.delivery.application.dto.CompensationScheduledEvent;
import com.example.delivery.application.dto.CompensationStep;
import com.example.delivery.application.dto.CompensationTask;
import com.example.delivery.application.dto.OrderActionResult;
import com.example.delivery.application.port.in.OrderStatusUseCase;
import com.example.delivery.application.port.out.CompensationQueuePort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.port.out.UserDirectoryPort;
import com.example.delivery.application.port.out.UserDirectoryPort.UserAccount;
import com.example.delivery.application.service.MarketResolver;
import com.example.delivery.application.service.OrderCancellationService;
import com.example.delivery.application.service.OrderTrackingProperties;
import com.example.delivery.domain.model.Money;
import com.example.delivery.domain.model.Order;
import com.example.delivery.domain.model.OrderId;
import com.example.delivery.domain.model.OrderStatus;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderCancellationService Tests")
class OrderCancellationServiceTest {

    private static final OrderId ORDER_ID = OrderId.of("o1");
    private static final Instant NOW = Instant.parse("2024-03-01T18:00:00Z");

    @Mock
    private OrderStorePort orderStore;
    @Mock
    private OrderStatusUseCase orderStatus;
    @Mock
    private CompensationQueuePort compensationQueue;
    @Mock
    private UserDirectoryPort userDirectory;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderCancellationService service;

    @BeforeEach
    void setUp() {
        service = newService(new String[0]);
    }

    private OrderCancellationService newService(String[] cancellableStatuses) {
        return new OrderCancellationService(orderStore, orderStatus, compensationQueue, userDirectory,
                new OrderTrackingProperties(new MarketResolver(new String[]{"902:0"})),
                eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC), cancellableStatuses);
    }

    private static Order.Builder order(OrderStatus status) {
        return Order.builder()
                .orderId(ORDER_ID)
                .userId("u1")
                .status(status)
                .vehicleId("veh-1")
                .addressZip("90210")
                .totalPrice(Money.ofCents(2500));
    }

    @SuppressWarnings("unchecked")
    private List<CompensationTask> enqueuedPlan() {
        ArgumentCaptor<List<CompensationTask>> plan = ArgumentCaptor.forClass(List.class);
        verify(compensationQueue).enqueue(plan.capture());
        return plan.getValue();
    }

    @Test
    @DisplayName("should_return_not_found_for_unknown_order")
    void should_return_not_found_for_unknown_order() {
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.empty());

        OrderActionResult result = service.cancel(CancelOrderCommand.byCustomer("u1", ORDER_ID));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo(OrderActionResult.NOT_FOUND_MESSAGE);
        verifyNoInteractions(orderStatus, compensationQueue, eventPublisher);
    }

    @Test
    @DisplayName("should_refuse_to_cancel_completed_order")
    void should_refuse_to_cancel_completed_order() {
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.COMPLETE).build()));

        OrderActionResult result = service.cancel(CancelOrderCommand.byCustomer("u1", ORDER_ID));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Sorry, it is too late for this order to be cancelled.");
        verifyNoInteractions(orderStatus, compensationQueue);
    }

    @Test
    @DisplayName("should_honour_override_of_cancellable_statuses")
    void should_honour_override_of_cancellable_statuses() {
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.SERVICING).build()));
        CancelOrderCommand command = new CancelOrderCommand("u1", ORDER_ID, true, false, true,
                EnumSet.of(OrderStatus.UNASSIGNED));

        OrderActionResult result = service.cancel(command);

        assertThat(result.success()).isFalse();
        verify(orderStatus, never()).setStatus(any(), any());
    }

    @Test
    @DisplayName("should_use_configured_cancellable_statuses")
    void should_use_configured_cancellable_statuses() {
        OrderCancellationService restricted = newService(new String[]{"unassigned", "assigned"});
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.ENROUTE).build()));

        OrderActionResult result = restricted.cancel(CancelOrderCommand.byCustomer("u1", ORDER_ID));

        assertThat(result.success()).isFalse();
        verifyNoInteractions(compensationQueue);
    }

    @Test
    @DisplayName("should_plan_every_applicable_step_in_order")
    void should_plan_every_applicable_step_in_order() {
        // Given: an order carrying every kind of side effect
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.ACCEPTED)
                .referralGallonsUsed(new BigDecimal("3"))
                .couponCode("SAVE10")
                .courierId("c1")
                .stripeChargeId("ch_1")
                .build()));

        // When
        OrderActionResult result = service.cancel(CancelOrderCommand.byDashboard("u1", ORDER_ID));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.customer()).isNull();
        verify(orderStatus).setStatus(ORDER_ID, OrderStatus.CANCELLED);

        List<CompensationTask> plan = enqueuedPlan();
        assertThat(plan).extracting(CompensationTask::step).containsExactly(
                CompensationStep.RESTORE_REFERRAL_GALLONS,
                CompensationStep.RELEASE_COUPON,
                CompensationStep.RELEASE_COURIER,
                CompensationStep.NOTIFY_CUSTOMER,
                CompensationStep.REFUND_CHARGE,
                CompensationStep.TRACK_CANCELLATION);
        assertThat(plan).extracting(CompensationTask::sequence).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(plan).extracting(CompensationTask::createdAt).containsOnly(NOW);
        assertThat(plan.get(2).payloadString(CompensationTask.COURIER_ID)).isEqualTo("c1");
        assertThat(plan.get(3).payloadString(CompensationTask.USER_ID)).isEqualTo("u1");

        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) plan.get(5).payload().get(CompensationTask.PROPERTIES);
        assertThat(properties)
                .containsEntry("cancelled-by-user", false)
                .containsEntry("order_id", "o1")
                .containsEntry("coupon_code", "SAVE10")
                .containsEntry("referral_gallons_used", 3.0);

        verify(eventPublisher).publishEvent(new CompensationScheduledEvent(ORDER_ID, 6));
    }

    @Test
    @DisplayName("should_plan_only_tracking_for_bare_order_and_return_customer_details")
    void should_plan_only_tracking_for_bare_order_and_return_customer_details() {
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.UNASSIGNED).build()));
        when(userDirectory.findById("u1")).thenReturn(Optional.of(
                new UserAccount("u1", "Ann", "ann@example.com", "+1555", "ANN1", new BigDecimal("2"), false, true)));

        OrderActionResult result = service.cancel(CancelOrderCommand.byCustomer("u1", ORDER_ID));

        assertThat(result.success()).isTrue();
        assertThat(result.customer().referralCode()).isEqualTo("ANN1");
        assertThat(result.customer().referralGallons()).isEqualByComparingTo("2");

        List<CompensationTask> plan = enqueuedPlan();
        assertThat(plan).singleElement().satisfies(task -> {
            assertThat(task.step()).isEqualTo(CompensationStep.TRACK_CANCELLATION);
            assertThat(task.payloadString(CompensationTask.USER_ID)).isEqualTo("u1");
            assertThat(task.payload().get(CompensationTask.PROPERTIES))
                    .asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("cancelled-by-user", true);
        });
    }

    @Test
    @DisplayName("should_fall_back_to_bare_success_when_customer_unknown")
    void should_fall_back_to_bare_success_when_customer_unknown() {
        when(orderStore.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.ASSIGNED).build()));
        when(userDirectory.findById("u1")).thenReturn(Optional.empty());

        OrderActionResult result = service.cancel(CancelOrderCommand.byCustomer("u1", ORDER_ID));

        assertThat(result.success()).isTrue();
        assertThat(result.customer()).isNull();
    }
}
