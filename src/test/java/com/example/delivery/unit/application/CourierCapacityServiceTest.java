package com.example.delivery.unit.application;

import com.example.delivery.application.port.out.CourierCapacityPort;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.application.service.CourierCapacityService;
import com.example.delivery.domain.model.OrderId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CourierCapacityService Tests")
class CourierCapacityServiceTest {

    private static final OrderId ORDER_ID = OrderId.of("o1");

    @Mock
    private CourierCapacityPort capacityPort;
    @Mock
    private OrderStorePort orderStore;

    private CourierCapacityService service;

    @BeforeEach
    void setUp() {
        service = new CourierCapacityService(capacityPort, orderStore);
    }

    @Test
    @DisplayName("should_mark_courier_busy_on_acquire")
    void should_mark_courier_busy_on_acquire() {
        service.acquire("c1", ORDER_ID);

        verify(capacityPort).setBusy("c1", true);
        verifyNoInteractions(orderStore);
    }

    @Test
    @DisplayName("should_free_courier_with_no_other_active_orders")
    void should_free_courier_with_no_other_active_orders() {
        when(orderStore.hasActiveOrdersForCourier("c1", ORDER_ID)).thenReturn(false);

        assertThat(service.release("c1", ORDER_ID)).isFalse();

        verify(capacityPort).setBusy("c1", false);
    }

    @Test
    @DisplayName("should_keep_courier_busy_while_bound_to_another_order")
    void should_keep_courier_busy_while_bound_to_another_order() {
        when(orderStore.hasActiveOrdersForCourier("c1", ORDER_ID)).thenReturn(true);

        assertThat(service.release("c1", ORDER_ID)).isTrue();

        verify(capacityPort).setBusy("c1", true);
    }
}
