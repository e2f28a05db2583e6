package com.example.delivery.unit.domain;

import com.example.delivery.domain.model.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderStatus Tests")
class OrderStatusTest {

    @Nested
    @DisplayName("Forward successor")
    class NextStatus {

        @ParameterizedTest
        @CsvSource({
                "UNASSIGNED, ASSIGNED",
                "ASSIGNED, ACCEPTED",
                "ACCEPTED, ENROUTE",
                "ENROUTE, SERVICING",
                "SERVICING, COMPLETE"
        })
        @DisplayName("should_follow_the_delivery_chain")
        void should_follow_the_delivery_chain(OrderStatus current, OrderStatus expected) {
            assertThat(current.next()).contains(expected);
        }

        @Test
        @DisplayName("should_have_no_successor_for_terminal_statuses")
        void should_have_no_successor_for_terminal_statuses() {
            assertThat(OrderStatus.COMPLETE.next()).isEmpty();
            assertThat(OrderStatus.CANCELLED.next()).isEmpty();
        }
    }

    @Test
    @DisplayName("should_allow_cancellation_from_every_non_terminal_status_by_default")
    void should_allow_cancellation_from_every_non_terminal_status_by_default() {
        assertThat(OrderStatus.defaultCancellable())
                .containsExactlyInAnyOrder(OrderStatus.UNASSIGNED, OrderStatus.ASSIGNED,
                        OrderStatus.ACCEPTED, OrderStatus.ENROUTE, OrderStatus.SERVICING)
                .noneMatch(OrderStatus::isTerminal);
    }

    @Test
    @DisplayName("should_parse_wire_names_case_insensitively")
    void should_parse_wire_names_case_insensitively() {
        assertThat(OrderStatus.fromWireName(" Enroute ")).isEqualTo(OrderStatus.ENROUTE);
        assertThat(OrderStatus.CANCELLED.wireName()).isEqualTo("cancelled");
    }

    @Test
    @DisplayName("should_reject_unknown_wire_name")
    void should_reject_unknown_wire_name() {
        assertThatThrownBy(() -> OrderStatus.fromWireName("delivered"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delivered");
    }
}
