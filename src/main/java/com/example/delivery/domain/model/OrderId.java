package com.example.delivery.domain.model;

import java.util.Objects;

/**
 * Value Object representing an opaque, immutable order identifier.
 */
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = Objects.requireNonNull(value, "OrderId value cannot be null");
    }

    /**
     * Creates an OrderId from its stored representation.
     *
     * @param value identifier string
     * @return new OrderId instance
     * @throws IllegalArgumentException if value is null or blank
     */
    public static OrderId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid OrderId: must not be blank");
        }
        return new OrderId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return Objects.equals(value, orderId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
