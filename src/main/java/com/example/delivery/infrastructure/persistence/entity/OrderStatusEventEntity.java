package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One row per status change of an order, in insertion order.
 */
@Entity
@Table(name = "order_status_events", indexes = {
    @Index(name = "idx_status_events_order", columnList = "order_id")
})
public class OrderStatusEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatusEnum status;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    protected OrderStatusEventEntity() {
    }

    public OrderStatusEventEntity(String orderId, OrderStatusEnum status, Instant occurredAt) {
        this.orderId = orderId;
        this.status = status;
        this.occurredAt = occurredAt;
    }

    public Long getId() {
        return id;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderStatusEnum getStatus() {
        return status;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
