package com.example.delivery.infrastructure.persistence.entity;

/**
 * Order status as stored in the {@code orders.status} column.
 */
public enum OrderStatusEnum {
    UNASSIGNED,
    ASSIGNED,
    ACCEPTED,
    ENROUTE,
    SERVICING,
    COMPLETE,
    CANCELLED
}
