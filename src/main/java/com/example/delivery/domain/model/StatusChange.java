package com.example.delivery.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of an order's append-only status history.
 */
public record StatusChange(OrderStatus status, Instant occurredAt) {

    public StatusChange {
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(occurredAt, "OccurredAt cannot be null");
    }

    /**
     * Renders the entry in the legacy delimited trail format, {@code "<status> <unix-seconds>|"}.
     */
    public String toLogEntry() {
        return status.wireName() + " " + occurredAt.getEpochSecond() + "|";
    }
}
