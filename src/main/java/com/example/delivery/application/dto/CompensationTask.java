package com.example.delivery.application.dto;

import com.example.delivery.domain.model.OrderId;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a cancellation's compensation sequence.
 *
 * @param sequence  position within the sequence; tasks of one cancellation share {@code createdAt}
 * @param payload   step inputs captured at cancellation time
 */
public record CompensationTask(
        String id,
        OrderId orderId,
        CompensationStep step,
        int sequence,
        Map<String, Object> payload,
        Instant createdAt
) {
    public static final String COURIER_ID = "courierId";
    public static final String USER_ID = "userId";
    public static final String PROPERTIES = "properties";

    public CompensationTask {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        Objects.requireNonNull(step, "Step cannot be null");
        Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        payload = payload == null ? Map.of() : payload;
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
