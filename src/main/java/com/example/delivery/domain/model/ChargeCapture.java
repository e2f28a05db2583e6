package com.example.delivery.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a successful capture as reported by the payment gateway.
 * <p>
 * {@code captured} drives the order's paid flag. The gateway also reports a separate
 * "paid" indicator on charges, which means something else and is not stored.
 */
public record ChargeCapture(
        boolean captured,
        String chargeId,
        String customerId,
        String balanceTransactionId,
        Instant capturedAt,
        CardSummary card
) {
    public ChargeCapture {
        Objects.requireNonNull(chargeId, "ChargeId cannot be null");
    }
}
