package com.example.delivery.domain.model;

/**
 * Subset of the charged card kept on the order for receipts and support.
 */
public record CardSummary(
        String id,
        String brand,
        Integer expMonth,
        Integer expYear,
        String last4
) {
}
