package com.example.delivery.application.dto;

/**
 * Compensation steps run after a cancellation, in declaration order.
 */
public enum CompensationStep {
    RESTORE_REFERRAL_GALLONS,
    RELEASE_COUPON,
    RELEASE_COURIER,
    NOTIFY_CUSTOMER,
    REFUND_CHARGE,
    TRACK_CANCELLATION
}
