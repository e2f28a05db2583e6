package com.example.delivery.application.port.out;

/**
 * Outbound port for coupon code usage, tracked per (code, vehicle, user).
 */
public interface CouponLedgerPort {

    void markUnused(String code, String vehicleId, String userId);
}
