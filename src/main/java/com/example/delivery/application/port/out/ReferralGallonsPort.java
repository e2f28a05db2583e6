package com.example.delivery.application.port.out;

import java.math.BigDecimal;

/**
 * Outbound port for the per-user referral gallons ledger.
 */
public interface ReferralGallonsPort {

    void credit(String userId, BigDecimal gallons);
}
