package com.example.delivery.infrastructure.persistence;

import com.example.delivery.application.port.out.CouponLedgerPort;
import com.example.delivery.infrastructure.persistence.repository.CouponRedemptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class CouponLedgerAdapter implements CouponLedgerPort {

    private static final Logger log = LoggerFactory.getLogger(CouponLedgerAdapter.class);

    private final CouponRedemptionRepository redemptionRepository;

    public CouponLedgerAdapter(CouponRedemptionRepository redemptionRepository) {
        this.redemptionRepository = redemptionRepository;
    }

    @Override
    @Transactional
    public void markUnused(String code, String vehicleId, String userId) {
        long removed = redemptionRepository.deleteByCodeAndVehicleIdAndUserId(code, vehicleId, userId);
        log.debug("Coupon {} freed for vehicle {} of {} ({} rows)", code, vehicleId, userId, removed);
    }
}
