package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.CouponRedemptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CouponRedemptionRepository extends JpaRepository<CouponRedemptionEntity, Long> {

    boolean existsByCodeAndVehicleIdAndUserId(String code, String vehicleId, String userId);

    long deleteByCodeAndVehicleIdAndUserId(String code, String vehicleId, String userId);
}
