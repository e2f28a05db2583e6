package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * Marks a coupon code as used by one vehicle of one user.
 */
@Entity
@Table(name = "coupon_redemptions", uniqueConstraints = {
    @UniqueConstraint(name = "uk_coupon_vehicle_user", columnNames = {"code", "vehicle_id", "user_id"})
})
public class CouponRedemptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", length = 64, nullable = false)
    private String code;

    @Column(name = "vehicle_id", length = 64)
    private String vehicleId;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    protected CouponRedemptionEntity() {
    }

    public CouponRedemptionEntity(String code, String vehicleId, String userId) {
        this.code = code;
        this.vehicleId = vehicleId;
        this.userId = userId;
    }

    public Long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public String getUserId() {
        return userId;
    }
}
