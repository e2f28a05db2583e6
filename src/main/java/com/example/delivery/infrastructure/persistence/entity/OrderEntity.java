package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for delivery orders. Money columns hold cents.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_status", columnList = "user_id, status"),
    @Index(name = "idx_orders_courier_status", columnList = "courier_id, status")
})
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatusEnum status;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "courier_id", length = 64)
    private String courierId;

    @Column(name = "vehicle_id", length = 64)
    private String vehicleId;

    @Column(name = "license_plate", length = 32)
    private String licensePlate;

    @Column(name = "total_price", nullable = false)
    private long totalPrice;

    @Column(name = "gas_price", nullable = false)
    private long gasPrice;

    @Column(name = "service_fee", nullable = false)
    private long serviceFee;

    @Column(name = "gallons", precision = 10, scale = 3)
    private BigDecimal gallons = BigDecimal.ZERO;

    @Column(name = "gas_type", length = 16)
    private String gasType;

    @Column(name = "tire_pressure_check")
    private boolean tirePressureCheck;

    @Column(name = "paid")
    private boolean paid;

    @Column(name = "stripe_charge_id", length = 64)
    private String stripeChargeId;

    @Column(name = "stripe_customer_id_charged", length = 64)
    private String stripeCustomerIdCharged;

    @Column(name = "stripe_balance_transaction_id", length = 64)
    private String stripeBalanceTransactionId;

    @Column(name = "time_paid")
    private Instant timePaid;

    @Column(name = "payment_info", length = 1000)
    private String paymentInfo;

    @Column(name = "stripe_refund_id", length = 64)
    private String stripeRefundId;

    @Column(name = "coupon_code", length = 64)
    private String couponCode;

    @Column(name = "referral_gallons_used", precision = 10, scale = 3)
    private BigDecimal referralGallonsUsed = BigDecimal.ZERO;

    @Column(name = "address_street", length = 255)
    private String addressStreet;

    @Column(name = "address_city", length = 128)
    private String addressCity;

    @Column(name = "address_state", length = 32)
    private String addressState;

    @Column(name = "address_zip", length = 16)
    private String addressZip;

    @Column(name = "lat")
    private Double lat;

    @Column(name = "lng")
    private Double lng;

    @Column(name = "target_time_start")
    private Instant targetTimeStart;

    @Column(name = "target_time_end")
    private Instant targetTimeEnd;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public OrderStatusEnum getStatus() {
        return status;
    }

    public void setStatus(OrderStatusEnum status) {
        this.status = status;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getCourierId() {
        return courierId;
    }

    public void setCourierId(String courierId) {
        this.courierId = courierId;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public void setVehicleId(String vehicleId) {
        this.vehicleId = vehicleId;
    }

    public String getLicensePlate() {
        return licensePlate;
    }

    public void setLicensePlate(String licensePlate) {
        this.licensePlate = licensePlate;
    }

    public long getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(long totalPrice) {
        this.totalPrice = totalPrice;
    }

    public long getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(long gasPrice) {
        this.gasPrice = gasPrice;
    }

    public long getServiceFee() {
        return serviceFee;
    }

    public void setServiceFee(long serviceFee) {
        this.serviceFee = serviceFee;
    }

    public BigDecimal getGallons() {
        return gallons;
    }

    public void setGallons(BigDecimal gallons) {
        this.gallons = gallons;
    }

    public String getGasType() {
        return gasType;
    }

    public void setGasType(String gasType) {
        this.gasType = gasType;
    }

    public boolean isTirePressureCheck() {
        return tirePressureCheck;
    }

    public void setTirePressureCheck(boolean tirePressureCheck) {
        this.tirePressureCheck = tirePressureCheck;
    }

    public boolean isPaid() {
        return paid;
    }

    public void setPaid(boolean paid) {
        this.paid = paid;
    }

    public String getStripeChargeId() {
        return stripeChargeId;
    }

    public void setStripeChargeId(String stripeChargeId) {
        this.stripeChargeId = stripeChargeId;
    }

    public String getStripeCustomerIdCharged() {
        return stripeCustomerIdCharged;
    }

    public void setStripeCustomerIdCharged(String stripeCustomerIdCharged) {
        this.stripeCustomerIdCharged = stripeCustomerIdCharged;
    }

    public String getStripeBalanceTransactionId() {
        return stripeBalanceTransactionId;
    }

    public void setStripeBalanceTransactionId(String stripeBalanceTransactionId) {
        this.stripeBalanceTransactionId = stripeBalanceTransactionId;
    }

    public Instant getTimePaid() {
        return timePaid;
    }

    public void setTimePaid(Instant timePaid) {
        this.timePaid = timePaid;
    }

    public String getPaymentInfo() {
        return paymentInfo;
    }

    public void setPaymentInfo(String paymentInfo) {
        this.paymentInfo = paymentInfo;
    }

    public String getStripeRefundId() {
        return stripeRefundId;
    }

    public void setStripeRefundId(String stripeRefundId) {
        this.stripeRefundId = stripeRefundId;
    }

    public String getCouponCode() {
        return couponCode;
    }

    public void setCouponCode(String couponCode) {
        this.couponCode = couponCode;
    }

    public BigDecimal getReferralGallonsUsed() {
        return referralGallonsUsed;
    }

    public void setReferralGallonsUsed(BigDecimal referralGallonsUsed) {
        this.referralGallonsUsed = referralGallonsUsed;
    }

    public String getAddressStreet() {
        return addressStreet;
    }

    public void setAddressStreet(String addressStreet) {
        this.addressStreet = addressStreet;
    }

    public String getAddressCity() {
        return addressCity;
    }

    public void setAddressCity(String addressCity) {
        this.addressCity = addressCity;
    }

    public String getAddressState() {
        return addressState;
    }

    public void setAddressState(String addressState) {
        this.addressState = addressState;
    }

    public String getAddressZip() {
        return addressZip;
    }

    public void setAddressZip(String addressZip) {
        this.addressZip = addressZip;
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLng() {
        return lng;
    }

    public void setLng(Double lng) {
        this.lng = lng;
    }

    public Instant getTargetTimeStart() {
        return targetTimeStart;
    }

    public void setTargetTimeStart(Instant targetTimeStart) {
        this.targetTimeStart = targetTimeStart;
    }

    public Instant getTargetTimeEnd() {
        return targetTimeEnd;
    }

    public void setTargetTimeEnd(Instant targetTimeEnd) {
        this.targetTimeEnd = targetTimeEnd;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
