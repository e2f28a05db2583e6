package com.example.delivery.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate Root representing a delivery order as read from the order store.
 * <p>
 * Instances are read-only snapshots. Every change goes through the order store so that
 * each write stays a single durable update.
 */
public final class Order {

    private final OrderId orderId;
    private final OrderStatus status;
    private final String userId;
    private final String courierId;
    private final String vehicleId;
    private final String licensePlate;
    private final Money totalPrice;
    private final Money gasPrice;
    private final Money serviceFee;
    private final BigDecimal gallons;
    private final String gasType;
    private final boolean tirePressureCheck;
    private final boolean paid;
    private final String stripeChargeId;
    private final String stripeCustomerIdCharged;
    private final String stripeBalanceTransactionId;
    private final Instant timePaid;
    private final CardSummary paymentInfo;
    private final String stripeRefundId;
    private final String couponCode;
    private final BigDecimal referralGallonsUsed;
    private final String addressStreet;
    private final String addressCity;
    private final String addressState;
    private final String addressZip;
    private final Double lat;
    private final Double lng;
    private final Instant targetTimeStart;
    private final Instant targetTimeEnd;
    private final List<StatusChange> statusHistory;

    private Order(Builder builder) {
        this.orderId = Objects.requireNonNull(builder.orderId, "OrderId cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.userId = Objects.requireNonNull(builder.userId, "UserId cannot be null");
        this.courierId = builder.courierId;
        this.vehicleId = builder.vehicleId;
        this.licensePlate = builder.licensePlate;
        this.totalPrice = Objects.requireNonNullElse(builder.totalPrice, Money.zero());
        this.gasPrice = Objects.requireNonNullElse(builder.gasPrice, Money.zero());
        this.serviceFee = Objects.requireNonNullElse(builder.serviceFee, Money.zero());
        this.gallons = Objects.requireNonNullElse(builder.gallons, BigDecimal.ZERO);
        this.gasType = builder.gasType;
        this.tirePressureCheck = builder.tirePressureCheck;
        this.paid = builder.paid;
        this.stripeChargeId = builder.stripeChargeId;
        this.stripeCustomerIdCharged = builder.stripeCustomerIdCharged;
        this.stripeBalanceTransactionId = builder.stripeBalanceTransactionId;
        this.timePaid = builder.timePaid;
        this.paymentInfo = builder.paymentInfo;
        this.stripeRefundId = builder.stripeRefundId;
        this.couponCode = builder.couponCode;
        this.referralGallonsUsed = Objects.requireNonNullElse(builder.referralGallonsUsed, BigDecimal.ZERO);
        this.addressStreet = builder.addressStreet;
        this.addressCity = builder.addressCity;
        this.addressState = builder.addressState;
        this.addressZip = builder.addressZip;
        this.lat = builder.lat;
        this.lng = builder.lng;
        this.targetTimeStart = builder.targetTimeStart;
        this.targetTimeEnd = builder.targetTimeEnd;
        this.statusHistory = new ArrayList<>(builder.statusHistory);

        if (referralGallonsUsed.signum() < 0) {
            throw new IllegalArgumentException("Referral gallons used cannot be negative: " + referralGallonsUsed);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether this order may be cancelled given the set of cancellable statuses.
     *
     * @param cancellable statuses from which cancellation is allowed
     * @return true if the current status is in the set
     */
    public boolean isCancellableFrom(Set<OrderStatus> cancellable) {
        return cancellable.contains(status);
    }

    public boolean hasCourier() {
        return !isBlank(courierId);
    }

    public boolean hasCharge() {
        return !isBlank(stripeChargeId);
    }

    public boolean hasRefund() {
        return !isBlank(stripeRefundId);
    }

    public boolean hasCoupon() {
        return !isBlank(couponCode);
    }

    public boolean usedReferralGallons() {
        return referralGallonsUsed.signum() > 0;
    }

    /**
     * A $0 order, or one without a charge on file, is never captured.
     */
    public boolean requiresCapture() {
        return !totalPrice.isZero() && hasCharge();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public String getUserId() {
        return userId;
    }

    public String getCourierId() {
        return courierId;
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public String getLicensePlate() {
        return licensePlate;
    }

    public Money getTotalPrice() {
        return totalPrice;
    }

    public Money getGasPrice() {
        return gasPrice;
    }

    public Money getServiceFee() {
        return serviceFee;
    }

    public BigDecimal getGallons() {
        return gallons;
    }

    public String getGasType() {
        return gasType;
    }

    public boolean isTirePressureCheck() {
        return tirePressureCheck;
    }

    public boolean isPaid() {
        return paid;
    }

    public String getStripeChargeId() {
        return stripeChargeId;
    }

    public String getStripeCustomerIdCharged() {
        return stripeCustomerIdCharged;
    }

    public String getStripeBalanceTransactionId() {
        return stripeBalanceTransactionId;
    }

    public Instant getTimePaid() {
        return timePaid;
    }

    public CardSummary getPaymentInfo() {
        return paymentInfo;
    }

    public String getStripeRefundId() {
        return stripeRefundId;
    }

    public String getCouponCode() {
        return couponCode;
    }

    public BigDecimal getReferralGallonsUsed() {
        return referralGallonsUsed;
    }

    public String getAddressStreet() {
        return addressStreet;
    }

    public String getAddressCity() {
        return addressCity;
    }

    public String getAddressState() {
        return addressState;
    }

    public String getAddressZip() {
        return addressZip;
    }

    public Double getLat() {
        return lat;
    }

    public Double getLng() {
        return lng;
    }

    public Instant getTargetTimeStart() {
        return targetTimeStart;
    }

    public Instant getTargetTimeEnd() {
        return targetTimeEnd;
    }

    public List<StatusChange> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", status=" + status +
                ", userId=" + userId +
                ", courierId=" + courierId +
                ", totalPrice=" + totalPrice +
                ", paid=" + paid +
                '}';
    }

    /**
     * Builder used by the persistence mapper and by tests.
     */
    public static final class Builder {

        private OrderId orderId;
        private OrderStatus status = OrderStatus.UNASSIGNED;
        private String userId;
        private String courierId;
        private String vehicleId;
        private String licensePlate;
        private Money totalPrice;
        private Money gasPrice;
        private Money serviceFee;
        private BigDecimal gallons;
        private String gasType;
        private boolean tirePressureCheck;
        private boolean paid;
        private String stripeChargeId;
        private String stripeCustomerIdCharged;
        private String stripeBalanceTransactionId;
        private Instant timePaid;
        private CardSummary paymentInfo;
        private String stripeRefundId;
        private String couponCode;
        private BigDecimal referralGallonsUsed;
        private String addressStreet;
        private String addressCity;
        private String addressState;
        private String addressZip;
        private Double lat;
        private Double lng;
        private Instant targetTimeStart;
        private Instant targetTimeEnd;
        private final List<StatusChange> statusHistory = new ArrayList<>();

        private Builder() {
        }

        public Builder orderId(OrderId orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder status(OrderStatus status) {
            this.status = status;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder courierId(String courierId) {
            this.courierId = courierId;
            return this;
        }

        public Builder vehicleId(String vehicleId) {
            this.vehicleId = vehicleId;
            return this;
        }

        public Builder licensePlate(String licensePlate) {
            this.licensePlate = licensePlate;
            return this;
        }

        public Builder totalPrice(Money totalPrice) {
            this.totalPrice = totalPrice;
            return this;
        }

        public Builder gasPrice(Money gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder serviceFee(Money serviceFee) {
            this.serviceFee = serviceFee;
            return this;
        }

        public Builder gallons(BigDecimal gallons) {
            this.gallons = gallons;
            return this;
        }

        public Builder gasType(String gasType) {
            this.gasType = gasType;
            return this;
        }

        public Builder tirePressureCheck(boolean tirePressureCheck) {
            this.tirePressureCheck = tirePressureCheck;
            return this;
        }

        public Builder paid(boolean paid) {
            this.paid = paid;
            return this;
        }

        public Builder stripeChargeId(String stripeChargeId) {
            this.stripeChargeId = stripeChargeId;
            return this;
        }

        public Builder stripeCustomerIdCharged(String stripeCustomerIdCharged) {
            this.stripeCustomerIdCharged = stripeCustomerIdCharged;
            return this;
        }

        public Builder stripeBalanceTransactionId(String stripeBalanceTransactionId) {
            this.stripeBalanceTransactionId = stripeBalanceTransactionId;
            return this;
        }

        public Builder timePaid(Instant timePaid) {
            this.timePaid = timePaid;
            return this;
        }

        public Builder paymentInfo(CardSummary paymentInfo) {
            this.paymentInfo = paymentInfo;
            return this;
        }

        public Builder stripeRefundId(String stripeRefundId) {
            this.stripeRefundId = stripeRefundId;
            return this;
        }

        public Builder couponCode(String couponCode) {
            this.couponCode = couponCode;
            return this;
        }

        public Builder referralGallonsUsed(BigDecimal referralGallonsUsed) {
            this.referralGallonsUsed = referralGallonsUsed;
            return this;
        }

        public Builder addressStreet(String addressStreet) {
            this.addressStreet = addressStreet;
            return this;
        }

        public Builder addressCity(String addressCity) {
            this.addressCity = addressCity;
            return this;
        }

        public Builder addressState(String addressState) {
            this.addressState = addressState;
            return this;
        }

        public Builder addressZip(String addressZip) {
            this.addressZip = addressZip;
            return this;
        }

        public Builder lat(Double lat) {
            this.lat = lat;
            return this;
        }

        public Builder lng(Double lng) {
            this.lng = lng;
            return this;
        }

        public Builder targetTimeStart(Instant targetTimeStart) {
            this.targetTimeStart = targetTimeStart;
            return this;
        }

        public Builder targetTimeEnd(Instant targetTimeEnd) {
            this.targetTimeEnd = targetTimeEnd;
            return this;
        }

        public Builder statusHistory(List<StatusChange> history) {
            this.statusHistory.clear();
            this.statusHistory.addAll(history);
            return this;
        }

        public Order build() {
            return new Order(this);
        }
    }
}
