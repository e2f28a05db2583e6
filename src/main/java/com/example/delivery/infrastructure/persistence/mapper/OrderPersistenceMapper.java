package com.example.delivery.infrastructure.persistence.mapper;

import com.example.delivery.domain.model.*;
import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEventEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    private final ObjectMapper objectMapper;

    public OrderPersistenceMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Order toDomain(OrderEntity entity, List<OrderStatusEventEntity> events) {
        List<StatusChange> history = events.stream()
                .map(event -> new StatusChange(toDomainStatus(event.getStatus()), event.getOccurredAt()))
                .toList();

        return Order.builder()
                .orderId(OrderId.of(entity.getId()))
                .status(toDomainStatus(entity.getStatus()))
                .userId(entity.getUserId())
                .courierId(entity.getCourierId())
                .vehicleId(entity.getVehicleId())
                .licensePlate(entity.getLicensePlate())
                .totalPrice(Money.ofCents(entity.getTotalPrice()))
                .gasPrice(Money.ofCents(entity.getGasPrice()))
                .serviceFee(Money.ofCents(entity.getServiceFee()))
                .gallons(entity.getGallons())
                .gasType(entity.getGasType())
                .tirePressureCheck(entity.isTirePressureCheck())
                .paid(entity.isPaid())
                .stripeChargeId(entity.getStripeChargeId())
                .stripeCustomerIdCharged(entity.getStripeCustomerIdCharged())
                .stripeBalanceTransactionId(entity.getStripeBalanceTransactionId())
                .timePaid(entity.getTimePaid())
                .paymentInfo(readCard(entity.getPaymentInfo()))
                .stripeRefundId(entity.getStripeRefundId())
                .couponCode(entity.getCouponCode())
                .referralGallonsUsed(entity.getReferralGallonsUsed())
                .addressStreet(entity.getAddressStreet())
                .addressCity(entity.getAddressCity())
                .addressState(entity.getAddressState())
                .addressZip(entity.getAddressZip())
                .lat(entity.getLat())
                .lng(entity.getLng())
                .targetTimeStart(entity.getTargetTimeStart())
                .targetTimeEnd(entity.getTargetTimeEnd())
                .statusHistory(history)
                .build();
    }

    /**
     * Applies a gateway capture to the entity. {@code paid} follows the capture flag.
     */
    public void applyCapture(OrderEntity entity, ChargeCapture capture) {
        entity.setPaid(capture.captured());
        entity.setStripeChargeId(capture.chargeId());
        entity.setStripeCustomerIdCharged(capture.customerId());
        entity.setStripeBalanceTransactionId(capture.balanceTransactionId());
        entity.setTimePaid(capture.capturedAt());
        entity.setPaymentInfo(writeCard(capture.card()));
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case UNASSIGNED -> OrderStatusEnum.UNASSIGNED;
            case ASSIGNED -> OrderStatusEnum.ASSIGNED;
            case ACCEPTED -> OrderStatusEnum.ACCEPTED;
            case ENROUTE -> OrderStatusEnum.ENROUTE;
            case SERVICING -> OrderStatusEnum.SERVICING;
            case COMPLETE -> OrderStatusEnum.COMPLETE;
            case CANCELLED -> OrderStatusEnum.CANCELLED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case UNASSIGNED -> OrderStatus.UNASSIGNED;
            case ASSIGNED -> OrderStatus.ASSIGNED;
            case ACCEPTED -> OrderStatus.ACCEPTED;
            case ENROUTE -> OrderStatus.ENROUTE;
            case SERVICING -> OrderStatus.SERVICING;
            case COMPLETE -> OrderStatus.COMPLETE;
            case CANCELLED -> OrderStatus.CANCELLED;
        };
    }

    String writeCard(CardSummary card) {
        if (card == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(new StoredCard(
                    card.id(), card.brand(), card.expMonth(), card.expYear(), card.last4()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize card summary " + card.id(), e);
        }
    }

    CardSummary readCard(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            StoredCard stored = objectMapper.readValue(json, StoredCard.class);
            return new CardSummary(stored.id(), stored.brand(), stored.expMonth(), stored.expYear(), stored.last4());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payment_info column: " + json, e);
        }
    }

    /**
     * Column format of {@code payment_info}, matching the gateway's card fields.
     */
    private record StoredCard(
            @JsonProperty("id") String id,
            @JsonProperty("brand") String brand,
            @JsonProperty("exp_month") Integer expMonth,
            @JsonProperty("exp_year") Integer expYear,
            @JsonProperty("last4") String last4
    ) {
    }
}
