package com.example.delivery.application.service;

import com.example.delivery.domain.model.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the standard property bag attached to every order analytics event.
 */
@Component
public class OrderTrackingProperties {

    private final MarketResolver marketResolver;

    public OrderTrackingProperties(MarketResolver marketResolver) {
        this.marketResolver = marketResolver;
    }

    /**
     * Standard order properties. Prices are in major currency units; target times are ISO-8601.
     */
    public Map<String, Object> standard(Order order) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("vehicle_id", order.getVehicleId());
        properties.put("gallons", order.getGallons().doubleValue());
        properties.put("gas_type", order.getGasType());
        properties.put("lat", order.getLat());
        properties.put("lng", order.getLng());
        properties.put("address_street", order.getAddressStreet());
        properties.put("address_city", order.getAddressCity());
        properties.put("address_state", order.getAddressState());
        properties.put("address_zip", order.getAddressZip());
        properties.put("license_plate", order.getLicensePlate());
        properties.put("coupon_code", order.getCouponCode());
        properties.put("referral_gallons_used", order.getReferralGallonsUsed().doubleValue());
        properties.put("tire_pressure_check", order.isTirePressureCheck());
        properties.put("order_id", order.getOrderId().getValue());
        properties.put("gas_price", order.getGasPrice().toMajorUnits().doubleValue());
        properties.put("service_fee", order.getServiceFee().toMajorUnits().doubleValue());
        properties.put("total_price", order.getTotalPrice().toMajorUnits().doubleValue());
        properties.put("target_time_start", isoOrNull(order.getTargetTimeStart()));
        properties.put("target_time_end", isoOrNull(order.getTargetTimeEnd()));
        properties.put("market_id", marketResolver.marketIdFor(order.getAddressZip()));
        return properties;
    }

    /**
     * Standard properties plus {@code revenue}, the total in major units.
     */
    public Map<String, Object> withRevenue(Order order) {
        Map<String, Object> properties = standard(order);
        properties.put("revenue", order.getTotalPrice().toMajorUnits().doubleValue());
        return properties;
    }

    private static String isoOrNull(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
