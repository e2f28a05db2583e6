package com.example.delivery.application.service;

import com.example.delivery.application.port.in.UnpaidBalanceQuery;
import com.example.delivery.domain.model.Money;
import com.example.delivery.domain.model.Order;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats the text message a courier receives when an order is assigned to them.
 */
@Component
public class CourierOrderSummaryFormatter {

    private final UnpaidBalanceQuery unpaidBalanceQuery;
    private final DateTimeFormatter dueFormatter;

    public CourierOrderSummaryFormatter(
            UnpaidBalanceQuery unpaidBalanceQuery,
            @Value("${delivery.time-zone:America/Los_Angeles}") String timeZone) {
        this.unpaidBalanceQuery = unpaidBalanceQuery;
        this.dueFormatter = DateTimeFormatter.ofPattern("EEE M/d h:mm a", Locale.US).withZone(ZoneId.of(timeZone));
    }

    public String format(Order order, boolean chargeAuthorized) {
        StringBuilder text = new StringBuilder("New order:");
        text.append(chargeAuthorized ? "\nCharge Authorized." : "\n!CHARGE FAILED TO AUTHORIZE!");

        Money unpaid = unpaidBalanceQuery.unpaidBalance(order.getUserId());
        if (unpaid.isPositive()) {
            text.append("\n!UNPAID BALANCE: $").append(unpaid.toMajorUnitsString());
        }

        text.append("\nDue: ")
                .append(order.getTargetTimeEnd() != null ? dueFormatter.format(order.getTargetTimeEnd()) : "-")
                .append('\n').append(order.getAddressStreet()).append(", ").append(order.getAddressZip())
                .append('\n').append(order.getGallons().stripTrailingZeros().toPlainString())
                .append(" Gallons of ").append(order.getGasType());
        return text.toString();
    }
}
