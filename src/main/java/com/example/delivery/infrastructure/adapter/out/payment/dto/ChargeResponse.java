package com.example.delivery.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Charge object returned by the gateway. {@code paid} is read but not used for the order's paid flag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChargeResponse(
        String id,
        boolean captured,
        boolean paid,
        String customer,
        @JsonProperty("balance_transaction") String balanceTransaction,
        Long created,
        CardSource source
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CardSource(
            String id,
            String brand,
            @JsonProperty("exp_month") Integer expMonth,
            @JsonProperty("exp_year") Integer expYear,
            String last4
    ) {
    }
}
