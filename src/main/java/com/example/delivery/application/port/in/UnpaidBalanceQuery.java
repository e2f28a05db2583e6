package com.example.delivery.application.port.in;

import com.example.delivery.domain.model.Money;

/**
 * Inbound port for a customer's outstanding balance.
 */
public interface UnpaidBalanceQuery {

    /**
     * Sum of totals over the user's complete, unpaid orders with a positive total.
     */
    Money unpaidBalance(String userId);
}
