package com.example.delivery.application.service;

import com.example.delivery.application.port.in.UnpaidBalanceQuery;
import com.example.delivery.application.port.out.OrderStorePort;
import com.example.delivery.domain.model.Money;
import org.springframework.stereotype.Service;

@Service
public class UnpaidBalanceService implements UnpaidBalanceQuery {

    private final OrderStorePort orderStore;

    public UnpaidBalanceService(OrderStorePort orderStore) {
        this.orderStore = orderStore;
    }

    @Override
    public Money unpaidBalance(String userId) {
        return orderStore.unpaidBalance(userId);
    }
}
