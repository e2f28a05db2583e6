package com.example.delivery.application.dto;

import com.example.delivery.application.port.out.UserDirectoryPort.UserAccount;

import java.math.BigDecimal;

/**
 * Customer profile returned to the customer app after a cancellation.
 */
public record CustomerDetails(
        String userId,
        String name,
        String email,
        String phoneNumber,
        String referralCode,
        BigDecimal referralGallons
) {
    public static CustomerDetails from(UserAccount account) {
        return new CustomerDetails(
                account.id(),
                account.name(),
                account.email(),
                account.phoneNumber(),
                account.referralCode(),
                account.referralGallons());
    }
}
