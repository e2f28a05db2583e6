package com.example.delivery.application.port.out;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outbound port for reading customer accounts.
 */
public interface UserDirectoryPort {

    Optional<UserAccount> findById(String userId);

    /**
     * Resolves the owner of a referral code, if the code is one.
     */
    Optional<String> findUserIdByReferralCode(String referralCode);

    /**
     * Read model of a customer account.
     *
     * @param managedAccount   true for accounts run by an account manager (fleet/operator accounts)
     * @param supportsRichText true when the user's device renders emoji in push messages
     */
    record UserAccount(
            String id,
            String name,
            String email,
            String phoneNumber,
            String referralCode,
            BigDecimal referralGallons,
            boolean managedAccount,
            boolean supportsRichText
    ) {
    }
}
