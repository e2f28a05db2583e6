package com.example.delivery.infrastructure.persistence;

import com.example.delivery.application.port.out.ReferralGallonsPort;
import com.example.delivery.application.port.out.UserDirectoryPort;
import com.example.delivery.infrastructure.persistence.entity.UserAccountEntity;
import com.example.delivery.infrastructure.persistence.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * User accounts and their referral gallons ledger.
 */
@Component
public class UserAccountPersistenceAdapter implements UserDirectoryPort, ReferralGallonsPort {

    private static final Logger log = LoggerFactory.getLogger(UserAccountPersistenceAdapter.class);

    private final UserAccountRepository userRepository;

    public UserAccountPersistenceAdapter(UserAccountRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(String userId) {
        return userRepository.findById(userId).map(UserAccountPersistenceAdapter::toAccount);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findUserIdByReferralCode(String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findByReferralCode(referralCode).map(UserAccountEntity::getId);
    }

    @Override
    @Transactional
    public void credit(String userId, BigDecimal gallons) {
        requireUpdated(userRepository.addReferralGallons(userId, gallons), userId);
        log.debug("Credited {} referral gallons to {}", gallons, userId);
    }

    private static void requireUpdated(int rows, String userId) {
        if (rows == 0) {
            throw new IllegalStateException("Unknown user: " + userId);
        }
    }

    private static UserAccount toAccount(UserAccountEntity entity) {
        return new UserAccount(
                entity.getId(),
                entity.getName(),
                entity.getEmail(),
                entity.getPhoneNumber(),
                entity.getReferralCode(),
                entity.getReferralGallons(),
                entity.getAccountManagerId() != null && !entity.getAccountManagerId().isBlank(),
                entity.isSupportsRichText());
    }
}
