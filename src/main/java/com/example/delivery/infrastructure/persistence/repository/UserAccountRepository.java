package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.UserAccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * JPA Repository for user accounts. Gallon credits are single UPDATE statements so
 * concurrent credits never lose an increment.
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccountEntity, String> {

    Optional<UserAccountEntity> findByReferralCode(String referralCode);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserAccountEntity u SET u.referralGallons = u.referralGallons + :gallons WHERE u.id = :id")
    int addReferralGallons(@Param("id") String id, @Param("gallons") BigDecimal gallons);
}
