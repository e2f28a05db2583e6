package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;

/**
 * Customer and courier accounts. Only the columns the order lifecycle reads or writes are mapped.
 */
@Entity
@Table(name = "users")
public class UserAccountEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", length = 128)
    private String name;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(name = "referral_code", length = 64, unique = true)
    private String referralCode;

    @Column(name = "referral_gallons", precision = 10, scale = 3, nullable = false)
    private BigDecimal referralGallons = BigDecimal.ZERO;

    @Column(name = "account_manager_id", length = 64)
    private String accountManagerId;

    @Column(name = "supports_rich_text")
    private boolean supportsRichText;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public String getReferralCode() {
        return referralCode;
    }

    public void setReferralCode(String referralCode) {
        this.referralCode = referralCode;
    }

    public BigDecimal getReferralGallons() {
        return referralGallons;
    }

    public void setReferralGallons(BigDecimal referralGallons) {
        this.referralGallons = referralGallons;
    }

    public String getAccountManagerId() {
        return accountManagerId;
    }

    public void setAccountManagerId(String accountManagerId) {
        this.accountManagerId = accountManagerId;
    }

    public boolean isSupportsRichText() {
        return supportsRichText;
    }

    public void setSupportsRichText(boolean supportsRichText) {
        this.supportsRichText = supportsRichText;
    }
}
